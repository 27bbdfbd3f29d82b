package ch.so.arp.finrag.tools;

import java.util.Collection;
import java.util.List;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ch.so.arp.finrag.financials.FinancialMetric;
import ch.so.arp.finrag.financials.TickerAliases;

/**
 * Small builder for the JSON schemas of the tool inputs.
 */
final class ToolSchemas {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    static final List<String> QUARTERS = List.of("Q1", "Q2", "Q3", "Q4");

    private ToolSchemas() {
    }

    static ObjectNode object(List<String> required) {
        ObjectNode schema = NODES.objectNode();
        schema.put("type", "object");
        schema.putObject("properties");
        ArrayNode requiredNode = schema.putArray("required");
        required.forEach(requiredNode::add);
        return schema;
    }

    static ObjectNode property(ObjectNode schema, String name, ObjectNode property) {
        ((ObjectNode) schema.get("properties")).set(name, property);
        return schema;
    }

    static ObjectNode string(String description) {
        ObjectNode node = NODES.objectNode();
        node.put("type", "string");
        if (description != null) {
            node.put("description", description);
        }
        return node;
    }

    static ObjectNode enumeration(Collection<String> values, String description) {
        ObjectNode node = string(description);
        ArrayNode options = node.putArray("enum");
        values.forEach(options::add);
        return node;
    }

    static ObjectNode integer(int minimum, int maximum, String description) {
        ObjectNode node = NODES.objectNode();
        node.put("type", "integer");
        node.put("minimum", minimum);
        node.put("maximum", maximum);
        node.put("description", description);
        return node;
    }

    static ObjectNode array(ObjectNode items, String description) {
        ObjectNode node = NODES.objectNode();
        node.put("type", "array");
        node.put("description", description);
        node.set("items", items);
        return node;
    }

    static ObjectNode ticker() {
        return enumeration(TickerAliases.knownTickers().stream().sorted().toList(), "Stock ticker symbol");
    }

    static ObjectNode quarter(String description) {
        return enumeration(QUARTERS, description);
    }

    static ObjectNode metric(boolean scalarOnly, String description) {
        return enumeration(FinancialMetric.wireNames(scalarOnly), description);
    }

    static ObjectNode period(List<String> required) {
        ObjectNode period = object(required);
        property(period, "fiscalYear", string("Fiscal year (e.g. \"2025\") or \"latest\" to auto-detect"));
        property(period, "quarter", quarter("Fiscal quarter"));
        return period;
    }
}
