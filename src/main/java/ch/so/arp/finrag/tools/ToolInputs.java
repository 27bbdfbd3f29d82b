package ch.so.arp.finrag.tools;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.fasterxml.jackson.databind.JsonNode;

import ch.so.arp.finrag.financials.FinancialMetric;

/**
 * Reads and validates tool inputs. Invalid input raises
 * {@link IllegalArgumentException}, which is reported back to the planner.
 */
final class ToolInputs {

    private ToolInputs() {
    }

    static String requireText(JsonNode input, String field, String toolName) {
        String value = optionalText(input, field);
        if (value == null) {
            throw new IllegalArgumentException("Missing required input '" + field + "' for " + toolName);
        }
        return value;
    }

    static String optionalText(JsonNode input, String field) {
        JsonNode value = input.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    static String ticker(JsonNode input, ToolContext context, String toolName) {
        String ticker = optionalText(input, "ticker");
        if (ticker == null && context.tickers().size() == 1) {
            ticker = context.tickers().get(0);
        }
        if (ticker == null) {
            throw new IllegalArgumentException("Missing required input 'ticker' for " + toolName);
        }
        return ticker.toUpperCase(Locale.ROOT);
    }

    static boolean isLatest(String fiscalYear) {
        if (fiscalYear == null) {
            return true;
        }
        String normalized = fiscalYear.toLowerCase(Locale.ROOT);
        return normalized.equals("latest") || normalized.equals("most recent") || normalized.equals("current");
    }

    static List<FinancialMetric> metrics(JsonNode input, String toolName) {
        JsonNode node = input.get("metrics");
        if (node == null || !node.isArray() || node.isEmpty()) {
            throw new IllegalArgumentException("Missing required input 'metrics' for " + toolName);
        }
        List<FinancialMetric> metrics = new ArrayList<>();
        for (JsonNode value : node) {
            FinancialMetric metric = FinancialMetric.fromWireName(value.asText())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown metric: " + value.asText()));
            if (!metrics.contains(metric)) {
                metrics.add(metric);
            }
        }
        return metrics;
    }
}
