package ch.so.arp.finrag.llm;

import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Tool declaration with a JSON schema describing its input.
 */
public record ToolDefinition(String name, String description, JsonNode inputSchema) {

    public ToolDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(inputSchema, "inputSchema");
    }
}
