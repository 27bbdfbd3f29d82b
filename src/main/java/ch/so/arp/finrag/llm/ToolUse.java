package ch.so.arp.finrag.llm;

import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Tool invocation requested by the model.
 *
 * @param id    identifier the matching tool result must refer to
 * @param name  tool name as declared in the {@link ToolDefinition}
 * @param input structured input, an empty object if the model sent none
 */
public record ToolUse(String id, String name, JsonNode input) {

    public ToolUse {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        input = input == null || input.isNull() ? JsonNodeFactory.instance.objectNode() : input;
    }
}
