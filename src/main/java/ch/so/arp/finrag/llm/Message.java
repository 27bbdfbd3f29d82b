package ch.so.arp.finrag.llm;

import java.util.List;
import java.util.Objects;

/**
 * One turn of the conversation sent to the model. Besides plain text an
 * assistant turn may carry tool invocations and a user turn may carry tool
 * results.
 */
public record Message(Role role, String text, List<ToolUse> toolUses, List<ToolResultBlock> toolResults) {

    public Message {
        Objects.requireNonNull(role, "role");
        text = text == null ? "" : text;
        toolUses = toolUses == null ? List.of() : List.copyOf(toolUses);
        toolResults = toolResults == null ? List.of() : List.copyOf(toolResults);
    }

    public static Message user(String text) {
        return new Message(Role.USER, text, List.of(), List.of());
    }

    public static Message assistant(String text) {
        return new Message(Role.ASSISTANT, text, List.of(), List.of());
    }

    public static Message assistant(String text, List<ToolUse> toolUses) {
        return new Message(Role.ASSISTANT, text, toolUses, List.of());
    }

    public static Message toolResults(List<ToolResultBlock> results) {
        return new Message(Role.USER, "", List.of(), results);
    }
}
