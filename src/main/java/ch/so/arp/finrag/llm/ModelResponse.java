package ch.so.arp.finrag.llm;

import java.util.List;

/**
 * Completion returned by the model: text, requested tool invocations or both.
 */
public record ModelResponse(String text, List<ToolUse> toolUses, TokenUsage usage, String stopReason) {

    public ModelResponse {
        text = text == null ? "" : text;
        toolUses = toolUses == null ? List.of() : List.copyOf(toolUses);
        usage = usage == null ? TokenUsage.empty() : usage;
    }

    public static ModelResponse text(String text) {
        return new ModelResponse(text, List.of(), TokenUsage.empty(), "end_turn");
    }

    public static ModelResponse toolUses(List<ToolUse> toolUses) {
        return new ModelResponse("", toolUses, TokenUsage.empty(), "tool_use");
    }

    public boolean hasToolUses() {
        return !toolUses.isEmpty();
    }
}
