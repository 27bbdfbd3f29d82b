package ch.so.arp.finrag.llm;

import java.util.Objects;

/**
 * Result of a tool execution as it is fed back to the model.
 */
public record ToolResultBlock(String toolUseId, String content, boolean isError) {

    public ToolResultBlock {
        Objects.requireNonNull(toolUseId, "toolUseId");
        content = content == null ? "" : content;
    }
}
