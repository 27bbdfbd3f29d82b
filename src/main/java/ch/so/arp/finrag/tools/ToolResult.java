package ch.so.arp.finrag.tools;

import java.util.Map;

import ch.so.arp.finrag.llm.ToolResultBlock;

/**
 * Outcome of one tool call, successful or not.
 */
public record ToolResult(
        String toolName,
        boolean success,
        Map<String, Object> payload,
        String summary,
        String error,
        int evidenceCount,
        long latencyMs) {

    public static ToolResult success(String toolName, ToolOutput output, long latencyMs) {
        return new ToolResult(toolName, true, output.payload(), output.summary(), null, output.evidenceCount(),
                latencyMs);
    }

    public static ToolResult failure(String toolName, String error, long latencyMs) {
        return new ToolResult(toolName, false, Map.of(), "", error == null ? "unknown error" : error, 0, latencyMs);
    }

    /**
     * Content block fed back to the planner for the given invocation.
     */
    public ToolResultBlock toResultBlock(String toolUseId) {
        return new ToolResultBlock(toolUseId, success ? summary : "Tool failed: " + error, !success);
    }
}
