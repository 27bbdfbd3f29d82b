package ch.so.arp.finrag.tools;

import java.util.Map;
import java.util.Objects;

/**
 * Output of a successful tool execution.
 *
 * @param payload       structured data, sent to the client in the
 *                      {@code tool_result} frame
 * @param summary       compact text fed back to the planner
 * @param evidenceCount number of retrieved chunks, zero for tools that do
 *                      not retrieve
 */
public record ToolOutput(Map<String, Object> payload, String summary, int evidenceCount) {

    public ToolOutput {
        Objects.requireNonNull(payload, "payload");
        summary = summary == null ? "" : summary;
    }

    public static ToolOutput of(Map<String, Object> payload, String summary) {
        return new ToolOutput(payload, summary, 0);
    }
}
