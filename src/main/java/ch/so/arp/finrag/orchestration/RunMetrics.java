package ch.so.arp.finrag.orchestration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ch.so.arp.finrag.tools.ToolResult;

/**
 * Timing and counters of one orchestrated request, reported in the
 * {@code metrics} frame.
 */
class RunMetrics {

    private final long startNanos;
    private long firstContentNanos = -1;
    private int plannerCalls;
    private int retrievalResults;
    private double avgRetrievalScore;
    private int contentLength;
    private final List<Map<String, Object>> toolBreakdown = new ArrayList<>();

    RunMetrics(long startNanos) {
        this.startNanos = startNanos;
    }

    void plannerCalled() {
        plannerCalls++;
    }

    int plannerCalls() {
        return plannerCalls;
    }

    void toolCompleted(ToolResult result) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("tool", result.toolName());
        entry.put("latencyMs", result.latencyMs());
        entry.put("success", result.success());
        toolBreakdown.add(entry);
        retrievalResults += result.evidenceCount();
        if (result.payload().get("results") instanceof List<?> results) {
            double sum = 0;
            int scored = 0;
            for (Object item : results) {
                if (item instanceof Map<?, ?> hit && hit.get("score") instanceof Number score
                        && score.doubleValue() > 0) {
                    sum += score.doubleValue();
                    scored++;
                }
            }
            if (scored > 0) {
                avgRetrievalScore = sum / scored;
            }
        }
    }

    void contentEmitted(String text, long nowNanos) {
        if (text.isEmpty()) {
            return;
        }
        if (firstContentNanos < 0) {
            firstContentNanos = nowNanos;
        }
        contentLength += text.length();
    }

    boolean hasContent() {
        return contentLength > 0;
    }

    Map<String, Object> toFields(long nowNanos) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("totalTimeMs", millis(nowNanos - startNanos));
        fields.put("timeToFirstTokenMs", firstContentNanos < 0 ? null : millis(firstContentNanos - startNanos));
        fields.put("llmCalls", plannerCalls);
        fields.put("toolCalls", toolBreakdown.size());
        fields.put("toolBreakdown", List.copyOf(toolBreakdown));
        fields.put("retrievalResults", retrievalResults);
        fields.put("avgRetrievalScore", avgRetrievalScore);
        fields.put("estimatedTokens", (contentLength + 3) / 4);
        return fields;
    }

    private static long millis(long nanos) {
        return nanos / 1_000_000L;
    }
}
