package ch.so.arp.finrag.orchestration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One frame of the answer stream. On the wire a frame is a flat JSON object
 * whose {@code type} key is followed by the frame's fields.
 */
public record StreamEvent(EventType type, Map<String, Object> fields) {

    public StreamEvent {
        Objects.requireNonNull(type, "type");
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static StreamEvent metadata(String requestId, Map<String, String> dataFreshness) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("requestId", requestId);
        fields.put("dataFreshness", dataFreshness);
        return new StreamEvent(EventType.METADATA, fields);
    }

    public static StreamEvent status(String message) {
        return new StreamEvent(EventType.STATUS, Map.of("message", message));
    }

    public static StreamEvent status(String message, Map<String, Object> details) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("message", message);
        fields.putAll(details);
        return new StreamEvent(EventType.STATUS, fields);
    }

    public static StreamEvent toolStart(String tool, String id, JsonNode input) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("tool", tool);
        fields.put("id", id);
        fields.put("input", input);
        return new StreamEvent(EventType.TOOL_START, fields);
    }

    public static StreamEvent toolResult(String tool, String id, boolean success, Object result, String error,
            long latencyMs) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("tool", tool);
        fields.put("id", id);
        fields.put("success", success);
        fields.put("result", result);
        fields.put("error", error);
        fields.put("latencyMs", latencyMs);
        return new StreamEvent(EventType.TOOL_RESULT, fields);
    }

    public static StreamEvent content(String text) {
        return new StreamEvent(EventType.CONTENT, Map.of("content", text));
    }

    public static StreamEvent metrics(Map<String, Object> metrics) {
        return new StreamEvent(EventType.METRICS, metrics);
    }

    public static StreamEvent end(String requestId) {
        return new StreamEvent(EventType.END, Map.of("requestId", requestId));
    }

    public static StreamEvent error(String message) {
        return new StreamEvent(EventType.ERROR, Map.of("error", message == null ? "Unknown error" : message));
    }

    /**
     * Flat representation written to the client. Null values are dropped.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type.wireName());
        fields.forEach((key, value) -> {
            if (value != null) {
                map.put(key, value);
            }
        });
        return map;
    }

    public String text() {
        Object content = fields.get("content");
        return content == null ? "" : content.toString();
    }
}
