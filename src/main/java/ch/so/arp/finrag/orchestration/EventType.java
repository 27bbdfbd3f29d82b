package ch.so.arp.finrag.orchestration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Frame types of the answer stream. {@link #END} and {@link #ERROR} close the
 * stream.
 */
public enum EventType {
    METADATA("metadata"),
    STATUS("status"),
    TOOL_START("tool_start"),
    TOOL_RESULT("tool_result"),
    CONTENT("content"),
    METRICS("metrics"),
    END("end"),
    ERROR("error");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == END || this == ERROR;
    }
}
