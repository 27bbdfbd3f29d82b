package ch.so.arp.finrag.retrieval;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Retrieval strategies. {@link #AUTO} is resolved to one of the others by the
 * {@link StrategyClassifier}.
 */
public enum StrategyType {
    DENSE("dense-only"),
    HYBRID("hybrid-bm25"),
    HYDE("hyde"),
    MULTI_QUERY("multi-query"),
    AUTO("auto");

    private final String wireName;

    StrategyType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Parse a strategy from its wire name ({@code hybrid-bm25}) or its short
     * name ({@code hybrid}), ignoring case.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    @JsonCreator
    public static StrategyType fromWireName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        for (StrategyType type : values()) {
            if (type.wireName.equals(normalized)
                    || type.name().toLowerCase(Locale.ROOT).replace('_', '-').equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown retrieval strategy: " + name);
    }
}
