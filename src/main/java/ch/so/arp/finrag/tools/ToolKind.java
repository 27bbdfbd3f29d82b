package ch.so.arp.finrag.tools;

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of tools the planner can call.
 */
public enum ToolKind {
    FETCH_METRIC("get_financial_metrics"),
    FETCH_MULTI_PERIOD("get_multi_quarter_metrics"),
    COMPUTE_GROWTH("compute_growth_rate"),
    SEARCH_TRANSCRIPTS("search_earnings_transcript"),
    LIST_AVAILABLE_DATA("list_available_data");

    private final String wireName;

    ToolKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ToolKind> fromWireName(String name) {
        return Arrays.stream(values()).filter(kind -> kind.wireName.equals(name)).findFirst();
    }
}
