package ch.so.arp.finrag.tools;

import java.util.List;

import ch.so.arp.finrag.retrieval.StrategyType;

/**
 * Request scoped information available to every tool.
 *
 * @param strategy retrieval strategy requested by the caller, {@code null}
 *                 for the configured default
 * @param tickers  tickers named in the question
 */
public record ToolContext(StrategyType strategy, List<String> tickers) {

    public ToolContext {
        tickers = tickers == null ? List.of() : List.copyOf(tickers);
    }

    public static ToolContext empty() {
        return new ToolContext(null, List.of());
    }
}
