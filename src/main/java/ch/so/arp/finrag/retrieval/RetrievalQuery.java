package ch.so.arp.finrag.retrieval;

import java.util.List;
import java.util.Objects;

/**
 * Immutable retrieval request.
 *
 * @param text     raw query text
 * @param strategy explicit strategy, {@code null} for the configured default
 * @param tickers  ticker hints, possibly empty
 */
public record RetrievalQuery(String text, StrategyType strategy, List<String> tickers) {

    public RetrievalQuery {
        Objects.requireNonNull(text, "text");
        tickers = tickers == null ? List.of() : List.copyOf(tickers);
    }

    public static RetrievalQuery of(String text) {
        return new RetrievalQuery(text, null, List.of());
    }

    public static RetrievalQuery of(String text, StrategyType strategy) {
        return new RetrievalQuery(text, strategy, List.of());
    }
}
