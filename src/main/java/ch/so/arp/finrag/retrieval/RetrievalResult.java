package ch.so.arp.finrag.retrieval;

import java.util.List;

/**
 * Ranked chunks returned by a strategy, best first.
 *
 * @param strategy             strategy that produced the chunks
 * @param autoSelected         whether the strategy was chosen by the
 *                             classifier
 * @param chunks               ranked chunks
 * @param queryVariants        queries searched by multi-query retrieval, empty
 *                             otherwise
 * @param hypotheticalDocument text embedded by HyDE, {@code null} otherwise
 */
public record RetrievalResult(
        StrategyType strategy,
        boolean autoSelected,
        List<RankedChunk> chunks,
        List<String> queryVariants,
        String hypotheticalDocument) {

    public RetrievalResult {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
        queryVariants = queryVariants == null ? List.of() : List.copyOf(queryVariants);
    }

    public static RetrievalResult of(StrategyType strategy, List<RankedChunk> chunks) {
        return new RetrievalResult(strategy, false, chunks, List.of(), null);
    }

    RetrievalResult withAutoSelected() {
        return new RetrievalResult(strategy, true, chunks, queryVariants, hypotheticalDocument);
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }
}
