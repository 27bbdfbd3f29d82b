package ch.so.arp.finrag.retrieval;

import ch.so.arp.finrag.index.MetadataFilter;

/**
 * Retrieval algorithm. Implementations are stateless; they fail only when an
 * upstream service fails after the resilience guards gave up.
 */
public interface RetrievalStrategy {

    StrategyType type();

    /**
     * Retrieve the best matching chunks.
     *
     * @param query  query text and hints
     * @param topK   maximum number of chunks
     * @param filter metadata filter applied by the index
     * @return ranked chunks, best first
     */
    RetrievalResult retrieve(RetrievalQuery query, int topK, MetadataFilter filter);
}
