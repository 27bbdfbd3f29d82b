package ch.so.arp.finrag.index;

import java.util.List;

/**
 * Read side of the vector index holding the transcript chunks.
 */
public interface VectorIndex {

    /**
     * Query the index.
     *
     * @param query dense vector, optional sparse vector, top-K and filter
     * @return matches ordered by descending score
     */
    List<ScoredChunk> query(IndexQuery query);

    /**
     * Whether the index fuses dense and sparse scores itself. Callers fall
     * back to re-ranking dense results when it does not.
     */
    default boolean supportsHybrid() {
        return false;
    }
}
