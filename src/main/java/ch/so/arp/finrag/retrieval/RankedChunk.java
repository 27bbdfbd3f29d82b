package ch.so.arp.finrag.retrieval;

import ch.so.arp.finrag.index.Chunk;

/**
 * Retrieved chunk with its strategy-local score. Scores of different
 * strategies are not comparable: cosine for dense, weighted sum for hybrid,
 * reciprocal-rank sum for fused results.
 */
public record RankedChunk(Chunk chunk, double score, StrategyType origin) {
}
