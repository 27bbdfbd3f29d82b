package ch.so.arp.finrag.index;

/**
 * Chunk returned by an index together with the index's own similarity score.
 */
public record ScoredChunk(Chunk chunk, double score) {
}
