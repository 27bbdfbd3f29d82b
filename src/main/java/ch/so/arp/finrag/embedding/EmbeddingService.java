package ch.so.arp.finrag.embedding;

/**
 * Computes dense embeddings. Implementations either call a remote embedding API
 * or provide deterministic vectors suited for tests and local development.
 */
public interface EmbeddingService {

    /**
     * Create an embedding vector for the provided text.
     *
     * @param text the text to embed
     * @param kind whether the text is a query or a document
     * @return the embedding represented as a float array of fixed length
     */
    float[] embed(String text, EmbeddingKind kind);
}
