package ch.so.arp.finrag.embedding;

import java.util.Objects;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * Keeps recently computed embeddings so repeated queries (retries of the same
 * question, multi-query variants that coincide) do not hit the service again.
 */
class CachingEmbeddingService implements EmbeddingService {

    private final EmbeddingService delegate;
    private final Cache<CacheKey, float[]> cache;

    CachingEmbeddingService(EmbeddingService delegate, long maximumSize) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.cache = Caffeine.newBuilder().maximumSize(maximumSize).build();
    }

    @Override
    public float[] embed(String text, EmbeddingKind kind) {
        float[] vector = cache.get(new CacheKey(text, kind), key -> delegate.embed(key.text(), key.kind()));
        return vector.clone();
    }

    private record CacheKey(String text, EmbeddingKind kind) {
    }
}
