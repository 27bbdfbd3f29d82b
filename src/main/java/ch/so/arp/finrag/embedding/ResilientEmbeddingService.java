package ch.so.arp.finrag.embedding;

import java.util.Objects;

import ch.so.arp.finrag.resilience.ResilientCallExecutor;

/**
 * Routes every embedding call through the shared {@link ResilientCallExecutor}.
 */
class ResilientEmbeddingService implements EmbeddingService {

    static final String DEPENDENCY = "embedding";

    private final EmbeddingService delegate;
    private final ResilientCallExecutor executor;

    ResilientEmbeddingService(EmbeddingService delegate, ResilientCallExecutor executor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public float[] embed(String text, EmbeddingKind kind) {
        return executor.call(DEPENDENCY, () -> delegate.embed(text, kind));
    }
}
