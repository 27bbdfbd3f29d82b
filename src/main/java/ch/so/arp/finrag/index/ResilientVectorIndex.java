package ch.so.arp.finrag.index;

import java.util.List;
import java.util.Objects;

import ch.so.arp.finrag.resilience.ResilientCallExecutor;

/**
 * Routes index queries through the shared {@link ResilientCallExecutor}.
 */
class ResilientVectorIndex implements VectorIndex {

    static final String DEPENDENCY = "vector-index";

    private final VectorIndex delegate;
    private final ResilientCallExecutor executor;

    ResilientVectorIndex(VectorIndex delegate, ResilientCallExecutor executor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public List<ScoredChunk> query(IndexQuery query) {
        return executor.call(DEPENDENCY, () -> delegate.query(query));
    }

    @Override
    public boolean supportsHybrid() {
        return delegate.supportsHybrid();
    }
}
