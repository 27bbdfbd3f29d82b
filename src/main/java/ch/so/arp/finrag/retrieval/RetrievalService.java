package ch.so.arp.finrag.retrieval;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.finrag.index.MetadataFilter;

/**
 * Entry point for retrieval. Resolves the requested (or default) strategy,
 * asks the {@link StrategyClassifier} when it is {@link StrategyType#AUTO}
 * and delegates.
 */
public class RetrievalService {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetrievalService.class);

    private final Map<StrategyType, RetrievalStrategy> strategies = new EnumMap<>(StrategyType.class);
    private final StrategyClassifier classifier;
    private final StrategyType defaultStrategy;
    private final int defaultTopK;

    public RetrievalService(Collection<RetrievalStrategy> strategies, StrategyClassifier classifier,
            StrategyType defaultStrategy, int defaultTopK) {
        for (RetrievalStrategy strategy : strategies) {
            if (strategy.type() == StrategyType.AUTO) {
                throw new IllegalArgumentException("AUTO is resolved by the classifier, not by a strategy");
            }
            this.strategies.put(strategy.type(), strategy);
        }
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.defaultStrategy = defaultStrategy == null ? StrategyType.AUTO : defaultStrategy;
        this.defaultTopK = defaultTopK;
    }

    public RetrievalResult retrieve(RetrievalQuery query) {
        return retrieve(query, defaultTopK, MetadataFilter.none());
    }

    /**
     * Retrieve chunks for the query.
     *
     * @param query  query text, strategy directive and ticker hints; a single
     *               ticker hint restricts an otherwise empty filter to that
     *               ticker
     * @param topK   maximum number of chunks, the default when not positive
     * @param filter metadata filter
     */
    public RetrievalResult retrieve(RetrievalQuery query, int topK, MetadataFilter filter) {
        int limit = topK > 0 ? topK : defaultTopK;
        MetadataFilter effectiveFilter = filter == null ? MetadataFilter.none() : filter;
        if (effectiveFilter.isEmpty() && query.tickers().size() == 1) {
            effectiveFilter = MetadataFilter.forTicker(query.tickers().get(0));
        }

        StrategyType requested = query.strategy() != null ? query.strategy() : defaultStrategy;
        boolean auto = requested == StrategyType.AUTO;
        StrategyType type = auto ? classifier.classify(query.text()) : requested;
        RetrievalStrategy strategy = strategies.get(type);
        if (strategy == null) {
            throw new IllegalArgumentException("No retrieval strategy registered for " + type.wireName());
        }

        long start = System.nanoTime();
        RetrievalResult result = strategy.retrieve(query, limit, effectiveFilter);
        LOGGER.debug("{} retrieval{} returned {} chunks in {} ms (topK={}, filter={})", type.wireName(),
                auto ? " (auto)" : "", result.chunks().size(), (System.nanoTime() - start) / 1_000_000, limit,
                effectiveFilter);
        return auto ? result.withAutoSelected() : result;
    }

    public int defaultTopK() {
        return defaultTopK;
    }
}
