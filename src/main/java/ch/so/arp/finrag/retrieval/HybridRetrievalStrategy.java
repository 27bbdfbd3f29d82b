package ch.so.arp.finrag.retrieval;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.finrag.embedding.EmbeddingKind;
import ch.so.arp.finrag.embedding.EmbeddingService;
import ch.so.arp.finrag.index.IndexQuery;
import ch.so.arp.finrag.index.MetadataFilter;
import ch.so.arp.finrag.index.ScoredChunk;
import ch.so.arp.finrag.index.VectorIndex;
import ch.so.arp.finrag.sparse.SparseVector;
import ch.so.arp.finrag.sparse.SparseVectorizer;

/**
 * Dense plus keyword retrieval. Indices that fuse dense and sparse scores get
 * both vectors; for all others a larger dense pool is re-ranked here with the
 * same weighting, {@code alpha * dense + (1 - alpha) * sparseCosine}, where
 * the pool's dense scores are min-max scaled to [0, 1] first.
 */
class HybridRetrievalStrategy implements RetrievalStrategy {

    private static final Logger LOGGER = LoggerFactory.getLogger(HybridRetrievalStrategy.class);

    private final EmbeddingService embeddingService;
    private final VectorIndex vectorIndex;
    private final SparseVectorizer vectorizer;
    private final double alpha;
    private final int poolFactor;
    private final boolean clientRerank;

    HybridRetrievalStrategy(EmbeddingService embeddingService, VectorIndex vectorIndex, SparseVectorizer vectorizer,
            double alpha, int poolFactor, boolean clientRerank) {
        if (alpha < 0.0d || alpha > 1.0d) {
            throw new IllegalArgumentException("alpha must be within [0, 1]: " + alpha);
        }
        this.embeddingService = Objects.requireNonNull(embeddingService, "embeddingService");
        this.vectorIndex = Objects.requireNonNull(vectorIndex, "vectorIndex");
        this.vectorizer = Objects.requireNonNull(vectorizer, "vectorizer");
        this.alpha = alpha;
        this.poolFactor = Math.max(1, poolFactor);
        this.clientRerank = clientRerank;
    }

    @Override
    public StrategyType type() {
        return StrategyType.HYBRID;
    }

    @Override
    public RetrievalResult retrieve(RetrievalQuery query, int topK, MetadataFilter filter) {
        float[] dense = embeddingService.embed(query.text(), EmbeddingKind.QUERY);
        SparseVector sparse = vectorizer.encode(query.text());

        List<RankedChunk> chunks;
        if (sparse != null && vectorIndex.supportsHybrid() && !clientRerank) {
            chunks = vectorIndex.query(new IndexQuery(dense, sparse, alpha, topK, filter)).stream()
                    .map(match -> new RankedChunk(match.chunk(), match.score(), StrategyType.HYBRID))
                    .toList();
            LOGGER.debug("Native hybrid query returned {} chunks (alpha={})", chunks.size(), alpha);
        } else {
            List<ScoredChunk> pool = vectorIndex.query(IndexQuery.dense(dense, topK * poolFactor, filter));
            chunks = rerank(pool, sparse, topK);
            LOGGER.debug("Re-ranked {} dense candidates to {} chunks (alpha={}, keywords={})", pool.size(),
                    chunks.size(), alpha, sparse != null ? sparse.size() : 0);
        }
        return RetrievalResult.of(StrategyType.HYBRID, chunks);
    }

    List<RankedChunk> rerank(List<ScoredChunk> pool, SparseVector querySparse, int topK) {
        double min = pool.stream().mapToDouble(ScoredChunk::score).min().orElse(0.0d);
        double max = pool.stream().mapToDouble(ScoredChunk::score).max().orElse(0.0d);
        return pool.stream()
                .map(match -> new RankedChunk(match.chunk(),
                        combinedScore(match, normalise(match.score(), min, max), querySparse), StrategyType.HYBRID))
                .sorted(Comparator.comparingDouble(RankedChunk::score).reversed())
                .limit(topK)
                .toList();
    }

    private double combinedScore(ScoredChunk match, double dense, SparseVector querySparse) {
        if (querySparse == null) {
            return dense;
        }
        SparseVector chunkSparse = vectorizer.encode(match.chunk().text());
        double keyword = chunkSparse == null ? 0.0d : querySparse.cosine(chunkSparse);
        return alpha * dense + (1.0d - alpha) * keyword;
    }

    private static double normalise(double score, double min, double max) {
        // a pool of equal scores carries no dense signal
        return max > min ? (score - min) / (max - min) : 1.0d;
    }
}
