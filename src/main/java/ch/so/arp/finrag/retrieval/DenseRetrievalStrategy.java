package ch.so.arp.finrag.retrieval;

import java.util.List;
import java.util.Objects;

import ch.so.arp.finrag.embedding.EmbeddingKind;
import ch.so.arp.finrag.embedding.EmbeddingService;
import ch.so.arp.finrag.index.IndexQuery;
import ch.so.arp.finrag.index.MetadataFilter;
import ch.so.arp.finrag.index.VectorIndex;

/**
 * Embeds the query and returns the index's dense top-K as-is.
 */
class DenseRetrievalStrategy implements RetrievalStrategy {

    private final EmbeddingService embeddingService;
    private final VectorIndex vectorIndex;

    DenseRetrievalStrategy(EmbeddingService embeddingService, VectorIndex vectorIndex) {
        this.embeddingService = Objects.requireNonNull(embeddingService, "embeddingService");
        this.vectorIndex = Objects.requireNonNull(vectorIndex, "vectorIndex");
    }

    @Override
    public StrategyType type() {
        return StrategyType.DENSE;
    }

    @Override
    public RetrievalResult retrieve(RetrievalQuery query, int topK, MetadataFilter filter) {
        return RetrievalResult.of(StrategyType.DENSE, search(query.text(), topK, filter, StrategyType.DENSE));
    }

    /**
     * Dense search for an arbitrary text, shared by the strategies that
     * rewrite the query before searching.
     */
    List<RankedChunk> search(String text, int topK, MetadataFilter filter, StrategyType origin) {
        float[] vector = embeddingService.embed(text, EmbeddingKind.QUERY);
        return vectorIndex.query(IndexQuery.dense(vector, topK, filter)).stream()
                .map(match -> new RankedChunk(match.chunk(), match.score(), origin))
                .toList();
    }
}
