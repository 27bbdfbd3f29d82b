package ch.so.arp.finrag.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import ch.so.arp.finrag.embedding.EmbeddingService;
import ch.so.arp.finrag.index.Chunk;
import ch.so.arp.finrag.index.InMemoryVectorIndex;
import ch.so.arp.finrag.index.MetadataFilter;
import ch.so.arp.finrag.sparse.SparseVectorizer;

class HybridRetrievalStrategyTest {

    private static final String QUERY = "gaming margin decline";

    private final SparseVectorizer vectorizer = new SparseVectorizer();
    private final EmbeddingService embeddingService = (text, kind) -> new float[] { 1.0f, 0.0f };
    private InMemoryVectorIndex index;

    @BeforeEach
    void setUp() {
        index = new InMemoryVectorIndex();
        add("dense-best", "Data center revenue reached a record", new float[] { 0.9f, 0.1f });
        add("dense-middle", "Gaming consoles shipped fewer units", new float[] { 0.5f, 0.5f });
        add("keyword-best", "Gaming margin decline continued this quarter", new float[] { 0.1f, 0.9f });
    }

    @Test
    void alphaOneMatchesDenseRankingOnBothPaths() {
        List<String> dense = ids(new DenseRetrievalStrategy(embeddingService, index)
                .retrieve(RetrievalQuery.of(QUERY), 3, MetadataFilter.none()).chunks());

        List<String> nativePath = ids(hybrid(1.0d, false).retrieve(RetrievalQuery.of(QUERY), 3, MetadataFilter.none())
                .chunks());
        List<String> rerankPath = ids(hybrid(1.0d, true).retrieve(RetrievalQuery.of(QUERY), 3, MetadataFilter.none())
                .chunks());

        assertThat(dense).containsExactly("dense-best", "dense-middle", "keyword-best");
        assertThat(nativePath).isEqualTo(dense);
        assertThat(rerankPath).isEqualTo(dense);
    }

    @Test
    void alphaZeroRanksByKeywordsOnBothPaths() {
        List<String> nativePath = ids(hybrid(0.0d, false).retrieve(RetrievalQuery.of(QUERY), 3, MetadataFilter.none())
                .chunks());
        List<String> rerankPath = ids(hybrid(0.0d, true).retrieve(RetrievalQuery.of(QUERY), 3, MetadataFilter.none())
                .chunks());

        assertThat(nativePath).containsExactly("keyword-best", "dense-middle", "dense-best");
        assertThat(rerankPath).containsExactly("keyword-best", "dense-middle", "dense-best");
    }

    @Test
    void scalesDensePoolBeforeBlendingKeywords() {
        List<RankedChunk> denseOnly = hybrid(1.0d, true).retrieve(RetrievalQuery.of(QUERY), 3, MetadataFilter.none())
                .chunks();
        List<RankedChunk> blended = hybrid(0.6d, true).retrieve(RetrievalQuery.of(QUERY), 3, MetadataFilter.none())
                .chunks();

        assertThat(denseOnly.get(0).score()).isEqualTo(1.0d);
        assertThat(denseOnly.get(2).score()).isEqualTo(0.0d);
        assertThat(blended).allSatisfy(ranked -> assertThat(ranked.score()).isBetween(0.0d, 1.0d));
    }

    @Test
    void labelsResultsAsHybrid() {
        RetrievalResult result = hybrid(0.6d, false).retrieve(RetrievalQuery.of(QUERY), 2, MetadataFilter.none());

        assertThat(result.strategy()).isEqualTo(StrategyType.HYBRID);
        assertThat(result.chunks()).hasSize(2)
                .allSatisfy(ranked -> assertThat(ranked.origin()).isEqualTo(StrategyType.HYBRID));
    }

    @Test
    void rejectsAlphaOutsideUnitInterval() {
        assertThatThrownBy(() -> hybrid(1.5d, false)).isInstanceOf(IllegalArgumentException.class);
    }

    private HybridRetrievalStrategy hybrid(double alpha, boolean clientRerank) {
        return new HybridRetrievalStrategy(embeddingService, index, vectorizer, alpha, 3, clientRerank);
    }

    private void add(String id, String text, float[] dense) {
        index.add(new Chunk(id, text, "test", "AMD", 2024, "Q3", "Prepared Remarks"), dense, vectorizer.encode(text));
    }

    private static List<String> ids(List<RankedChunk> chunks) {
        return chunks.stream().map(ranked -> ranked.chunk().id()).toList();
    }
}
