package ch.so.arp.finrag.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import ch.so.arp.finrag.embedding.EmbeddingService;
import ch.so.arp.finrag.index.Chunk;
import ch.so.arp.finrag.index.InMemoryVectorIndex;
import ch.so.arp.finrag.index.MetadataFilter;
import ch.so.arp.finrag.llm.CompletionRequest;
import ch.so.arp.finrag.llm.LanguageModel;
import ch.so.arp.finrag.llm.ModelResponse;
import ch.so.arp.finrag.resilience.TransientServiceException;

class MultiQueryRetrievalStrategyTest {

    private static final String QUERY = "Compare AMD and NVIDIA data center growth";

    private final List<String> embeddedTexts = new CopyOnWriteArrayList<>();
    private final EmbeddingService embeddingService = (text, kind) -> {
        embeddedTexts.add(text);
        return text.contains("Instinct") ? new float[] { 0.0f, 1.0f } : new float[] { 1.0f, 0.0f };
    };
    private final LanguageModel languageModel = mock(LanguageModel.class);
    private MultiQueryRetrievalStrategy strategy;

    @BeforeEach
    void setUp() {
        InMemoryVectorIndex index = new InMemoryVectorIndex();
        index.add(chunk("revenue"), new float[] { 1.0f, 0.0f }, null);
        index.add(chunk("accelerators"), new float[] { 0.0f, 1.0f }, null);
        index.add(chunk("mixed"), new float[] { 0.7f, 0.7f }, null);
        strategy = new MultiQueryRetrievalStrategy(languageModel, new DenseRetrievalStrategy(embeddingService, index),
                3, 20, 60);
    }

    @Test
    void parsesNumberedAndBulletedVariants() {
        List<String> variants = MultiQueryRetrievalStrategy.parseVariants("""
                Here are alternative queries:
                1. AMD data center revenue trend
                2) "NVIDIA Instinct competitor sales"
                - short
                * Hyperscaler accelerator demand""");

        assertThat(variants).containsExactly("AMD data center revenue trend", "NVIDIA Instinct competitor sales",
                "Hyperscaler accelerator demand");
    }

    @Test
    void searchesOriginalPlusVariantsAndFusesResults() {
        when(languageModel.complete(any(CompletionRequest.class))).thenReturn(ModelResponse.text("""
                1. AMD data center revenue trend
                2. Instinct accelerator sales growth
                3. Hyperscaler accelerator demand"""));

        RetrievalResult result = strategy.retrieve(RetrievalQuery.of(QUERY), 2, MetadataFilter.none());

        assertThat(result.queryVariants()).containsExactly(QUERY, "AMD data center revenue trend",
                "Instinct accelerator sales growth");
        assertThat(embeddedTexts).hasSize(3);
        assertThat(result.strategy()).isEqualTo(StrategyType.MULTI_QUERY);
        assertThat(result.chunks()).hasSize(2);
        // "mixed" ranks second in every list, the others rank first in some and last in others
        assertThat(result.chunks()).extracting(ranked -> ranked.chunk().id()).containsExactly("revenue", "mixed");
    }

    @Test
    void searchesOnlyTheOriginalWhenVariantGenerationFails() {
        when(languageModel.complete(any(CompletionRequest.class)))
                .thenThrow(new TransientServiceException("anthropic", "overloaded"));

        RetrievalResult result = strategy.retrieve(RetrievalQuery.of(QUERY), 3, MetadataFilter.none());

        assertThat(result.queryVariants()).containsExactly(QUERY);
        assertThat(embeddedTexts).containsExactly(QUERY);
        assertThat(result.chunks()).hasSize(3);
    }

    private static Chunk chunk(String id) {
        return new Chunk(id, "text " + id, "test", "AMD", 2024, "Q3", "Prepared Remarks");
    }
}
