package ch.so.arp.finrag.retrieval;

import java.util.List;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import ch.so.arp.finrag.embedding.EmbeddingService;
import ch.so.arp.finrag.index.VectorIndex;
import ch.so.arp.finrag.llm.LanguageModel;
import ch.so.arp.finrag.sparse.SparseVectorizer;

/**
 * Wires the sparse vectorizer, the four strategies and the router.
 */
@Configuration
@EnableConfigurationProperties(RetrievalProperties.class)
public class RetrievalConfiguration {

    @Bean
    public SparseVectorizer sparseVectorizer(RetrievalProperties properties) {
        return new SparseVectorizer(properties.getSparseHashSpace(), properties.getSparseCacheSize());
    }

    @Bean
    public StrategyClassifier strategyClassifier(RetrievalProperties properties) {
        return new StrategyClassifier(properties.getAuto().toRules());
    }

    @Bean
    public RetrievalService retrievalService(RetrievalProperties properties, EmbeddingService embeddingService,
            VectorIndex vectorIndex, SparseVectorizer sparseVectorizer, LanguageModel languageModel,
            StrategyClassifier strategyClassifier) {
        DenseRetrievalStrategy dense = new DenseRetrievalStrategy(embeddingService, vectorIndex);
        List<RetrievalStrategy> strategies = List.of(
                dense,
                new HybridRetrievalStrategy(embeddingService, vectorIndex, sparseVectorizer,
                        properties.getHybridAlpha(), properties.getHybridPoolFactor(),
                        properties.isHybridClientRerank()),
                new HydeRetrievalStrategy(languageModel, dense),
                new MultiQueryRetrievalStrategy(languageModel, dense, properties.getMultiQueryVariants(),
                        properties.getPerVariantTopK(), properties.getRrfK()));
        return new RetrievalService(strategies, strategyClassifier, properties.getDefaultStrategy(),
                properties.getDefaultTopK());
    }
}
