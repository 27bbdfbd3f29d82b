package ch.so.arp.finrag.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.finrag.embedding.EmbeddingService;
import ch.so.arp.finrag.resilience.ResilientCallExecutor;
import ch.so.arp.finrag.sparse.SparseVectorizer;

/**
 * Selects the vector index backend with {@code finrag.vector-store}
 * ({@code memory} by default, {@code postgres} or {@code pinecone}).
 */
@Configuration
@EnableConfigurationProperties({ VectorIndexProperties.class, PineconeClientProperties.class })
public class VectorIndexConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(VectorIndexConfiguration.class);

    @Bean
    @ConditionalOnProperty(name = "finrag.vector-store", havingValue = "memory", matchIfMissing = true)
    public VectorIndex inMemoryVectorIndex(VectorIndexProperties properties, ResourcePatternResolver resolver,
            ObjectMapper objectMapper, EmbeddingService embeddingService, SparseVectorizer sparseVectorizer,
            ResilientCallExecutor resilientCallExecutor) {
        InMemoryVectorIndex index = new InMemoryVectorIndex();
        new ChunkCorpusLoader(resolver, objectMapper, embeddingService, sparseVectorizer)
                .load(properties.getChunksLocation(), index);
        return new ResilientVectorIndex(index, resilientCallExecutor);
    }

    @Bean
    @ConditionalOnProperty(name = "finrag.vector-store", havingValue = "postgres")
    public VectorIndex pgVectorIndex(JdbcClient jdbcClient, ResilientCallExecutor resilientCallExecutor) {
        LOGGER.info("Using pgvector index");
        return new ResilientVectorIndex(new PgVectorIndex(jdbcClient), resilientCallExecutor);
    }

    @Bean
    @ConditionalOnProperty(name = "finrag.vector-store", havingValue = "pinecone")
    public VectorIndex pineconeVectorIndex(RestClient.Builder restClientBuilder, PineconeClientProperties properties,
            ResilientCallExecutor resilientCallExecutor) {
        LOGGER.info("Using Pinecone index at {}", properties.getIndexHost());
        return new ResilientVectorIndex(new PineconeVectorIndex(restClientBuilder, properties),
                resilientCallExecutor);
    }
}
