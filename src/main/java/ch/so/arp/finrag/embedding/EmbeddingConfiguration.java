package ch.so.arp.finrag.embedding;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import ch.so.arp.finrag.resilience.ResilientCallExecutor;

/**
 * Chooses between deterministic and Voyage embeddings. Either one is wrapped
 * with the resilience guard and a small cache.
 */
@Configuration
@EnableConfigurationProperties(VoyageClientProperties.class)
public class EmbeddingConfiguration {

    @Bean
    @ConditionalOnProperty(name = "finrag.mock-embeddings", havingValue = "true", matchIfMissing = true)
    public EmbeddingService deterministicEmbeddingService(VoyageClientProperties properties,
            ResilientCallExecutor resilientCallExecutor) {
        return decorate(new DeterministicEmbeddingService(properties.getDimensions()), properties,
                resilientCallExecutor);
    }

    @Bean
    @ConditionalOnProperty(name = "finrag.mock-embeddings", havingValue = "false")
    public EmbeddingService voyageEmbeddingService(RestClient.Builder restClientBuilder,
            VoyageClientProperties properties, ResilientCallExecutor resilientCallExecutor) {
        return decorate(new VoyageEmbeddingService(restClientBuilder, properties), properties, resilientCallExecutor);
    }

    private EmbeddingService decorate(EmbeddingService raw, VoyageClientProperties properties,
            ResilientCallExecutor resilientCallExecutor) {
        return new CachingEmbeddingService(new ResilientEmbeddingService(raw, resilientCallExecutor),
                properties.getCacheSize());
    }
}
