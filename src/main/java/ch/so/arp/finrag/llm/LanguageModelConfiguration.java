package ch.so.arp.finrag.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.finrag.resilience.ResilientCallExecutor;

/**
 * Chooses between the mock model and the Anthropic API with
 * {@code finrag.mock-llm} (mock by default).
 */
@Configuration
@EnableConfigurationProperties(AnthropicClientProperties.class)
public class LanguageModelConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(LanguageModelConfiguration.class);

    @Bean
    @ConditionalOnProperty(name = "finrag.mock-llm", havingValue = "true", matchIfMissing = true)
    public LanguageModel mockLanguageModel(ResilientCallExecutor resilientCallExecutor) {
        LOGGER.info("Using mock language model");
        return new ResilientLanguageModel(new MockLanguageModel(), resilientCallExecutor);
    }

    @Bean
    @ConditionalOnProperty(name = "finrag.mock-llm", havingValue = "false")
    public LanguageModel anthropicLanguageModel(RestClient.Builder restClientBuilder, ObjectMapper objectMapper,
            AnthropicClientProperties properties, ResilientCallExecutor resilientCallExecutor) {
        LOGGER.info("Using Anthropic model {}", properties.getModel());
        return new ResilientLanguageModel(new AnthropicLanguageModel(restClientBuilder, objectMapper, properties),
                resilientCallExecutor);
    }
}
