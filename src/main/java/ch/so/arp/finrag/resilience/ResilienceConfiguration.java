package ch.so.arp.finrag.resilience;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Wires the shared {@link ResilientCallExecutor} together with the thread pool
 * that runs the time-limited attempts.
 */
@Configuration
@EnableConfigurationProperties(ResilienceProperties.class)
public class ResilienceConfiguration {

    @Bean(destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "externalCallExecutor")
    public ExecutorService externalCallExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("finrag-call-"));
    }

    @Bean
    @ConditionalOnMissingBean
    public ResilientCallExecutor resilientCallExecutor(ResilienceProperties properties,
            @Qualifier("externalCallExecutor") ExecutorService externalCallExecutor) {
        return new ResilientCallExecutor(properties, externalCallExecutor);
    }
}
