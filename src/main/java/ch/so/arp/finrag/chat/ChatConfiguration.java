package ch.so.arp.finrag.chat;

import java.util.concurrent.Executor;
import java.util.concurrent.Executors;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Executor and emitter factory of the streaming endpoint.
 */
@Configuration
@EnableConfigurationProperties(ChatProperties.class)
public class ChatConfiguration {

    @Bean(destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "chatExecutor")
    public Executor chatExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("finrag-chat-"));
    }

    @Bean
    @ConditionalOnMissingBean
    public SseEmitterFactory sseEmitterFactory(ChatProperties properties) {
        return new DefaultSseEmitterFactory(properties.getEmitterTimeout());
    }
}
