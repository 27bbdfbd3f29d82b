package ch.so.arp.finrag.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import ch.so.arp.finrag.resilience.ResilienceProperties;
import ch.so.arp.finrag.resilience.ResilientCallExecutor;
import ch.so.arp.finrag.resilience.ServiceTimeoutException;
import ch.so.arp.finrag.resilience.TransientServiceException;

class ResilientLanguageModelTest {

    private final ExecutorService callExecutor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        callExecutor.shutdownNow();
    }

    @Test
    void doesNotReplayStreamThatTimedOutAfterOutput() throws InterruptedException {
        AtomicInteger attempts = new AtomicInteger();
        CountDownLatch abandoned = new CountDownLatch(1);
        LanguageModel stalling = new StreamingModel((request, tokens) -> {
            attempts.incrementAndGet();
            tokens.accept("Revenue ");
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException ex) {
                tokens.accept("after timeout");
                abandoned.countDown();
            }
        });
        ResilientLanguageModel model = new ResilientLanguageModel(stalling, executor(Duration.ofMillis(200)));
        List<String> received = new CopyOnWriteArrayList<>();

        assertThatThrownBy(() -> model.stream(request(), received::add))
                .isInstanceOf(ServiceTimeoutException.class);

        assertThat(abandoned.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(received).containsExactly("Revenue ");
        assertThat(attempts).hasValue(1);
    }

    @Test
    void retriesStreamThatFailedBeforeOutput() {
        AtomicInteger attempts = new AtomicInteger();
        LanguageModel flaky = new StreamingModel((request, tokens) -> {
            if (attempts.incrementAndGet() == 1) {
                throw new TransientServiceException("anthropic", 529, "overloaded", null);
            }
            tokens.accept("Revenue ");
            tokens.accept("rose.");
        });
        ResilientLanguageModel model = new ResilientLanguageModel(flaky, executor(Duration.ofSeconds(5)));
        List<String> received = new CopyOnWriteArrayList<>();

        model.stream(request(), received::add);

        assertThat(received).containsExactly("Revenue ", "rose.");
        assertThat(attempts).hasValue(2);
    }

    @Test
    void doesNotRetryStreamThatFailedAfterOutput() {
        AtomicInteger attempts = new AtomicInteger();
        LanguageModel broken = new StreamingModel((request, tokens) -> {
            attempts.incrementAndGet();
            tokens.accept("Revenue ");
            throw new TransientServiceException("anthropic", "connection reset");
        });
        ResilientLanguageModel model = new ResilientLanguageModel(broken, executor(Duration.ofSeconds(5)));
        List<String> received = new CopyOnWriteArrayList<>();

        assertThatThrownBy(() -> model.stream(request(), received::add))
                .isInstanceOf(TransientServiceException.class)
                .hasMessageContaining("connection reset");
        assertThat(received).containsExactly("Revenue ");
        assertThat(attempts).hasValue(1);
    }

    private ResilientCallExecutor executor(Duration timeout) {
        ResilienceProperties.Policy policy = new ResilienceProperties.Policy();
        policy.setMaxAttempts(2);
        policy.setTimeout(timeout);
        policy.setBaseDelay(Duration.ofMillis(1));
        policy.setJitter(0.0d);
        policy.setFailureThreshold(5);
        ResilienceProperties properties = new ResilienceProperties();
        properties.setDefaults(policy);
        return new ResilientCallExecutor(properties, callExecutor);
    }

    private static CompletionRequest request() {
        return CompletionRequest.prompt("What was AMD's revenue?", 100, 0.0d);
    }

    private interface StreamBehaviour {
        void stream(CompletionRequest request, Consumer<String> tokens);
    }

    private static final class StreamingModel implements LanguageModel {

        private final StreamBehaviour behaviour;

        StreamingModel(StreamBehaviour behaviour) {
            this.behaviour = behaviour;
        }

        @Override
        public ModelResponse complete(CompletionRequest request) {
            throw new UnsupportedOperationException("streaming only");
        }

        @Override
        public void stream(CompletionRequest request, Consumer<String> tokenConsumer) {
            behaviour.stream(request, tokenConsumer);
        }
    }
}
