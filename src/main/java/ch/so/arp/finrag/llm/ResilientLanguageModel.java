package ch.so.arp.finrag.llm;

import java.util.Objects;
import java.util.function.Consumer;

import ch.so.arp.finrag.resilience.AttemptObserver;
import ch.so.arp.finrag.resilience.ResilientCallExecutor;

/**
 * Routes model calls through the shared {@link ResilientCallExecutor}. A
 * stream that already produced text is not retried since the emitted tokens
 * cannot be taken back, and an attempt that was abandoned after its time
 * limit cannot emit anymore.
 */
class ResilientLanguageModel implements LanguageModel {

    static final String DEPENDENCY = AnthropicLanguageModel.DEPENDENCY;

    private final LanguageModel delegate;
    private final ResilientCallExecutor executor;

    ResilientLanguageModel(LanguageModel delegate, ResilientCallExecutor executor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public ModelResponse complete(CompletionRequest request) {
        return executor.call(DEPENDENCY, () -> delegate.complete(request));
    }

    @Override
    public void stream(CompletionRequest request, Consumer<String> tokenConsumer) {
        StreamGate gate = new StreamGate(tokenConsumer);
        try {
            executor.run(DEPENDENCY, () -> {
                int attempt = gate.nextAttempt();
                delegate.stream(request, token -> gate.accept(attempt, token));
            }, gate);
        } finally {
            gate.close();
        }
    }

    /**
     * Forwards tokens of the live attempt only, and only until the call has
     * returned or failed.
     */
    private static final class StreamGate implements AttemptObserver {

        private final Consumer<String> tokenConsumer;
        private int attempt;
        private boolean live;
        private boolean emitted;
        private boolean closed;

        StreamGate(Consumer<String> tokenConsumer) {
            this.tokenConsumer = tokenConsumer;
        }

        synchronized int nextAttempt() {
            live = true;
            return ++attempt;
        }

        synchronized void accept(int tokenAttempt, String token) {
            if (closed || !live || tokenAttempt != attempt) {
                return;
            }
            emitted = true;
            tokenConsumer.accept(token);
        }

        @Override
        public synchronized boolean retryAllowed() {
            return !emitted;
        }

        @Override
        public synchronized void abandoned() {
            live = false;
        }

        synchronized void close() {
            closed = true;
        }
    }
}
