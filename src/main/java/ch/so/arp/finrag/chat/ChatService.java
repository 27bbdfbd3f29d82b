package ch.so.arp.finrag.chat;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import ch.so.arp.finrag.orchestration.ChatTurn;
import ch.so.arp.finrag.orchestration.StreamEvent;
import ch.so.arp.finrag.orchestration.ToolOrchestrator;

/**
 * Runs the tool orchestration loop for a question on the chat executor and
 * hands the produced frames to a {@link StreamingResponseHandler}.
 */
@Service
public class ChatService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatService.class);

    private final ToolOrchestrator orchestrator;
    private final Executor chatExecutor;

    public ChatService(ToolOrchestrator orchestrator, @Qualifier("chatExecutor") Executor chatExecutor) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.chatExecutor = Objects.requireNonNull(chatExecutor, "chatExecutor");
    }

    /**
     * Start answering a question.
     *
     * @return handle to cancel the run; cancelling interrupts the in-flight
     *         planner or tool call
     */
    public Future<?> streamAnswer(ChatTurn turn, StreamingResponseHandler handler) {
        Objects.requireNonNull(turn, "turn");
        Objects.requireNonNull(handler, "handler");
        FutureTask<Void> task = new FutureTask<>(() -> {
            try {
                orchestrator.run(turn, handler::onEvent);
                handler.onComplete();
            } catch (Exception ex) {
                LOGGER.error("Failed to produce response for request {}: {}", turn.requestId(), ex.getMessage(), ex);
                handler.onError(ex);
            }
        }, null);
        chatExecutor.execute(task);
        return task;
    }

    /**
     * Callback API allowing to react to the streaming behaviour of the service.
     */
    public interface StreamingResponseHandler {

        void onEvent(StreamEvent event);

        void onComplete();

        void onError(Throwable throwable);
    }
}
