package ch.so.arp.finrag.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import ch.so.arp.finrag.llm.Message;
import ch.so.arp.finrag.llm.Role;
import ch.so.arp.finrag.orchestration.ChatTurn;
import ch.so.arp.finrag.orchestration.StreamEvent;
import ch.so.arp.finrag.resilience.RequestCancelledException;
import ch.so.arp.finrag.retrieval.StrategyType;

class ChatControllerTest {

    private final ChatService chatService = mock(ChatService.class);
    private final AtomicReference<ChatTurn> turnReference = new AtomicReference<>();
    private final AtomicReference<ChatService.StreamingResponseHandler> handlerReference = new AtomicReference<>();

    @BeforeEach
    void captureHandler() {
        doAnswer(invocation -> {
            turnReference.set(invocation.getArgument(0));
            handlerReference.set(invocation.getArgument(1));
            return new CompletableFuture<Void>();
        }).when(chatService).streamAnswer(any(), any());
    }

    @Test
    void streamsFramesThroughSseEmitter() {
        RecordingSseEmitter emitter = new RecordingSseEmitter(false);
        ChatController controller = new ChatController(chatService, () -> emitter);

        SseEmitter returnedEmitter = controller.chat(new ChatRequest("How did AMD do?", null, null, null));

        assertThat(returnedEmitter).isSameAs(emitter);
        ChatService.StreamingResponseHandler handler = handlerReference.get();
        handler.onEvent(StreamEvent.content("AMD"));
        handler.onEvent(StreamEvent.end("req-1"));
        handler.onComplete();

        assertThat(emitter.getEvents()).containsExactly(
                Map.of("type", "content", "content", "AMD"),
                Map.of("type", "end", "requestId", "req-1"));
        assertThat(emitter.getMediaTypes()).containsOnly(MediaType.APPLICATION_JSON);
        assertThat(emitter.isCompleted()).isTrue();
    }

    @Test
    void buildsTurnFromRequest() {
        ChatController controller = new ChatController(chatService, () -> new RecordingSseEmitter(false));

        controller.chat(new ChatRequest("Compare them",
                List.of(new ChatRequest.HistoryMessage("user", "NVDA revenue?"),
                        new ChatRequest.HistoryMessage("assistant", "$35.1B")),
                StrategyType.MULTI_QUERY, List.of(" nvda", "amd ")));

        ChatTurn turn = turnReference.get();
        assertThat(turn.requestId()).isNotBlank();
        assertThat(turn.message()).isEqualTo("Compare them");
        assertThat(turn.strategy()).isEqualTo(StrategyType.MULTI_QUERY);
        assertThat(turn.tickers()).containsExactly("NVDA", "AMD");
        assertThat(turn.history()).extracting(Message::role).containsExactly(Role.USER, Role.ASSISTANT);
    }

    @Test
    void failedSendCancelsTheRun() {
        RecordingSseEmitter emitter = new RecordingSseEmitter(true);
        ChatController controller = new ChatController(chatService, () -> emitter);
        controller.chat(new ChatRequest("broken pipe", null, null, null));

        assertThatThrownBy(() -> handlerReference.get().onEvent(StreamEvent.content("x")))
                .isInstanceOf(RequestCancelledException.class);
        assertThat(emitter.getErrors()).singleElement().isInstanceOf(IOException.class);
    }

    @Test
    void reportsErrorsFromStreamingHandler() {
        RecordingSseEmitter emitter = new RecordingSseEmitter(false);
        ChatController controller = new ChatController(chatService, () -> emitter);
        controller.chat(new ChatRequest("broken", null, null, null));

        RuntimeException failure = new RuntimeException("boom");
        handlerReference.get().onError(failure);

        assertThat(emitter.getErrors()).containsExactly(failure);
        assertThat(emitter.isCompleted()).isFalse();
    }

    private static final class RecordingSseEmitter extends SseEmitter {

        private final boolean failOnSend;
        private final List<Object> events = new CopyOnWriteArrayList<>();
        private final List<MediaType> mediaTypes = new CopyOnWriteArrayList<>();
        private final List<Throwable> errors = new CopyOnWriteArrayList<>();
        private volatile boolean completed;

        private RecordingSseEmitter(boolean failOnSend) {
            super(0L);
            this.failOnSend = failOnSend;
        }

        @Override
        public void send(Object object, MediaType mediaType) throws IOException {
            if (failOnSend) {
                throw new IOException("Broken pipe");
            }
            events.add(object);
            mediaTypes.add(mediaType);
        }

        @Override
        public void complete() {
            completed = true;
            super.complete();
        }

        @Override
        public void completeWithError(Throwable ex) {
            errors.add(ex);
            super.completeWithError(ex);
        }

        List<Object> getEvents() {
            return new ArrayList<>(events);
        }

        List<MediaType> getMediaTypes() {
            return new ArrayList<>(mediaTypes);
        }

        List<Throwable> getErrors() {
            return new ArrayList<>(errors);
        }

        boolean isCompleted() {
            return completed;
        }
    }
}
