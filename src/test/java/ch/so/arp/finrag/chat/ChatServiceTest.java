package ch.so.arp.finrag.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import ch.so.arp.finrag.orchestration.ChatTurn;
import ch.so.arp.finrag.orchestration.EventSink;
import ch.so.arp.finrag.orchestration.StreamEvent;
import ch.so.arp.finrag.orchestration.ToolOrchestrator;

class ChatServiceTest {

    private final ToolOrchestrator orchestrator = mock(ToolOrchestrator.class);
    private final Executor directExecutor = Runnable::run;
    private final ChatTurn turn = new ChatTurn("req-1", "What is AMD's revenue?", List.of(), null, List.of());

    @Test
    void streamsFramesAndCompletesSuccessfully() {
        doAnswer(invocation -> {
            EventSink sink = invocation.getArgument(1);
            sink.emit(StreamEvent.metadata("req-1", Map.of()));
            sink.emit(StreamEvent.content("$6.8B"));
            sink.emit(StreamEvent.end("req-1"));
            return null;
        }).when(orchestrator).run(eq(turn), any());
        ChatService chatService = new ChatService(orchestrator, directExecutor);

        List<StreamEvent> events = new ArrayList<>();
        AtomicBoolean completed = new AtomicBoolean(false);
        AtomicReference<Throwable> error = new AtomicReference<>();

        Future<?> answer = chatService.streamAnswer(turn, handler(events, completed, error));

        assertThat(events).extracting(StreamEvent::text).containsExactly("", "$6.8B", "");
        assertThat(completed).isTrue();
        assertThat(error.get()).isNull();
        assertThat(answer).isDone();
    }

    @Test
    void propagatesUnexpectedFailures() {
        doThrow(new IllegalStateException("boom")).when(orchestrator).run(eq(turn), any());
        ChatService chatService = new ChatService(orchestrator, directExecutor);

        AtomicBoolean completed = new AtomicBoolean(false);
        AtomicReference<Throwable> error = new AtomicReference<>();

        chatService.streamAnswer(turn, handler(new ArrayList<>(), completed, error));

        assertThat(completed).isFalse();
        assertThat(error.get()).isInstanceOf(IllegalStateException.class).hasMessage("boom");
    }

    @Test
    void cancellingBeforeStartSkipsTheRun() {
        List<Runnable> queued = new ArrayList<>();
        ChatService chatService = new ChatService(orchestrator, queued::add);
        AtomicBoolean completed = new AtomicBoolean(false);

        Future<?> answer = chatService.streamAnswer(turn, handler(new ArrayList<>(), completed, new AtomicReference<>()));
        answer.cancel(true);
        queued.forEach(Runnable::run);

        assertThat(answer).isCancelled();
        assertThat(completed).isFalse();
    }

    private static ChatService.StreamingResponseHandler handler(List<StreamEvent> events, AtomicBoolean completed,
            AtomicReference<Throwable> error) {
        return new ChatService.StreamingResponseHandler() {
            @Override
            public void onEvent(StreamEvent event) {
                events.add(event);
            }

            @Override
            public void onComplete() {
                completed.set(true);
            }

            @Override
            public void onError(Throwable throwable) {
                error.set(throwable);
            }
        };
    }
}
