package ch.so.arp.finrag.chat;

import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import ch.so.arp.finrag.orchestration.ChatTurn;
import ch.so.arp.finrag.orchestration.StreamEvent;
import ch.so.arp.finrag.resilience.RequestCancelledException;
import jakarta.validation.Valid;

/**
 * REST endpoint exposing the chat functionality via server sent events. Every
 * frame is sent as one JSON {@code data} line.
 */
@RestController
@RequestMapping(path = "/api/chat", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
@Validated
public class ChatController {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatController.class);

    private final ChatService chatService;
    private final SseEmitterFactory emitterFactory;

    public ChatController(ChatService chatService, SseEmitterFactory emitterFactory) {
        this.chatService = chatService;
        this.emitterFactory = emitterFactory;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public SseEmitter chat(@Valid @RequestBody ChatRequest request) {
        SseEmitter emitter = emitterFactory.create();
        ChatTurn turn = new ChatTurn(UUID.randomUUID().toString(), request.message(), request.history(),
                request.strategy(), request.tickers());
        Future<?> answer = chatService.streamAnswer(turn, new ChatService.StreamingResponseHandler() {
            @Override
            public void onEvent(StreamEvent event) {
                try {
                    emitter.send(event.toMap(), MediaType.APPLICATION_JSON);
                } catch (IOException | IllegalStateException ex) {
                    LOGGER.warn("Unable to stream {} frame of request {}: {}", event.type().wireName(),
                            turn.requestId(), ex.getMessage());
                    emitter.completeWithError(ex);
                    throw new RequestCancelledException("Client disconnected", ex);
                }
            }

            @Override
            public void onComplete() {
                emitter.complete();
            }

            @Override
            public void onError(Throwable throwable) {
                emitter.completeWithError(throwable);
            }
        });
        emitter.onTimeout(() -> {
            LOGGER.info("Emitter of request {} timed out, cancelling", turn.requestId());
            answer.cancel(true);
        });
        emitter.onError(ex -> answer.cancel(true));
        emitter.onCompletion(() -> answer.cancel(true));
        return emitter;
    }
}
