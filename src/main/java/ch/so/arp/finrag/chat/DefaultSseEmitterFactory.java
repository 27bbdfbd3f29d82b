package ch.so.arp.finrag.chat;

import java.time.Duration;

import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Creates emitters with the configured timeout. A zero timeout lets long
 * answers finish without interruption.
 */
class DefaultSseEmitterFactory implements SseEmitterFactory {

    private final long timeoutMillis;

    DefaultSseEmitterFactory(Duration timeout) {
        this.timeoutMillis = timeout == null ? 0L : timeout.toMillis();
    }

    @Override
    public SseEmitter create() {
        return new SseEmitter(timeoutMillis);
    }
}
