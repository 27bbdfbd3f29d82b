package ch.so.arp.finrag.chat;

import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Supplies the emitter a chat request streams its frames into. Tests swap
 * in emitters that record what was sent.
 */
@FunctionalInterface
public interface SseEmitterFactory {

    SseEmitter create();
}
