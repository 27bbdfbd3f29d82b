package ch.so.arp.finrag.chat;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "finrag.chat")
public class ChatProperties {

    /**
     * Emitter timeout; the answer loop is cancelled when it expires. Zero
     * disables the timeout.
     */
    private Duration emitterTimeout = Duration.ofMinutes(3);

    public Duration getEmitterTimeout() {
        return emitterTimeout;
    }

    public void setEmitterTimeout(Duration emitterTimeout) {
        this.emitterTimeout = emitterTimeout;
    }
}
