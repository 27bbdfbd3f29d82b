package ch.so.arp.finrag.orchestration;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes frames of one request and drops everything after the first
 * {@code end} or {@code error} frame.
 */
public class GuardedEventSink implements EventSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(GuardedEventSink.class);

    private final EventSink delegate;
    private boolean terminated;

    public GuardedEventSink(EventSink delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public synchronized void emit(StreamEvent event) {
        if (terminated) {
            LOGGER.debug("Dropping {} frame emitted after stream end", event.type().wireName());
            return;
        }
        if (event.type().isTerminal()) {
            terminated = true;
        }
        delegate.emit(event);
    }

    public synchronized boolean isTerminated() {
        return terminated;
    }

    /**
     * Mark the stream closed without emitting a frame, e.g. after the client
     * went away.
     */
    public synchronized void close() {
        terminated = true;
    }
}
