package ch.so.arp.finrag.orchestration;

/**
 * Receives the frames of one answer stream in emission order.
 */
@FunctionalInterface
public interface EventSink {

    /**
     * Deliver a frame. Implementations throw
     * {@link ch.so.arp.finrag.resilience.RequestCancelledException} when the
     * client is gone.
     */
    void emit(StreamEvent event);
}
