package ch.so.arp.finrag.resilience;

/**
 * Signals that the caller gave up on the request (client disconnect, emitter
 * timeout) while an external call was in flight.
 */
public class RequestCancelledException extends RuntimeException {

    public RequestCancelledException(String message) {
        super(message);
    }

    public RequestCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
