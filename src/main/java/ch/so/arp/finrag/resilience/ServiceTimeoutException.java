package ch.so.arp.finrag.resilience;

/**
 * Raised when a dependency did not answer within its configured time limit on
 * every attempt.
 */
public class ServiceTimeoutException extends TransientServiceException {

    public ServiceTimeoutException(String dependency, String message, Throwable cause) {
        super(dependency, message, cause);
    }
}
