package ch.so.arp.finrag.resilience;

/**
 * Failure of an external dependency that may succeed when the call is repeated,
 * e.g. a timeout, a rate limit (HTTP 429), a server error (HTTP 5xx) or a
 * broken connection.
 */
public class TransientServiceException extends RuntimeException {

    private final String dependency;
    private final int statusCode;

    public TransientServiceException(String dependency, String message) {
        this(dependency, 0, message, null);
    }

    public TransientServiceException(String dependency, String message, Throwable cause) {
        this(dependency, 0, message, cause);
    }

    public TransientServiceException(String dependency, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.dependency = dependency;
        this.statusCode = statusCode;
    }

    public String getDependency() {
        return dependency;
    }

    /**
     * @return the HTTP status reported by the dependency or {@code 0} if the
     *         failure happened below HTTP
     */
    public int getStatusCode() {
        return statusCode;
    }
}
