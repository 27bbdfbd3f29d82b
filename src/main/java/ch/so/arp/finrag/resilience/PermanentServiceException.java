package ch.so.arp.finrag.resilience;

/**
 * Failure that repeating the call cannot fix: malformed input, rejected
 * credentials or any HTTP 4xx status other than 429.
 */
public class PermanentServiceException extends RuntimeException {

    private final String dependency;
    private final int statusCode;

    public PermanentServiceException(String dependency, String message) {
        this(dependency, 0, message, null);
    }

    public PermanentServiceException(String dependency, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.dependency = dependency;
        this.statusCode = statusCode;
    }

    public String getDependency() {
        return dependency;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
