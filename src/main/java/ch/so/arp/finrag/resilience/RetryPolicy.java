package ch.so.arp.finrag.resilience;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeoutException;

import org.springframework.web.client.ResourceAccessException;

/**
 * Classifies failures of external calls. Only transient failures are retried
 * and only they count towards opening a circuit.
 */
public final class RetryPolicy {

    private RetryPolicy() {
    }

    public static boolean shouldRetry(Throwable error) {
        if (error == null) {
            return false;
        }
        if (error instanceof TransientServiceException || error instanceof TimeoutException) {
            return true;
        }
        if (error instanceof ResourceAccessException || error instanceof IOException
                || error instanceof UncheckedIOException) {
            return true;
        }
        return false;
    }

    /**
     * Maps an HTTP status code onto the transient/permanent taxonomy.
     */
    public static boolean isRetryableStatus(int statusCode) {
        return statusCode == 429 || statusCode >= 500;
    }
}
