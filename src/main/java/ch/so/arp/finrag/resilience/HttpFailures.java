package ch.so.arp.finrag.resilience;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestClient;

/**
 * Translates error responses of HTTP dependencies into the
 * transient/permanent taxonomy. Meant to be used as a {@code RestClient}
 * status handler.
 */
public final class HttpFailures {

    private static final int MAX_BODY_LENGTH = 500;

    private HttpFailures() {
    }

    public static RuntimeException fromStatus(String dependency, int statusCode, String body) {
        String message = dependency + " request failed (" + statusCode + "): " + abbreviate(body);
        if (RetryPolicy.isRetryableStatus(statusCode)) {
            return new TransientServiceException(dependency, statusCode, message, null);
        }
        return new PermanentServiceException(dependency, statusCode, message, null);
    }

    /**
     * Status handler throwing the translated exception, e.g.
     * {@code .onStatus(HttpStatusCode::isError, HttpFailures.handler("embedding"))}.
     */
    public static RestClient.ResponseSpec.ErrorHandler handler(String dependency) {
        return (HttpRequest request, ClientHttpResponse response) -> {
            throw fromStatus(dependency, response.getStatusCode().value(), readBody(response));
        };
    }

    private static String readBody(ClientHttpResponse response) {
        try {
            return new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            return "<unreadable body: " + ex.getMessage() + ">";
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_BODY_LENGTH ? body : body.substring(0, MAX_BODY_LENGTH) + "...";
    }
}
