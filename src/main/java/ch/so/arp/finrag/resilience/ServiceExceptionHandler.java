package ch.so.arp.finrag.resilience;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;

/**
 * Maps failures of external dependencies on the JSON endpoints to error
 * responses. Streaming requests report failures as {@code error} frames
 * instead.
 */
@RestControllerAdvice
public class ServiceExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServiceExceptionHandler.class);

    @ExceptionHandler(CallNotPermittedException.class)
    public ResponseEntity<Map<String, Object>> handleOpenCircuit(CallNotPermittedException ex) {
        return body(HttpStatus.SERVICE_UNAVAILABLE, "circuit_open", ex.getMessage());
    }

    @ExceptionHandler(TransientServiceException.class)
    public ResponseEntity<Map<String, Object>> handleTransient(TransientServiceException ex) {
        LOGGER.warn("Dependency {} unavailable: {}", ex.getDependency(), ex.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, "dependency_unavailable", ex.getMessage());
    }

    @ExceptionHandler(PermanentServiceException.class)
    public ResponseEntity<Map<String, Object>> handlePermanent(PermanentServiceException ex) {
        LOGGER.warn("Dependency {} rejected the request: {}", ex.getDependency(), ex.getMessage());
        return body(HttpStatus.BAD_GATEWAY, "dependency_failed", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidInput(IllegalArgumentException ex) {
        return body(HttpStatus.BAD_REQUEST, "invalid_request", ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("details", details);
        return new ResponseEntity<>(body, status);
    }
}
