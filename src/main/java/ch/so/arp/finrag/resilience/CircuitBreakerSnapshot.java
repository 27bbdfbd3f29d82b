package ch.so.arp.finrag.resilience;

/**
 * Point-in-time view of one dependency's circuit breaker, exposed by the health
 * endpoint.
 */
public record CircuitBreakerSnapshot(String dependency, String state, int failedCalls, int bufferedCalls) {
}
