package ch.so.arp.finrag.resilience;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Reports the circuit breaker state of every external dependency called so
 * far. The status is {@code degraded} while any circuit is open.
 */
@RestController
public class HealthController {

    private final ResilientCallExecutor executor;

    public HealthController(ResilientCallExecutor executor) {
        this.executor = executor;
    }

    @GetMapping(path = "/api/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> health() {
        List<CircuitBreakerSnapshot> circuits = executor.circuitStates();
        boolean degraded = circuits.stream().anyMatch(circuit -> !"CLOSED".equals(circuit.state()));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", degraded ? "degraded" : "ok");
        body.put("circuits", circuits);
        return body;
    }
}
