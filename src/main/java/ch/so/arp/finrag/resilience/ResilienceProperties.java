package ch.so.arp.finrag.resilience;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Timeout, retry and circuit breaker settings per external dependency. A
 * dependency without an entry of its own uses {@link #getDefaults()}.
 */
@ConfigurationProperties(prefix = "finrag.resilience")
public class ResilienceProperties {

    /**
     * Policy used for every dependency that has no dedicated entry.
     */
    private Policy defaults = new Policy();

    /**
     * Dedicated policies keyed by dependency name (anthropic, embedding,
     * vector-index, tool-&lt;name&gt;).
     */
    private Map<String, Policy> dependencies = new LinkedHashMap<>();

    public Policy getDefaults() {
        return defaults;
    }

    public void setDefaults(Policy defaults) {
        this.defaults = defaults;
    }

    public Map<String, Policy> getDependencies() {
        return dependencies;
    }

    public void setDependencies(Map<String, Policy> dependencies) {
        this.dependencies = dependencies;
    }

    public Policy policyFor(String dependency) {
        return dependencies.getOrDefault(dependency, defaults);
    }

    public static class Policy {

        /**
         * Wall-clock cap of a single attempt.
         */
        private Duration timeout = Duration.ofSeconds(30);

        /**
         * Attempts including the first call.
         */
        private int maxAttempts = 3;

        /**
         * Delay before the first retry; doubled for every further retry.
         */
        private Duration baseDelay = Duration.ofSeconds(1);

        /**
         * Randomisation factor applied to the backoff delay, 0 disables jitter.
         */
        private double jitter = 0.5d;

        /**
         * Consecutive failures that open the circuit.
         */
        private int failureThreshold = 5;

        /**
         * Time the circuit stays open before a single trial call is let through.
         */
        private Duration coolDown = Duration.ofSeconds(30);

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getCoolDown() {
            return coolDown;
        }

        public void setCoolDown(Duration coolDown) {
            this.coolDown = coolDown;
        }
    }
}
