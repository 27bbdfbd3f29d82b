package ch.so.arp.finrag.resilience;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;

/**
 * Runs calls to external dependencies (planner, embedder, vector index, tools)
 * behind a circuit breaker, a retry with exponential backoff and a time limit,
 * composed in that order: an open circuit rejects the call before any attempt
 * is made, and every retry attempt gets its own time limit.
 * <p>
 * The circuit breakers are the only state shared between concurrent requests.
 * They live in a {@link CircuitBreakerRegistry} owned by this instance, one per
 * dependency name, created on first use.
 */
public class ResilientCallExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResilientCallExecutor.class);

    private final ResilienceProperties properties;
    private final ExecutorService callExecutor;
    private final CircuitBreakerRegistry circuitBreakers = CircuitBreakerRegistry.ofDefaults();
    private final RetryRegistry retries = RetryRegistry.ofDefaults();
    private final TimeLimiterRegistry timeLimiters = TimeLimiterRegistry.ofDefaults();
    private final Map<String, Guard> guards = new ConcurrentHashMap<>();

    public ResilientCallExecutor(ResilienceProperties properties, ExecutorService callExecutor) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.callExecutor = Objects.requireNonNull(callExecutor, "callExecutor");
    }

    /**
     * Execute the call on behalf of the named dependency.
     *
     * @param dependency name of the dependency, selects the policy and the
     *                   circuit breaker
     * @param call       the raw call
     * @return the call's result
     * @throws io.github.resilience4j.circuitbreaker.CallNotPermittedException if
     *         the dependency's circuit is open
     * @throws ServiceTimeoutException    if the last attempt exceeded the time
     *                                    limit
     * @throws RequestCancelledException  if the calling thread was interrupted
     */
    public <T> T call(String dependency, Callable<T> call) {
        return call(dependency, call, null);
    }

    /**
     * Like {@link #call(String, Callable)}, but a failed attempt is only
     * retried while the observer allows it, and the observer learns about
     * attempts that are given up. Streaming calls use this to stop retrying
     * once output has reached the caller.
     */
    public <T> T call(String dependency, Callable<T> call, AttemptObserver observer) {
        Objects.requireNonNull(call, "call");
        if (Thread.currentThread().isInterrupted()) {
            throw new RequestCancelledException("Request cancelled before calling " + dependency);
        }
        Guard guard = guards.computeIfAbsent(dependency, this::createGuard);
        Callable<T> timed = () -> callWithTimeLimit(guard.timeLimiter(), call, observer);
        Retry retry = observer == null ? guard.retry() : conditionalRetry(dependency, guard.retry(), observer);
        Callable<T> retried = Retry.decorateCallable(retry, timed);
        Callable<T> guarded = CircuitBreaker.decorateCallable(guard.circuitBreaker(), retried);
        try {
            return guarded.call();
        } catch (RuntimeException ex) {
            throw ex;
        } catch (TimeoutException ex) {
            throw new ServiceTimeoutException(dependency,
                    dependency + " timed out after " + guard.timeLimiter().getTimeLimiterConfig().getTimeoutDuration(),
                    ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RequestCancelledException("Request cancelled while calling " + dependency, ex);
        } catch (IOException ex) {
            throw new TransientServiceException(dependency, ex.getMessage(), ex);
        } catch (Exception ex) {
            throw new PermanentServiceException(dependency, 0, ex.getMessage(), ex);
        }
    }

    /**
     * Runnable variant of {@link #call(String, Callable)}.
     */
    public void run(String dependency, Runnable runnable) {
        run(dependency, runnable, null);
    }

    public void run(String dependency, Runnable runnable, AttemptObserver observer) {
        call(dependency, () -> {
            runnable.run();
            return null;
        }, observer);
    }

    public CircuitBreaker circuitBreaker(String dependency) {
        return guards.computeIfAbsent(dependency, this::createGuard).circuitBreaker();
    }

    public List<CircuitBreakerSnapshot> circuitStates() {
        return guards.entrySet().stream()
                .map(entry -> {
                    CircuitBreaker breaker = entry.getValue().circuitBreaker();
                    return new CircuitBreakerSnapshot(entry.getKey(), breaker.getState().name(),
                            breaker.getMetrics().getNumberOfFailedCalls(),
                            breaker.getMetrics().getNumberOfBufferedCalls());
                })
                .sorted(Comparator.comparing(CircuitBreakerSnapshot::dependency))
                .toList();
    }

    private <T> T callWithTimeLimit(TimeLimiter timeLimiter, Callable<T> call, AttemptObserver observer)
            throws Exception {
        Future<T> future = callExecutor.submit(call);
        try {
            return timeLimiter.executeFutureSupplier(() -> future);
        } catch (TimeoutException | InterruptedException ex) {
            if (observer != null) {
                observer.abandoned();
            }
            future.cancel(true);
            throw ex;
        }
    }

    private Guard createGuard(String dependency) {
        ResilienceProperties.Policy policy = properties.policyFor(dependency);
        int threshold = Math.max(1, policy.getFailureThreshold());

        CircuitBreakerConfig breakerConfig = CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100.0f)
                .permittedNumberOfCallsInHalfOpenState(1)
                .waitDurationInOpenState(policy.getCoolDown())
                .recordException(RetryPolicy::shouldRetry)
                .ignoreExceptions(InterruptedException.class, CancellationException.class,
                        RequestCancelledException.class)
                .build();
        CircuitBreaker circuitBreaker = circuitBreakers.circuitBreaker(dependency, breakerConfig);
        circuitBreaker.getEventPublisher().onStateTransition(event -> LOGGER.warn("Circuit for {} changed: {}",
                dependency, event.getStateTransition()));

        IntervalFunction backoff = policy.getJitter() > 0.0d
                ? IntervalFunction.ofExponentialRandomBackoff(policy.getBaseDelay(), 2.0d, policy.getJitter())
                : IntervalFunction.ofExponentialBackoff(policy.getBaseDelay(), 2.0d);
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(Math.max(1, policy.getMaxAttempts()))
                .intervalFunction(backoff)
                .retryOnException(RetryPolicy::shouldRetry)
                .build();
        Retry retry = retries.retry(dependency, retryConfig);
        logRetries(dependency, retry);

        TimeLimiterConfig limiterConfig = TimeLimiterConfig.custom()
                .timeoutDuration(policy.getTimeout())
                .cancelRunningFuture(false)
                .build();
        TimeLimiter timeLimiter = timeLimiters.timeLimiter(dependency, limiterConfig);

        LOGGER.debug("Created resilience guard for {} (timeout={}, attempts={}, threshold={}, coolDown={})",
                dependency, policy.getTimeout(), policy.getMaxAttempts(), threshold, policy.getCoolDown());
        return new Guard(circuitBreaker, retry, timeLimiter);
    }

    private static Retry conditionalRetry(String dependency, Retry base, AttemptObserver observer) {
        RetryConfig config = RetryConfig.from(base.getRetryConfig())
                .retryOnException(error -> RetryPolicy.shouldRetry(error) && observer.retryAllowed())
                .build();
        Retry retry = Retry.of(dependency, config);
        logRetries(dependency, retry);
        return retry;
    }

    private static void logRetries(String dependency, Retry retry) {
        retry.getEventPublisher().onRetry(event -> LOGGER.warn("Attempt {} for {} failed: {}. Retrying in {} ms",
                event.getNumberOfRetryAttempts(), dependency,
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown",
                event.getWaitInterval().toMillis()));
    }

    private record Guard(CircuitBreaker circuitBreaker, Retry retry, TimeLimiter timeLimiter) {
    }
}
