package ch.so.arp.finrag.resilience;

/**
 * Follows the attempts of a single call made through
 * {@link ResilientCallExecutor}.
 */
public interface AttemptObserver {

    /**
     * Whether a failed attempt may be retried. Asked after every retryable
     * failure.
     */
    boolean retryAllowed();

    /**
     * The running attempt exceeded its time limit or the caller was
     * interrupted. Called before the attempt is cancelled; the attempt may
     * still be running.
     */
    void abandoned();
}
