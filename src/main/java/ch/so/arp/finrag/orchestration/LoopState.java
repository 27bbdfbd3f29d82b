package ch.so.arp.finrag.orchestration;

/**
 * Phases of the orchestration loop.
 */
public enum LoopState {
    PLANNING,
    EXECUTING_TOOLS,
    STREAMING_FINAL,
    TERMINATED
}
