package ch.so.arp.finrag.orchestration;

import java.util.List;
import java.util.Objects;

import ch.so.arp.finrag.llm.Message;
import ch.so.arp.finrag.retrieval.StrategyType;

/**
 * A question to answer together with the prior conversation.
 *
 * @param requestId identifier echoed in the {@code metadata} and {@code end}
 *                  frames
 * @param message   the user's question
 * @param history   earlier user and assistant turns, oldest first
 * @param strategy  retrieval strategy directive, {@code null} for the default
 * @param tickers   tickers selected by the caller; detected from the question
 *                  when empty
 */
public record ChatTurn(String requestId, String message, List<Message> history, StrategyType strategy,
        List<String> tickers) {

    public ChatTurn {
        Objects.requireNonNull(requestId, "requestId");
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message must not be blank");
        }
        history = history == null ? List.of() : List.copyOf(history);
        tickers = tickers == null ? List.of() : List.copyOf(tickers);
    }
}
