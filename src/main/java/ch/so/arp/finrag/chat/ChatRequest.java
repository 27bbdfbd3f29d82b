package ch.so.arp.finrag.chat;

import java.util.List;
import java.util.Locale;

import ch.so.arp.finrag.llm.Message;
import ch.so.arp.finrag.llm.Role;
import ch.so.arp.finrag.retrieval.StrategyType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Incoming payload for chat requests.
 *
 * @param message     the question
 * @param chatHistory earlier turns, oldest first
 * @param strategy    optional retrieval strategy directive
 * @param tickers     optional tickers, detected from the message when empty
 */
public record ChatRequest(
        @NotBlank @Size(max = 4000) String message,
        @Valid List<HistoryMessage> chatHistory,
        StrategyType strategy,
        List<String> tickers) {

    public ChatRequest {
        chatHistory = chatHistory == null ? List.of() : List.copyOf(chatHistory);
        tickers = tickers == null ? List.of() : tickers.stream()
                .filter(ticker -> ticker != null && !ticker.isBlank())
                .map(ticker -> ticker.trim().toUpperCase(Locale.ROOT))
                .toList();
    }

    List<Message> history() {
        return chatHistory.stream().map(HistoryMessage::toMessage).toList();
    }

    /**
     * A prior turn as sent by the chat UI.
     */
    public record HistoryMessage(@NotBlank String role, @NotBlank String content) {

        Message toMessage() {
            return "assistant".equalsIgnoreCase(role) ? Message.assistant(content) : Message.user(content);
        }
    }
}
