package ch.so.arp.finrag.llm;

import java.util.List;
import java.util.Objects;

/**
 * Request for one model completion.
 *
 * @param systemPrompt optional system prompt
 * @param messages     conversation so far, must not be empty
 * @param tools        tools the model may call, empty for plain completions
 * @param toolChoice   whether tools may be requested
 * @param maxTokens    output token limit
 * @param temperature  sampling temperature
 */
public record CompletionRequest(
        String systemPrompt,
        List<Message> messages,
        List<ToolDefinition> tools,
        ToolChoice toolChoice,
        int maxTokens,
        double temperature) {

    public CompletionRequest {
        Objects.requireNonNull(messages, "messages");
        if (messages.isEmpty()) {
            throw new IllegalArgumentException("messages must not be empty");
        }
        messages = List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
        toolChoice = toolChoice == null ? ToolChoice.AUTO : toolChoice;
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
    }

    /**
     * Single-turn prompt without tools.
     */
    public static CompletionRequest prompt(String userPrompt, int maxTokens, double temperature) {
        return new CompletionRequest(null, List.of(Message.user(userPrompt)), List.of(), ToolChoice.NONE, maxTokens,
                temperature);
    }

    public String lastUserText() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message message = messages.get(i);
            if (message.role() == Role.USER && !message.text().isBlank()) {
                return message.text();
            }
        }
        return "";
    }
}
