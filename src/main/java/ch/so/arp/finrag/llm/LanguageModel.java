package ch.so.arp.finrag.llm;

import java.util.function.Consumer;

/**
 * Abstraction over the language model. Implementations either call the
 * Anthropic Messages API or return predictable responses for development and
 * tests.
 */
public interface LanguageModel {

    /**
     * Run one completion.
     *
     * @param request system prompt, messages and optional tools
     * @return text and tool invocations of the model's turn
     */
    ModelResponse complete(CompletionRequest request);

    /**
     * Stream a plain text completion.
     *
     * @param request       system prompt and messages; tools are declared but
     *                      the answer is expected to be text
     * @param tokenConsumer callback invoked for every text delta
     */
    void stream(CompletionRequest request, Consumer<String> tokenConsumer);
}
