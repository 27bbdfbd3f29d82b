package ch.so.arp.finrag.llm;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Deterministic {@link LanguageModel} used in tests and local development
 * where the Anthropic API should not be contacted. With tools available it
 * asks for one transcript search, then answers from the tool results.
 */
class MockLanguageModel implements LanguageModel {

    private static final Pattern QUOTED = Pattern.compile("\"([^\"]{3,})\"");
    private static final int MAX_RESULT_LENGTH = 600;

    @Override
    public ModelResponse complete(CompletionRequest request) {
        if (request.toolChoice() == ToolChoice.AUTO && !request.tools().isEmpty()) {
            Optional<ToolDefinition> search = request.tools().stream()
                    .filter(tool -> tool.name().contains("search"))
                    .findFirst();
            if (search.isPresent() && !hasCalled(request, search.get().name())) {
                ObjectNode input = JsonNodeFactory.instance.objectNode();
                input.put("query", request.lastUserText());
                return ModelResponse.toolUses(List.of(new ToolUse("mock_tool_1", search.get().name(), input)));
            }
        }
        if (request.tools().isEmpty()) {
            return ModelResponse.text(expand(subject(request.lastUserText())));
        }
        return ModelResponse.text(answer(request));
    }

    @Override
    public void stream(CompletionRequest request, Consumer<String> tokenConsumer) {
        String text = complete(request).text();
        for (String word : text.split("(?<= )")) {
            tokenConsumer.accept(word);
        }
    }

    private static boolean hasCalled(CompletionRequest request, String toolName) {
        return request.messages().stream()
                .flatMap(message -> message.toolUses().stream())
                .anyMatch(toolUse -> toolUse.name().equals(toolName));
    }

    private static String subject(String prompt) {
        Matcher matcher = QUOTED.matcher(prompt);
        return matcher.find() ? matcher.group(1) : prompt.trim();
    }

    private static String expand(String subject) {
        return String.join("\n",
                "Management discussed " + subject + " on the earnings call.",
                "Reported financial results related to " + subject + ".",
                "Analyst questions and guidance about " + subject + ".");
    }

    private static String answer(CompletionRequest request) {
        List<String> results = new ArrayList<>();
        for (Message message : request.messages()) {
            for (ToolResultBlock result : message.toolResults()) {
                if (!result.isError() && !result.content().isBlank()) {
                    results.add(abbreviate(result.content()));
                }
            }
        }
        String question = firstUserText(request);
        if (results.isEmpty()) {
            return "[mocked answer] I could not find data to answer: " + question;
        }
        return "[mocked answer] For \"" + question + "\" the retrieved data shows:\n" + String.join("\n", results);
    }

    private static String firstUserText(CompletionRequest request) {
        return request.messages().stream()
                .filter(message -> message.role() == Role.USER && !message.text().isBlank())
                .map(Message::text)
                .findFirst()
                .orElse("");
    }

    private static String abbreviate(String text) {
        return text.length() <= MAX_RESULT_LENGTH ? text : text.substring(0, MAX_RESULT_LENGTH) + "...";
    }
}
