package ch.so.arp.finrag.llm;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;

class MockLanguageModelTest {

    private static final ToolDefinition SEARCH = new ToolDefinition("search_earnings_transcript", "search",
            JsonNodeFactory.instance.objectNode());

    private final MockLanguageModel model = new MockLanguageModel();

    @Test
    void searchesOnceThenAnswersFromToolResults() {
        ModelResponse first = model.complete(request(List.of(Message.user("AI demand?"))));

        assertThat(first.toolUses()).singleElement().satisfies(toolUse -> {
            assertThat(toolUse.name()).isEqualTo("search_earnings_transcript");
            assertThat(toolUse.input().path("query").asText()).isEqualTo("AI demand?");
        });

        ModelResponse second = model.complete(request(List.of(
                Message.user("AI demand?"),
                Message.assistant("", first.toolUses()),
                Message.toolResults(List.of(new ToolResultBlock("mock_tool_1", "Demand is strong.", false))))));

        assertThat(second.hasToolUses()).isFalse();
        assertThat(second.text()).startsWith("[mocked answer]").contains("Demand is strong.");
    }

    @Test
    void expandsQuotedSubjectForPlainPrompts() {
        ModelResponse response = model.complete(
                CompletionRequest.prompt("Write a passage answering \"gaming margins\"", 100, 0.0d));

        assertThat(response.text()).startsWith("Management discussed gaming margins on the earnings call.");
    }

    @Test
    void streamsWordByWord() {
        List<String> tokens = new ArrayList<>();
        model.stream(new CompletionRequest(null, List.of(Message.user("Q")), List.of(SEARCH), ToolChoice.NONE, 100,
                0.0d), tokens::add);

        assertThat(String.join("", tokens)).isEqualTo("[mocked answer] I could not find data to answer: Q");
        assertThat(tokens).hasSizeGreaterThan(1);
    }

    private static CompletionRequest request(List<Message> messages) {
        return new CompletionRequest("system", messages, List.of(SEARCH), ToolChoice.AUTO, 100, 0.0d);
    }
}
