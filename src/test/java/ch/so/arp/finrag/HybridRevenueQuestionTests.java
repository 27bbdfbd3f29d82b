package ch.so.arp.finrag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.notNullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Answers a revenue question from an index holding a single AMD chunk, with
 * the financial statement prefetch switched off so the figure can only come
 * from the transcript.
 */
@SpringBootTest(properties = {
        "finrag.index.chunks-location=classpath:scenario/amd-revenue-chunk.json",
        "finrag.orchestration.prefetch-financials=false" })
@AutoConfigureMockMvc
class HybridRevenueQuestionTests {

    private static final String QUESTION = "What was AMD's Q3 2024 revenue?";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void ranksRevenueChunkFirst() throws Exception {
        mockMvc.perform(post("/api/retrieval")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"query": "What was AMD's Q3 2024 revenue?", "strategy": "hybrid-bm25"}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.strategy").value("hybrid-bm25"))
                .andExpect(jsonPath("$.chunks[0].chunk.id").value("amd-2024-q3-revenue"))
                .andExpect(jsonPath("$.chunks[0].score").value(notNullValue()));
    }

    @Test
    void streamsAnswerCitingRevenueFigure() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .content("""
                        {"message": "%s", "strategy": "hybrid-bm25"}
                        """.formatted(QUESTION)))
                .andExpect(request().asyncStarted())
                .andReturn();
        result.getAsyncResult(10_000);

        List<JsonNode> frames = frames(result.getResponse().getContentAsString(StandardCharsets.UTF_8));

        JsonNode toolResult = frames.stream()
                .filter(frame -> "tool_result".equals(frame.path("type").asText()))
                .findFirst()
                .orElseThrow();
        assertThat(toolResult.path("success").asBoolean()).isTrue();
        JsonNode first = toolResult.path("result").path("results").path(0);
        assertThat(first.path("id").asText()).isEqualTo("amd-2024-q3-revenue");
        assertThat(first.path("score").isNumber()).isTrue();
        assertThat(toolResult.path("result").path("strategy").asText()).isEqualTo("hybrid-bm25");

        StringBuilder answer = new StringBuilder();
        frames.stream()
                .filter(frame -> "content".equals(frame.path("type").asText()))
                .forEach(frame -> answer.append(frame.path("content").asText()));
        assertThat(answer.toString()).contains("$6.8B");
        assertThat(frames.get(frames.size() - 1).path("type").asText()).isEqualTo("end");
    }

    private List<JsonNode> frames(String body) throws Exception {
        List<JsonNode> frames = new ArrayList<>();
        for (String line : body.split("\n")) {
            if (line.startsWith("data:")) {
                frames.add(objectMapper.readTree(line.substring("data:".length())));
            }
        }
        return frames;
    }
}
