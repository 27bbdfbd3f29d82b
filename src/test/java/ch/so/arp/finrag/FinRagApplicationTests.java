package ch.so.arp.finrag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class FinRagApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void retrievesFilteredTranscriptChunks() throws Exception {
        mockMvc.perform(post("/api/retrieval")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"query": "AMD Q3 2024 revenue", "strategy": "dense-only", "topK": 3,
                         "ticker": "AMD", "fiscalYear": 2024, "quarter": "Q3"}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.strategy").value("dense-only"))
                .andExpect(jsonPath("$.autoSelected").value(false))
                .andExpect(jsonPath("$.chunks.length()").value(3))
                .andExpect(jsonPath("$.chunks[*].chunk.ticker").value(everyItem(is("AMD"))))
                .andExpect(jsonPath("$.chunks[*].chunk.quarter").value(everyItem(is("Q3"))));
    }

    @Test
    void rejectsInvalidRetrievalRequests() throws Exception {
        mockMvc.perform(post("/api/retrieval")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"query": " ", "topK": 500}
                        """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void reportsHealth() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void streamsChatFrames() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .content("""
                        {"message": "What did AMD say about data center revenue?"}
                        """))
                .andExpect(request().asyncStarted())
                .andReturn();
        result.getAsyncResult(10_000);

        String body = result.getResponse().getContentAsString(StandardCharsets.UTF_8);
        assertThat(body)
                .startsWith("data:{\"type\":\"metadata\"")
                .contains("\"id\":\"auto-financials\"")
                .contains("\"tool\":\"search_earnings_transcript\"")
                .contains("\"type\":\"content\"")
                .contains("\"type\":\"metrics\"");
        assertThat(body.indexOf("\"type\":\"end\"")).isGreaterThan(body.lastIndexOf("\"type\":\"content\""));
        assertThat(body).doesNotContain("\"type\":\"error\"");
    }

    @Test
    void rejectsBlankChatMessages() throws Exception {
        mockMvc.perform(post("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"message": ""}
                        """))
                .andExpect(status().isBadRequest());
    }
}
