package ch.so.arp.finrag.llm;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ch.so.arp.finrag.resilience.HttpFailures;
import ch.so.arp.finrag.resilience.PermanentServiceException;
import ch.so.arp.finrag.resilience.TransientServiceException;

/**
 * {@link LanguageModel} backed by the Anthropic Messages API. Completions are
 * plain JSON requests, streaming reads the server-sent events and forwards
 * every {@code text_delta}.
 */
class AnthropicLanguageModel implements LanguageModel {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnthropicLanguageModel.class);

    static final String DEPENDENCY = "anthropic";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final AnthropicClientProperties properties;

    AnthropicLanguageModel(RestClient.Builder builder, ObjectMapper objectMapper,
            AnthropicClientProperties properties) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalArgumentException(
                    "Property 'finrag.anthropic.api-key' must be provided when the mock model is disabled");
        }
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.restClient = builder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader("x-api-key", properties.getApiKey())
                .defaultHeader("anthropic-version", properties.getVersion())
                .build();
    }

    @Override
    public ModelResponse complete(CompletionRequest request) {
        LOGGER.debug("Completion with model {} ({} messages, {} tools, tool choice {})", properties.getModel(),
                request.messages().size(), request.tools().size(), request.toolChoice().wireName());
        JsonNode response = restClient.post()
                .uri("/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .body(requestBody(request, false))
                .retrieve()
                .onStatus(HttpStatusCode::isError, HttpFailures.handler(DEPENDENCY))
                .body(JsonNode.class);
        if (response == null) {
            throw new TransientServiceException(DEPENDENCY, "Anthropic returned an empty response");
        }
        return parseResponse(response);
    }

    @Override
    public void stream(CompletionRequest request, Consumer<String> tokenConsumer) {
        LOGGER.debug("Streaming completion with model {}", properties.getModel());
        restClient.post()
                .uri("/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .body(requestBody(request, true))
                .exchange((httpRequest, response) -> {
                    if (response.getStatusCode().isError()) {
                        HttpFailures.handler(DEPENDENCY).handle(httpRequest, response);
                    }
                    readEvents(response.getBody(), tokenConsumer);
                    return null;
                });
    }

    ObjectNode requestBody(CompletionRequest request, boolean stream) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", properties.getModel());
        body.put("max_tokens", request.maxTokens());
        body.put("temperature", request.temperature());
        if (StringUtils.hasText(request.systemPrompt())) {
            body.put("system", request.systemPrompt());
        }
        ArrayNode messages = body.putArray("messages");
        for (Message message : request.messages()) {
            messages.add(toWire(message));
        }
        if (!request.tools().isEmpty()) {
            ArrayNode tools = body.putArray("tools");
            for (ToolDefinition tool : request.tools()) {
                ObjectNode node = tools.addObject();
                node.put("name", tool.name());
                node.put("description", tool.description());
                node.set("input_schema", tool.inputSchema());
            }
            body.putObject("tool_choice").put("type", request.toolChoice().wireName());
        }
        if (stream) {
            body.put("stream", true);
        }
        return body;
    }

    private ObjectNode toWire(Message message) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("role", message.role().wireName());
        if (message.toolUses().isEmpty() && message.toolResults().isEmpty()) {
            node.put("content", message.text());
            return node;
        }
        ArrayNode content = node.putArray("content");
        if (message.role() == Role.ASSISTANT && !message.text().isBlank()) {
            content.addObject().put("type", "text").put("text", message.text());
        }
        for (ToolUse toolUse : message.toolUses()) {
            ObjectNode block = content.addObject();
            block.put("type", "tool_use");
            block.put("id", toolUse.id());
            block.put("name", toolUse.name());
            block.set("input", toolUse.input());
        }
        for (ToolResultBlock result : message.toolResults()) {
            ObjectNode block = content.addObject();
            block.put("type", "tool_result");
            block.put("tool_use_id", result.toolUseId());
            block.put("content", result.content());
            if (result.isError()) {
                block.put("is_error", true);
            }
        }
        // tool results have to precede any text in a user turn
        if (message.role() == Role.USER && !message.text().isBlank()) {
            content.addObject().put("type", "text").put("text", message.text());
        }
        return node;
    }

    private ModelResponse parseResponse(JsonNode response) {
        StringBuilder text = new StringBuilder();
        List<ToolUse> toolUses = new ArrayList<>();
        for (JsonNode block : response.path("content")) {
            String type = block.path("type").asText();
            if ("text".equals(type)) {
                text.append(block.path("text").asText());
            } else if ("tool_use".equals(type)) {
                toolUses.add(new ToolUse(block.path("id").asText(), block.path("name").asText(), block.get("input")));
            }
        }
        JsonNode usage = response.path("usage");
        return new ModelResponse(text.toString(), toolUses,
                new TokenUsage(usage.path("input_tokens").asInt(), usage.path("output_tokens").asInt()),
                response.path("stop_reason").asText(null));
    }

    private void readEvents(InputStream body, Consumer<String> tokenConsumer) throws IOException {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new IOException("Stream interrupted");
                }
                if (!line.startsWith("data:")) {
                    continue;
                }
                String data = line.substring("data:".length()).trim();
                if (data.isEmpty() || "[DONE]".equals(data)) {
                    continue;
                }
                handleEvent(parse(data), tokenConsumer);
            }
        }
    }

    private void handleEvent(JsonNode event, Consumer<String> tokenConsumer) {
        String type = event.path("type").asText();
        if ("content_block_delta".equals(type)) {
            JsonNode delta = event.path("delta");
            if ("text_delta".equals(delta.path("type").asText())) {
                String text = delta.path("text").asText();
                if (!text.isEmpty()) {
                    tokenConsumer.accept(text);
                }
            }
        } else if ("error".equals(type)) {
            String errorType = event.path("error").path("type").asText();
            String message = event.path("error").path("message").asText("Anthropic stream error");
            if ("overloaded_error".equals(errorType) || "api_error".equals(errorType)) {
                throw new TransientServiceException(DEPENDENCY, message);
            }
            throw new PermanentServiceException(DEPENDENCY, message);
        }
    }

    private JsonNode parse(String data) {
        try {
            return objectMapper.readTree(data);
        } catch (JsonProcessingException ex) {
            throw new PermanentServiceException(DEPENDENCY, 0, "Malformed stream event: " + data, ex);
        }
    }
}
