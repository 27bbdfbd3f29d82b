package ch.so.arp.finrag.embedding;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.JsonNode;

import ch.so.arp.finrag.resilience.HttpFailures;
import ch.so.arp.finrag.resilience.TransientServiceException;

/**
 * Embeds texts with the Voyage AI embeddings endpoint.
 */
class VoyageEmbeddingService implements EmbeddingService {

    private static final Logger LOGGER = LoggerFactory.getLogger(VoyageEmbeddingService.class);

    static final String DEPENDENCY = "embedding";

    private final RestClient restClient;
    private final VoyageClientProperties properties;

    VoyageEmbeddingService(RestClient.Builder builder, VoyageClientProperties properties) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalArgumentException(
                    "Property 'finrag.voyage.api-key' must be provided when mock embeddings are disabled");
        }
        this.properties = properties;
        this.restClient = builder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + properties.getApiKey())
                .build();
    }

    @Override
    public float[] embed(String text, EmbeddingKind kind) {
        LOGGER.debug("Embedding {} text of {} chars with {}", kind.wireName(), text.length(), properties.getModel());
        JsonNode response = restClient.post()
                .uri("/embeddings")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of(
                        "input", List.of(text),
                        "model", properties.getModel(),
                        "input_type", kind.wireName()))
                .retrieve()
                .onStatus(HttpStatusCode::isError, HttpFailures.handler(DEPENDENCY))
                .body(JsonNode.class);

        JsonNode embedding = response == null ? null : response.path("data").path(0).path("embedding");
        if (embedding == null || !embedding.isArray() || embedding.isEmpty()) {
            throw new TransientServiceException(DEPENDENCY, "Voyage returned an empty embedding");
        }
        float[] vector = new float[embedding.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) embedding.get(i).asDouble();
        }
        return vector;
    }
}
