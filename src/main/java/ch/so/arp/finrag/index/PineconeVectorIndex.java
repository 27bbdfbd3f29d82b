package ch.so.arp.finrag.index;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.JsonNode;

import ch.so.arp.finrag.resilience.HttpFailures;
import ch.so.arp.finrag.resilience.PermanentServiceException;
import ch.so.arp.finrag.sparse.SparseVector;

/**
 * Pinecone index queried through its REST data plane. Hybrid queries follow
 * Pinecone's convex combination: dense values are scaled by {@code alpha} and
 * sparse values by {@code 1 - alpha}, and the dotproduct metric adds both.
 */
class PineconeVectorIndex implements VectorIndex {

    private static final Logger LOGGER = LoggerFactory.getLogger(PineconeVectorIndex.class);

    private static final String SPARSE_UNSUPPORTED = "does not support sparse values";

    private final RestClient restClient;
    private final String namespace;
    private final AtomicBoolean sparseSupported;

    PineconeVectorIndex(RestClient.Builder builder, PineconeClientProperties properties) {
        if (!StringUtils.hasText(properties.getApiKey()) || !StringUtils.hasText(properties.getIndexHost())) {
            throw new IllegalArgumentException(
                    "Properties 'finrag.pinecone.api-key' and 'finrag.pinecone.index-host' must be provided");
        }
        this.restClient = builder
                .baseUrl(properties.getIndexHost())
                .defaultHeader("Api-Key", properties.getApiKey())
                .build();
        this.namespace = properties.getNamespace();
        this.sparseSupported = new AtomicBoolean(properties.isSparseEnabled());
    }

    @Override
    public List<ScoredChunk> query(IndexQuery query) {
        boolean hybrid = query.hybrid() && sparseSupported.get();
        try {
            return execute(query, hybrid);
        } catch (PermanentServiceException ex) {
            if (!hybrid || ex.getMessage() == null
                    || !ex.getMessage().toLowerCase(Locale.ROOT).contains(SPARSE_UNSUPPORTED)) {
                throw ex;
            }
            LOGGER.warn("Pinecone index does not support sparse values. Retrying with dense-only search.");
            sparseSupported.set(false);
            return execute(query, false);
        }
    }

    @Override
    public boolean supportsHybrid() {
        return sparseSupported.get();
    }

    private List<ScoredChunk> execute(IndexQuery query, boolean hybrid) {
        JsonNode response = restClient.post()
                .uri("/query")
                .contentType(MediaType.APPLICATION_JSON)
                .body(requestBody(query, hybrid))
                .retrieve()
                .onStatus(HttpStatusCode::isError, HttpFailures.handler(ResilientVectorIndex.DEPENDENCY))
                .body(JsonNode.class);

        List<ScoredChunk> matches = new ArrayList<>();
        if (response != null) {
            for (JsonNode match : response.path("matches")) {
                matches.add(new ScoredChunk(toChunk(match), match.path("score").asDouble()));
            }
        }
        LOGGER.debug("Pinecone returned {} matches (hybrid={}, filter={})", matches.size(), hybrid, query.filter());
        return matches;
    }

    Map<String, Object> requestBody(IndexQuery query, boolean hybrid) {
        Map<String, Object> body = new LinkedHashMap<>();
        double denseWeight = hybrid ? query.alpha() : 1.0d;
        body.put("vector", scale(query.dense(), denseWeight));
        if (hybrid) {
            SparseVector sparse = query.sparse().scale(1.0d - query.alpha());
            body.put("sparseVector", Map.of("indices", sparse.indices(), "values", sparse.weights()));
        }
        body.put("topK", query.topK());
        body.put("includeMetadata", true);
        if (StringUtils.hasText(namespace)) {
            body.put("namespace", namespace);
        }
        Map<String, Object> filter = toFilter(query.filter());
        if (!filter.isEmpty()) {
            body.put("filter", filter);
        }
        return body;
    }

    private static Map<String, Object> toFilter(MetadataFilter filter) {
        Map<String, Object> conditions = new LinkedHashMap<>();
        if (filter.ticker() != null) {
            conditions.put("ticker", Map.of("$eq", filter.ticker()));
        }
        if (filter.fiscalYear() != null) {
            conditions.put("fiscalYear", Map.of("$eq", filter.fiscalYear()));
        }
        if (filter.quarter() != null) {
            conditions.put("quarter", Map.of("$eq", filter.quarter()));
        }
        return conditions;
    }

    private static float[] scale(float[] values, double factor) {
        float[] scaled = new float[values.length];
        for (int i = 0; i < values.length; i++) {
            scaled[i] = (float) (values[i] * factor);
        }
        return scaled;
    }

    private static Chunk toChunk(JsonNode match) {
        JsonNode metadata = match.path("metadata");
        JsonNode year = metadata.hasNonNull("fiscalYear") ? metadata.get("fiscalYear") : metadata.get("fiscal_year");
        return new Chunk(
                match.path("id").asText(),
                metadata.path("text").asText(""),
                metadata.path("source").asText(""),
                textOrNull(metadata, "ticker"),
                year == null || year.isNull() ? null : year.asInt(),
                textOrNull(metadata, "quarter"),
                metadata.path("section").asText(""));
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
