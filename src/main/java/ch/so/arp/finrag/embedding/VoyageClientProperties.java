package ch.so.arp.finrag.embedding;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the Voyage AI embedding API.
 */
@ConfigurationProperties(prefix = "finrag.voyage")
public class VoyageClientProperties {

    /**
     * API key that authorises requests against the Voyage service.
     */
    private String apiKey;

    /**
     * Base URL for the API.
     */
    private String baseUrl = "https://api.voyageai.com/v1";

    /**
     * Name of the embedding model.
     */
    private String model = "voyage-3.5";

    /**
     * Dimensions of the vectors produced by the model. The deterministic
     * embeddings use the same value so indices stay interchangeable.
     */
    private int dimensions = 1024;

    /**
     * Number of embeddings kept in memory.
     */
    private long cacheSize = 100;

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getDimensions() {
        return dimensions;
    }

    public void setDimensions(int dimensions) {
        this.dimensions = dimensions;
    }

    public long getCacheSize() {
        return cacheSize;
    }

    public void setCacheSize(long cacheSize) {
        this.cacheSize = cacheSize;
    }
}
