package ch.so.arp.finrag.index;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for a Pinecone serverless index.
 */
@ConfigurationProperties(prefix = "finrag.pinecone")
public class PineconeClientProperties {

    /**
     * API key sent in the {@code Api-Key} header.
     */
    private String apiKey;

    /**
     * Data plane host of the index, e.g.
     * {@code https://earnings-abc123.svc.us-east-1.pinecone.io}.
     */
    private String indexHost;

    /**
     * Optional namespace inside the index.
     */
    private String namespace;

    /**
     * Whether the index was created with the dotproduct metric and accepts
     * sparse values. Turned off automatically when Pinecone rejects them.
     */
    private boolean sparseEnabled = true;

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getIndexHost() {
        return indexHost;
    }

    public void setIndexHost(String indexHost) {
        this.indexHost = indexHost;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public boolean isSparseEnabled() {
        return sparseEnabled;
    }

    public void setSparseEnabled(boolean sparseEnabled) {
        this.sparseEnabled = sparseEnabled;
    }
}
