package ch.so.arp.finrag.index;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the in-memory index.
 */
@ConfigurationProperties(prefix = "finrag.index")
public class VectorIndexProperties {

    /**
     * Resource pattern of the JSON chunk files used to seed the in-memory
     * index.
     */
    private String chunksLocation = "classpath:chunks/*.json";

    public String getChunksLocation() {
        return chunksLocation;
    }

    public void setChunksLocation(String chunksLocation) {
        this.chunksLocation = chunksLocation;
    }
}
