package ch.so.arp.finrag.index;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.finrag.embedding.EmbeddingKind;
import ch.so.arp.finrag.embedding.EmbeddingService;
import ch.so.arp.finrag.sparse.SparseVectorizer;

/**
 * Reads transcript chunks from JSON resources (one array of chunks per file)
 * and adds them, embedded as documents, to an {@link InMemoryVectorIndex}.
 */
class ChunkCorpusLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChunkCorpusLoader.class);

    private static final TypeReference<List<Chunk>> CHUNK_LIST = new TypeReference<>() {
    };

    private final ResourcePatternResolver resolver;
    private final ObjectMapper objectMapper;
    private final EmbeddingService embeddingService;
    private final SparseVectorizer vectorizer;

    ChunkCorpusLoader(ResourcePatternResolver resolver, ObjectMapper objectMapper,
            EmbeddingService embeddingService, SparseVectorizer vectorizer) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.embeddingService = Objects.requireNonNull(embeddingService, "embeddingService");
        this.vectorizer = Objects.requireNonNull(vectorizer, "vectorizer");
    }

    List<Chunk> read(String locationPattern) {
        List<Chunk> chunks = new ArrayList<>();
        try {
            for (Resource resource : resolver.getResources(locationPattern)) {
                try (InputStream input = resource.getInputStream()) {
                    chunks.addAll(objectMapper.readValue(input, CHUNK_LIST));
                }
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Could not read chunks from " + locationPattern, ex);
        }
        return chunks;
    }

    void load(String locationPattern, InMemoryVectorIndex index) {
        List<Chunk> chunks = read(locationPattern);
        for (Chunk chunk : chunks) {
            index.add(chunk, embeddingService.embed(chunk.text(), EmbeddingKind.DOCUMENT),
                    vectorizer.encode(chunk.text()));
        }
        LOGGER.info("Seeded in-memory index with {} chunks from {}", chunks.size(), locationPattern);
    }
}
