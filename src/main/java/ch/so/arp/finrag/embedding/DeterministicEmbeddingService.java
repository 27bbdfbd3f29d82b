package ch.so.arp.finrag.embedding;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic embedding service that sums one seeded random direction per
 * token and normalises the result. Texts sharing words end up close to each
 * other, which keeps local development and tests meaningful without external
 * API calls.
 */
class DeterministicEmbeddingService implements EmbeddingService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeterministicEmbeddingService.class);

    private final int dimensions;

    DeterministicEmbeddingService(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
        LOGGER.info("Using deterministic embeddings with {} dimensions", dimensions);
    }

    @Override
    public float[] embed(String text, EmbeddingKind kind) {
        double[] sum = new double[dimensions];
        String normalized = text == null ? "" : text.toLowerCase(Locale.ROOT);
        for (String token : normalized.split("[^\\p{L}\\p{N}]+")) {
            if (token.length() < 3) {
                continue;
            }
            Random random = new Random(bytesToLong(sha256(token)));
            for (int i = 0; i < dimensions; i++) {
                sum[i] += (random.nextDouble() * 2.0d) - 1.0d;
            }
        }
        double norm = 0.0d;
        for (double value : sum) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);
        float[] vector = new float[dimensions];
        for (int i = 0; i < dimensions; i++) {
            vector[i] = norm > 0 ? (float) (sum[i] / norm) : 0.0f;
        }
        return vector;
    }

    private byte[] sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }

    private long bytesToLong(byte[] bytes) {
        long result = 0L;
        for (int i = 0; i < Math.min(8, bytes.length); i++) {
            result = (result << 8) | (bytes[i] & 0xFF);
        }
        return result;
    }
}
