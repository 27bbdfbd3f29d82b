package ch.so.arp.finrag.sparse;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * Deterministic lexical encoder for hybrid search. Tokens are weighted with a
 * dampened term frequency {@code 1 + ln(tf)} (no IDF, the corpus statistics are
 * not tracked) and hashed into a fixed index space. Tokens colliding on the
 * same index have their weights summed.
 */
public class SparseVectorizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(SparseVectorizer.class);

    public static final int DEFAULT_HASH_SPACE = 1 << 20;

    static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "with", "that", "this", "from", "have", "will", "into",
            "over", "about", "their", "they", "been", "were", "after", "before", "are",
            "was", "has", "had", "its", "our", "what", "how", "can", "you", "your",
            "which", "would", "could", "should", "also", "just", "more", "very", "some",
            "said", "says", "like", "going", "think", "really", "want", "see", "look",
            "things", "thing", "way", "well", "actually", "know", "get", "got", "make");

    private static final int MIN_TOKEN_LENGTH = 3;

    private final int hashSpace;
    private final Cache<String, Optional<SparseVector>> cache;

    public SparseVectorizer() {
        this(DEFAULT_HASH_SPACE, 10_000);
    }

    public SparseVectorizer(int hashSpace, long cacheSize) {
        if (hashSpace <= 0) {
            throw new IllegalArgumentException("hashSpace must be positive");
        }
        this.hashSpace = hashSpace;
        this.cache = Caffeine.newBuilder().maximumSize(cacheSize).build();
        LOGGER.info("Sparse vectorizer hashing into {} buckets", hashSpace);
    }

    /**
     * Encode the text.
     *
     * @param text the text to encode, may be {@code null}
     * @return the sparse vector or {@code null} if no token survives filtering
     */
    public SparseVector encode(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        return cache.get(text, this::compute).orElse(null);
    }

    public int hashSpace() {
        return hashSpace;
    }

    List<String> tokenize(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        StringBuilder cleaned = new StringBuilder(lower.length());
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (Character.isLetterOrDigit(c) || c == '%' || c == '$' || c == '.') {
                cleaned.append(c);
            } else if (Character.isWhitespace(c)) {
                cleaned.append(' ');
            }
        }
        List<String> tokens = new ArrayList<>();
        for (String raw : cleaned.toString().split(" +")) {
            String token = trimDots(raw);
            if (token.length() >= MIN_TOKEN_LENGTH && !STOP_WORDS.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    int indexOf(String token) {
        byte[] digest = md5(token);
        long hash = ((long) (digest[0] & 0xFF) << 24) | ((digest[1] & 0xFF) << 16) | ((digest[2] & 0xFF) << 8)
                | (digest[3] & 0xFF);
        return (int) (hash % hashSpace);
    }

    private Optional<SparseVector> compute(String text) {
        List<String> tokens = tokenize(text);
        if (tokens.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Integer> termFrequencies = new LinkedHashMap<>();
        tokens.forEach(token -> termFrequencies.merge(token, 1, Integer::sum));

        TreeMap<Integer, Double> buckets = new TreeMap<>();
        termFrequencies.forEach((token, count) -> buckets.merge(indexOf(token), 1.0d + Math.log(count), Double::sum));

        int[] indices = new int[buckets.size()];
        double[] weights = new double[buckets.size()];
        int position = 0;
        for (Map.Entry<Integer, Double> bucket : buckets.entrySet()) {
            indices[position] = bucket.getKey();
            weights[position] = bucket.getValue();
            position++;
        }
        return Optional.of(new SparseVector(indices, weights));
    }

    private static String trimDots(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && token.charAt(start) == '.') {
            start++;
        }
        while (end > start && token.charAt(end - 1) == '.') {
            end--;
        }
        return token.substring(start, end);
    }

    private static byte[] md5(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return digest.digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("MD5 algorithm not available", ex);
        }
    }
}
