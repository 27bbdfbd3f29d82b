package ch.so.arp.finrag.index;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.finrag.sparse.SparseVector;

/**
 * Vector index kept in memory. It scores natively in hybrid mode with
 * {@code alpha * denseCosine + (1 - alpha) * sparseCosine}, which makes it a
 * stand-in for a hosted hybrid index during development and in tests.
 */
public class InMemoryVectorIndex implements VectorIndex {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryVectorIndex.class);

    private final List<Entry> entries = new CopyOnWriteArrayList<>();

    /**
     * Add a chunk with its precomputed vectors.
     *
     * @param sparse may be {@code null} if the text produced no keywords
     */
    public void add(Chunk chunk, float[] dense, SparseVector sparse) {
        Objects.requireNonNull(chunk, "chunk");
        Objects.requireNonNull(dense, "dense");
        entries.removeIf(entry -> entry.chunk().id().equals(chunk.id()));
        entries.add(new Entry(chunk, dense.clone(), sparse));
    }

    public int size() {
        return entries.size();
    }

    @Override
    public List<ScoredChunk> query(IndexQuery query) {
        boolean hybrid = query.hybrid();
        List<ScoredChunk> matches = entries.stream()
                .filter(entry -> query.filter().matches(entry.chunk()))
                .map(entry -> new ScoredChunk(entry.chunk(), score(entry, query, hybrid)))
                .sorted(Comparator.comparingDouble(ScoredChunk::score).reversed())
                .limit(query.topK())
                .toList();
        LOGGER.debug("In-memory index returned {} of {} chunks (hybrid={}, filter={})", matches.size(),
                entries.size(), hybrid, query.filter());
        return matches;
    }

    @Override
    public boolean supportsHybrid() {
        return true;
    }

    private double score(Entry entry, IndexQuery query, boolean hybrid) {
        double dense = cosine(query.dense(), entry.dense());
        if (!hybrid) {
            return dense;
        }
        double sparse = entry.sparse() == null ? 0.0d : query.sparse().cosine(entry.sparse());
        return query.alpha() * dense + (1.0d - query.alpha()) * sparse;
    }

    static double cosine(float[] left, float[] right) {
        int length = Math.min(left.length, right.length);
        double dot = 0.0d;
        double leftNorm = 0.0d;
        double rightNorm = 0.0d;
        for (int i = 0; i < length; i++) {
            dot += left[i] * right[i];
            leftNorm += left[i] * left[i];
            rightNorm += right[i] * right[i];
        }
        if (leftNorm == 0.0d || rightNorm == 0.0d) {
            return 0.0d;
        }
        return dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
    }

    private record Entry(Chunk chunk, float[] dense, SparseVector sparse) {
    }
}
