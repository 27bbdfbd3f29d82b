package ch.so.arp.finrag.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import ch.so.arp.finrag.index.Chunk;

/**
 * Reciprocal rank fusion. A chunk scores {@code sum(1 / (rank + k))} over the
 * lists containing it, with 1-based ranks. Chunks are identified by id; a
 * chunk listed twice in one list only counts at its best rank.
 */
public final class ReciprocalRankFusion {

    public static final int DEFAULT_K = 60;

    private ReciprocalRankFusion() {
    }

    /**
     * Fuse ranked lists.
     *
     * @param lists  ranked lists, best first
     * @param k      damping constant
     * @param origin strategy recorded on the fused chunks
     * @return fused chunks by descending score; ties keep first-seen order
     */
    public static List<RankedChunk> fuse(List<List<RankedChunk>> lists, int k, StrategyType origin) {
        if (k < 0) {
            throw new IllegalArgumentException("k must not be negative: " + k);
        }
        Map<String, Chunk> chunks = new LinkedHashMap<>();
        Map<String, Double> scores = new LinkedHashMap<>();
        for (List<RankedChunk> list : lists) {
            Set<String> seen = new HashSet<>();
            int rank = 0;
            for (RankedChunk ranked : list) {
                String id = ranked.chunk().id();
                if (!seen.add(id)) {
                    continue;
                }
                rank++;
                chunks.putIfAbsent(id, ranked.chunk());
                scores.merge(id, 1.0d / (rank + k), Double::sum);
            }
        }
        List<RankedChunk> fused = new ArrayList<>(scores.size());
        scores.forEach((id, score) -> fused.add(new RankedChunk(chunks.get(id), score, origin)));
        fused.sort(Comparator.comparingDouble(RankedChunk::score).reversed());
        return fused;
    }
}
