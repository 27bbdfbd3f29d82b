package ch.so.arp.finrag.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.finrag.sparse.SparseVector;
import ch.so.arp.finrag.sparse.SparseVectorizer;

class InMemoryVectorIndexTest {

    private static final Chunk AMD_Q3 = new Chunk("amd-q3", "AMD data center", "call", "AMD", 2024, "Q3", "prepared");
    private static final Chunk AMD_Q2 = new Chunk("amd-q2", "AMD client", "call", "AMD", 2024, "Q2", "prepared");
    private static final Chunk NVDA = new Chunk("nvda-q3", "NVIDIA Blackwell", "call", "NVDA", 2025, "Q3", "qa");

    @Test
    void ranksByDenseCosineWithinTheFilter() {
        InMemoryVectorIndex index = new InMemoryVectorIndex();
        index.add(AMD_Q3, new float[] { 1.0f, 0.0f }, null);
        index.add(AMD_Q2, new float[] { 0.6f, 0.8f }, null);
        index.add(NVDA, new float[] { 1.0f, 0.0f }, null);

        List<ScoredChunk> matches = index.query(
                IndexQuery.dense(new float[] { 1.0f, 0.0f }, 5, MetadataFilter.forTicker("amd")));

        assertThat(matches).extracting(match -> match.chunk().id()).containsExactly("amd-q3", "amd-q2");
        assertThat(matches.get(1).score()).isCloseTo(0.6d, within(1e-6d));
        assertThat(index.query(IndexQuery.dense(new float[] { 1.0f, 0.0f }, 5,
                new MetadataFilter("AMD", 2024, "q2")))).extracting(match -> match.chunk().id())
                .containsExactly("amd-q2");
    }

    @Test
    void blendsDenseAndSparseScores() {
        InMemoryVectorIndex index = new InMemoryVectorIndex();
        index.add(AMD_Q3, new float[] { 1.0f, 0.0f }, new SparseVector(new int[] { 7 }, new double[] { 1.0d }));
        index.add(AMD_Q2, new float[] { 0.0f, 1.0f }, new SparseVector(new int[] { 3 }, new double[] { 1.0d }));

        SparseVector sparse = new SparseVector(new int[] { 3 }, new double[] { 2.0d });
        List<ScoredChunk> matches = index.query(
                new IndexQuery(new float[] { 1.0f, 0.0f }, sparse, 0.4d, 2, MetadataFilter.none()));

        assertThat(matches).extracting(match -> match.chunk().id()).containsExactly("amd-q2", "amd-q3");
        assertThat(matches.get(0).score()).isCloseTo(0.6d, within(1e-9d));
        assertThat(matches.get(1).score()).isCloseTo(0.4d, within(1e-9d));
    }

    @Test
    void replacesChunksWithTheSameId() {
        InMemoryVectorIndex index = new InMemoryVectorIndex();
        index.add(AMD_Q3, new float[] { 1.0f }, null);
        index.add(AMD_Q3, new float[] { 0.5f }, null);

        assertThat(index.size()).isEqualTo(1);
    }

    @Test
    void seedsBundledCorpus() {
        InMemoryVectorIndex index = new InMemoryVectorIndex();
        new ChunkCorpusLoader(new PathMatchingResourcePatternResolver(), new ObjectMapper(),
                (text, kind) -> new float[] { text.length(), 1.0f }, new SparseVectorizer(1 << 12, 10))
                .load("classpath:chunks/*.json", index);

        assertThat(index.size()).isEqualTo(15);
        assertThat(index.query(IndexQuery.dense(new float[] { 1.0f, 1.0f }, 20, MetadataFilter.forTicker("MSFT"))))
                .hasSize(2);
    }
}
