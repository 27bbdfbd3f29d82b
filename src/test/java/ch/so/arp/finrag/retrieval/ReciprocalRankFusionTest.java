package ch.so.arp.finrag.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;

import org.junit.jupiter.api.Test;

import ch.so.arp.finrag.index.Chunk;

class ReciprocalRankFusionTest {

    @Test
    void scoresByReciprocalRank() {
        List<RankedChunk> fused = ReciprocalRankFusion.fuse(List.of(List.of(ranked("a"), ranked("b"))), 60,
                StrategyType.MULTI_QUERY);

        assertThat(fused).extracting(ranked -> ranked.chunk().id()).containsExactly("a", "b");
        assertThat(fused.get(0).score()).isCloseTo(1.0d / 61, within(1e-12));
        assertThat(fused.get(1).score()).isCloseTo(1.0d / 62, within(1e-12));
        assertThat(fused).allSatisfy(ranked -> assertThat(ranked.origin()).isEqualTo(StrategyType.MULTI_QUERY));
    }

    @Test
    void rewardsChunksFoundBySeveralQueries() {
        List<RankedChunk> fused = ReciprocalRankFusion.fuse(List.of(
                List.of(ranked("a"), ranked("b")),
                List.of(ranked("c"), ranked("b"))), 60, StrategyType.MULTI_QUERY);

        assertThat(fused.get(0).chunk().id()).isEqualTo("b");
        assertThat(fused.get(0).score()).isCloseTo(2.0d / 62, within(1e-12));
    }

    @Test
    void countsDuplicatesWithinOneListOnlyOnce() {
        List<RankedChunk> fused = ReciprocalRankFusion.fuse(List.of(List.of(ranked("a"), ranked("a"), ranked("b"))),
                60, StrategyType.MULTI_QUERY);

        assertThat(fused).hasSize(2);
        assertThat(fused.get(0).score()).isCloseTo(1.0d / 61, within(1e-12));
        assertThat(fused.get(1).score()).isCloseTo(1.0d / 62, within(1e-12));
    }

    @Test
    void keepsFirstSeenOrderOnTies() {
        List<RankedChunk> fused = ReciprocalRankFusion.fuse(List.of(List.of(ranked("x")), List.of(ranked("y"))), 60,
                StrategyType.MULTI_QUERY);

        assertThat(fused).extracting(ranked -> ranked.chunk().id()).containsExactly("x", "y");
    }

    @Test
    void rejectsNegativeK() {
        assertThatThrownBy(() -> ReciprocalRankFusion.fuse(List.of(), -1, StrategyType.MULTI_QUERY))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static RankedChunk ranked(String id) {
        return new RankedChunk(new Chunk(id, "text " + id, "source", "AMD", 2024, "Q3", "Prepared Remarks"), 0.5d,
                StrategyType.DENSE);
    }
}
