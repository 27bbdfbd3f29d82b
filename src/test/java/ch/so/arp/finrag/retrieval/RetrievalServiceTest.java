package ch.so.arp.finrag.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import ch.so.arp.finrag.index.Chunk;
import ch.so.arp.finrag.index.MetadataFilter;

class RetrievalServiceTest {

    private final StrategyClassifier classifier = new StrategyClassifier(new RetrievalProperties().getAuto().toRules());

    @Test
    void classifiesAutoQueriesAndMarksTheResult() {
        RecordingStrategy hybrid = new RecordingStrategy(StrategyType.HYBRID);
        RetrievalService service = new RetrievalService(List.of(new RecordingStrategy(StrategyType.DENSE), hybrid),
                classifier, StrategyType.AUTO, 10);

        RetrievalResult result = service.retrieve(RetrievalQuery.of("AMD revenue in Q3 2024"));

        assertThat(result.strategy()).isEqualTo(StrategyType.HYBRID);
        assertThat(result.autoSelected()).isTrue();
        assertThat(hybrid.topKs).containsExactly(10);
    }

    @Test
    void honoursExplicitStrategy() {
        RecordingStrategy dense = new RecordingStrategy(StrategyType.DENSE);
        RetrievalService service = new RetrievalService(List.of(dense, new RecordingStrategy(StrategyType.HYBRID)),
                classifier, StrategyType.AUTO, 10);

        RetrievalResult result = service.retrieve(RetrievalQuery.of("AMD revenue in Q3 2024", StrategyType.DENSE), 4,
                MetadataFilter.none());

        assertThat(result.strategy()).isEqualTo(StrategyType.DENSE);
        assertThat(result.autoSelected()).isFalse();
        assertThat(dense.topKs).containsExactly(4);
    }

    @Test
    void narrowsEmptyFilterToSingleTickerHint() {
        RecordingStrategy dense = new RecordingStrategy(StrategyType.DENSE);
        RetrievalService service = new RetrievalService(List.of(dense), classifier, StrategyType.DENSE, 10);

        service.retrieve(new RetrievalQuery("data center demand", null, List.of("amd")), 0, null);
        service.retrieve(new RetrievalQuery("data center demand", null, List.of("AMD", "NVDA")), 0, null);

        assertThat(dense.filters).containsExactly(MetadataFilter.forTicker("AMD"), MetadataFilter.none());
        assertThat(dense.topKs).containsExactly(10, 10);
    }

    @Test
    void failsForUnregisteredStrategy() {
        RetrievalService service = new RetrievalService(List.of(new RecordingStrategy(StrategyType.DENSE)),
                classifier, StrategyType.DENSE, 10);

        assertThatThrownBy(() -> service.retrieve(RetrievalQuery.of("anything", StrategyType.HYDE)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static final class RecordingStrategy implements RetrievalStrategy {

        private final StrategyType type;
        private final List<Integer> topKs = new ArrayList<>();
        private final List<MetadataFilter> filters = new ArrayList<>();

        private RecordingStrategy(StrategyType type) {
            this.type = type;
        }

        @Override
        public StrategyType type() {
            return type;
        }

        @Override
        public RetrievalResult retrieve(RetrievalQuery query, int topK, MetadataFilter filter) {
            topKs.add(topK);
            filters.add(filter);
            Chunk chunk = new Chunk("c-" + type.wireName(), query.text(), "test", "AMD", 2024, "Q3", "");
            return RetrievalResult.of(type, List.of(new RankedChunk(chunk, 1.0d, type)));
        }
    }
}
