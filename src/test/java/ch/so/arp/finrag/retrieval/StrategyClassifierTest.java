package ch.so.arp.finrag.retrieval;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class StrategyClassifierTest {

    private final StrategyClassifier classifier = new StrategyClassifier(new RetrievalProperties().getAuto().toRules());

    @Test
    void sendsComparisonsToMultiQuery() {
        assertThat(classifier.classify("Compare AMD and NVIDIA data center growth")).isEqualTo(StrategyType.MULTI_QUERY);
        assertThat(classifier.classify("AMD vs NVIDIA accelerators")).isEqualTo(StrategyType.MULTI_QUERY);
    }

    @Test
    void comparisonWinsOverFigures() {
        assertThat(classifier.classify("Compare AMD Q3 2024 versus Q2 2024 revenue"))
                .isEqualTo(StrategyType.MULTI_QUERY);
    }

    @Test
    void sendsFiguresAndDatesToHybrid() {
        assertThat(classifier.classify("What was AMD revenue in Q3 2024?")).isEqualTo(StrategyType.HYBRID);
        assertThat(classifier.classify("Which segment grew more than 100% last quarter")).isEqualTo(StrategyType.HYBRID);
        assertThat(classifier.classify("Did data center sales pass $5 billion")).isEqualTo(StrategyType.HYBRID);
    }

    @Test
    void sendsVagueQuestionsToHyde() {
        assertThat(classifier.classify("Tell me about NVIDIA's strategy")).isEqualTo(StrategyType.HYDE);
        assertThat(classifier.classify("AMD outlook")).isEqualTo(StrategyType.HYDE);
    }

    @Test
    void defaultsToDense() {
        assertThat(classifier.classify("How is AMD positioning Instinct accelerators against competition"))
                .isEqualTo(StrategyType.DENSE);
    }

    @Test
    void doesNotMatchMarkersInsideWords() {
        assertThat(classifier.isComparison("canvas sales in the holiday season")).isFalse();
    }
}
