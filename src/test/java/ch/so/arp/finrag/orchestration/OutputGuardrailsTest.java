package ch.so.arp.finrag.orchestration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

class OutputGuardrailsTest {

    private final OutputGuardrails guardrails = new OutputGuardrails(
            List.of("I recommend buying", "guaranteed return"), 30);

    @Test
    void removesProhibitedPhrasesIgnoringCase() {
        OutputGuardrails.Sanitized sanitized = guardrails.sanitize("No GUARANTEED RETURN here.");

        assertThat(sanitized.text()).isEqualTo("No  here.");
        assertThat(sanitized.violations()).containsExactly("Removed phrase: \"guaranteed return\"");
    }

    @Test
    void truncatesLongAnswers() {
        OutputGuardrails.Sanitized sanitized = guardrails.sanitize("Data center revenue doubled year over year.");

        assertThat(sanitized.text()).isEqualTo("Data center revenue doubled ye...");
        assertThat(sanitized.violations()).containsExactly("Response truncated at 30 characters");
    }

    @Test
    void cleanTextPassesUnchanged() {
        OutputGuardrails.Sanitized sanitized = guardrails.sanitize("Revenue was $6.8B.");

        assertThat(sanitized.text()).isEqualTo("Revenue was $6.8B.");
        assertThat(sanitized.hasViolations()).isFalse();
    }

    @Test
    void fragmentsRespectTheRemainingBudget() {
        OutputGuardrails.FragmentFilter filter = guardrails.fragmentFilter();

        String emitted = filter.accept("Data center revenue ") + filter.accept("doubled year over year.")
                + filter.finish();

        assertThat(emitted).isEqualTo("Data center revenue doubled ye");
        assertThat(filter.violations()).containsExactly("Response truncated at 30 characters");
    }

    @Test
    void removesPhraseSplitAcrossFragments() {
        OutputGuardrails.FragmentFilter filter = guardrails.fragmentFilter();
        StringBuilder emitted = new StringBuilder();

        for (String fragment : List.of("Upside: ", "I recom", "mend buy", "ing now")) {
            emitted.append(filter.accept(fragment));
        }
        emitted.append(filter.finish());

        assertThat(emitted.toString()).isEqualTo("Upside:  now");
        assertThat(filter.violations()).containsExactly("Removed phrase: \"i recommend buying\"");
    }

    @Test
    void holdsBackTailAsLongAsLongestPhraseMinusOne() {
        OutputGuardrails.FragmentFilter filter = guardrails.fragmentFilter();

        String first = filter.accept("Revenue was $6.8B in the quarter.");

        assertThat(first).isEqualTo("Revenue was $6.8");
        assertThat(filter.finish()).isEqualTo("B in the quarter.");
        assertThat(filter.violations()).isEmpty();
    }

    @Test
    void rejectsNonPositiveLimit() {
        assertThatThrownBy(() -> new OutputGuardrails(List.of(), 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
