package ch.so.arp.finrag.retrieval;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Keyword lists and patterns used by the {@link StrategyClassifier}.
 *
 * @param comparisonMarkers  phrases marking a comparison ("compare", "vs")
 * @param numericPatterns    regular expressions matching figures and dates
 * @param vaguePhrases       phrases of open-ended questions
 * @param vagueMaxWords      queries with at most this many words count as
 *                           vague
 */
public record ClassificationRules(
        List<String> comparisonMarkers,
        List<Pattern> numericPatterns,
        List<String> vaguePhrases,
        int vagueMaxWords) {

    public ClassificationRules {
        comparisonMarkers = lowerCase(comparisonMarkers);
        numericPatterns = numericPatterns == null ? List.of() : List.copyOf(numericPatterns);
        vaguePhrases = lowerCase(vaguePhrases);
    }

    public static ClassificationRules of(List<String> comparisonMarkers, List<String> numericPatterns,
            List<String> vaguePhrases, int vagueMaxWords) {
        List<Pattern> patterns = numericPatterns.stream()
                .map(pattern -> Pattern.compile(pattern, Pattern.CASE_INSENSITIVE))
                .toList();
        return new ClassificationRules(comparisonMarkers, patterns, vaguePhrases, vagueMaxWords);
    }

    private static List<String> lowerCase(List<String> values) {
        return values == null ? List.of() : values.stream().map(value -> value.toLowerCase(Locale.ROOT)).toList();
    }
}
