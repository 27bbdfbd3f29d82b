package ch.so.arp.finrag.retrieval;

import java.util.Locale;
import java.util.Objects;

/**
 * Picks a retrieval strategy for a query. Rules are checked in order:
 * comparisons go to multi-query, figures and dates to hybrid, vague questions
 * to HyDE and everything else to dense retrieval. The rules are a heuristic;
 * a poor pick lowers answer quality but is not an error.
 */
public class StrategyClassifier {

    private final ClassificationRules rules;

    public StrategyClassifier(ClassificationRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    public StrategyType classify(String query) {
        String normalized = normalize(query);
        if (isComparison(normalized)) {
            return StrategyType.MULTI_QUERY;
        }
        if (hasFigureOrDate(normalized)) {
            return StrategyType.HYBRID;
        }
        if (isVague(normalized)) {
            return StrategyType.HYDE;
        }
        return StrategyType.DENSE;
    }

    boolean isComparison(String query) {
        String padded = " " + normalize(query) + " ";
        return rules.comparisonMarkers().stream().anyMatch(padded::contains);
    }

    boolean hasFigureOrDate(String query) {
        return rules.numericPatterns().stream().anyMatch(pattern -> pattern.matcher(query).find());
    }

    boolean isVague(String query) {
        String normalized = normalize(query);
        if (rules.vaguePhrases().stream().anyMatch(normalized::contains)) {
            return true;
        }
        return !normalized.isEmpty() && normalized.split("\\s+").length <= rules.vagueMaxWords();
    }

    private static String normalize(String query) {
        return query == null ? "" : query.trim().toLowerCase(Locale.ROOT).replace('’', '\'');
    }
}
