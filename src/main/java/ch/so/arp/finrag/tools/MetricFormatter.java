package ch.so.arp.finrag.tools;

import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

import ch.so.arp.finrag.financials.FinancialMetric;

/**
 * Human readable figures for tool summaries. Amounts are stored in millions.
 */
final class MetricFormatter {

    private MetricFormatter() {
    }

    static String amount(double millions) {
        if (Math.abs(millions) >= 1000.0d) {
            return String.format(Locale.ROOT, "$%.1fB", millions / 1000.0d);
        }
        return String.format(Locale.ROOT, "$%.1fM", millions);
    }

    static String format(FinancialMetric metric, double value) {
        return switch (metric) {
            case GROSS_MARGIN, OPERATING_MARGIN, NET_MARGIN -> String.format(Locale.ROOT, "%.1f%%", value);
            case EPS, EPS_DILUTED -> String.format(Locale.ROOT, "$%.2f", value);
            default -> amount(value);
        };
    }

    static String label(FinancialMetric metric) {
        String words = metric.wireName().replace('_', ' ');
        return Character.toUpperCase(words.charAt(0)) + words.substring(1);
    }

    /**
     * One line summary such as {@code Q3 FY2024: Revenue $6.8B | Net income $771.0M}.
     */
    static String summarize(String period, Map<FinancialMetric, Double> values, Map<String, Double> segments) {
        StringJoiner parts = new StringJoiner(" | ");
        values.forEach((metric, value) -> parts.add(label(metric) + " " + format(metric, value)));
        segments.forEach((segment, value) -> parts.add(segment.replace('_', ' ') + " segment " + amount(value)));
        return parts.length() == 0 ? period + ": no numeric metrics" : period + ": " + parts;
    }
}
