package ch.so.arp.finrag.financials;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Metrics available in the structured quarterly statements. Amounts are in
 * millions of US dollars, margins in percent.
 */
public enum FinancialMetric {
    REVENUE,
    GROSS_PROFIT,
    OPERATING_INCOME,
    NET_INCOME,
    EPS,
    EPS_DILUTED,
    GROSS_MARGIN,
    OPERATING_MARGIN,
    NET_MARGIN,
    FREE_CASH_FLOW,
    OPERATING_CASH_FLOW,
    REVENUE_SEGMENTS;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether the metric is a single number, i.e. everything except the
     * segment breakdown.
     */
    public boolean isScalar() {
        return this != REVENUE_SEGMENTS;
    }

    public static Optional<FinancialMetric> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(metric -> metric.wireName().equals(normalized)).findFirst();
    }

    public static List<String> wireNames(boolean scalarOnly) {
        return Arrays.stream(values())
                .filter(metric -> !scalarOnly || metric.isScalar())
                .map(FinancialMetric::wireName)
                .toList();
    }
}
