package ch.so.arp.finrag.financials;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Reported figures of one company for one fiscal quarter.
 *
 * @param ticker          ticker symbol
 * @param period          fiscal period
 * @param metrics         scalar metrics by {@link FinancialMetric}
 * @param revenueSegments revenue per business segment, in millions
 */
public record QuarterFinancials(
        String ticker,
        FiscalPeriod period,
        Map<FinancialMetric, Double> metrics,
        Map<String, Double> revenueSegments) {

    public QuarterFinancials {
        Objects.requireNonNull(ticker, "ticker");
        Objects.requireNonNull(period, "period");
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
        revenueSegments = revenueSegments == null ? Map.of() : Map.copyOf(revenueSegments);
    }

    public OptionalDouble value(FinancialMetric metric) {
        Double value = metrics.get(metric);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }
}
