package ch.so.arp.finrag.tools;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ch.so.arp.finrag.financials.FinancialDataRepository;
import ch.so.arp.finrag.financials.FinancialMetric;
import ch.so.arp.finrag.financials.FiscalPeriod;
import ch.so.arp.finrag.financials.QuarterFinancials;
import ch.so.arp.finrag.llm.ToolDefinition;

/**
 * Growth of a metric between two quarters, {@code (cmp - base) / base * 100}.
 */
class ComputeGrowthTool implements FinancialTool {

    private static final String DESCRIPTION = """
            Compute growth between two periods (YoY, QoQ) for a specific metric.

            USE FOR:
            - "YoY growth", "QoQ change", "delta vs prior year/quarter" questions.

            DO NOT USE FOR:
            - Raw metric retrieval (use get_financial_metrics / get_multi_quarter_metrics).""";

    private final FinancialDataRepository repository;
    private final ToolDefinition definition;

    ComputeGrowthTool(FinancialDataRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository");
        ObjectNode schema = ToolSchemas.object(List.of("ticker", "metric", "basePeriod", "comparisonPeriod"));
        ToolSchemas.property(schema, "ticker", ToolSchemas.ticker());
        ToolSchemas.property(schema, "metric", ToolSchemas.metric(true, "Metric to compare"));
        ToolSchemas.property(schema, "basePeriod", ToolSchemas.period(List.of("fiscalYear", "quarter")));
        ToolSchemas.property(schema, "comparisonPeriod", ToolSchemas.period(List.of("fiscalYear", "quarter")));
        this.definition = new ToolDefinition(kind().wireName(), DESCRIPTION, schema);
    }

    @Override
    public ToolKind kind() {
        return ToolKind.COMPUTE_GROWTH;
    }

    @Override
    public ToolDefinition definition() {
        return definition;
    }

    @Override
    public ToolOutput execute(JsonNode input, ToolContext context) {
        String ticker = ToolInputs.ticker(input, context, kind().wireName());
        String metricName = ToolInputs.requireText(input, "metric", kind().wireName());
        FinancialMetric metric = FinancialMetric.fromWireName(metricName)
                .filter(FinancialMetric::isScalar)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported metric for growth: " + metricName));
        FiscalPeriod base = period(input, "basePeriod");
        FiscalPeriod comparison = period(input, "comparisonPeriod");

        OptionalDouble baseValue = value(ticker, base, metric);
        OptionalDouble comparisonValue = value(ticker, comparison, metric);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("ticker", ticker);
        payload.put("metric", metric.wireName());
        payload.put("basePeriod", periodValue(base, baseValue));
        payload.put("comparisonPeriod", periodValue(comparison, comparisonValue));

        if (baseValue.isEmpty() || comparisonValue.isEmpty()) {
            payload.put("success", false);
            payload.put("error", "Missing data for growth computation");
            return ToolOutput.of(payload, "Missing " + metric.wireName() + " data for " + ticker + " to compare "
                    + base.label() + " with " + comparison.label());
        }

        Double growth = growthRate(baseValue.getAsDouble(), comparisonValue.getAsDouble());
        String direction = direction(growth);
        payload.put("success", growth != null);
        payload.put("growthRateNumeric", growth);
        payload.put("growthRate", growth == null ? null : String.format(Locale.ROOT, "%.2f%%", growth));
        payload.put("direction", direction);

        String change = growth == null
                ? "cannot be computed from a zero base"
                : String.format(Locale.ROOT, "changed %+.2f%% (%s)", growth, direction);
        return ToolOutput.of(payload, String.format(Locale.ROOT, "%s %s %s from %s (%s) to %s (%s)", ticker,
                MetricFormatter.label(metric).toLowerCase(Locale.ROOT), change, base.label(),
                MetricFormatter.format(metric, baseValue.getAsDouble()), comparison.label(),
                MetricFormatter.format(metric, comparisonValue.getAsDouble())));
    }

    /**
     * Percentage growth, {@code null} for a zero base.
     */
    static Double growthRate(double base, double comparison) {
        if (base == 0.0d) {
            return null;
        }
        return (comparison - base) / base * 100.0d;
    }

    static String direction(Double growth) {
        if (growth == null || growth == 0.0d) {
            return "flat";
        }
        return growth > 0.0d ? "increase" : "decrease";
    }

    private OptionalDouble value(String ticker, FiscalPeriod period, FinancialMetric metric) {
        Optional<QuarterFinancials> data = repository.findQuarter(ticker, period);
        return data.isPresent() ? data.get().value(metric) : OptionalDouble.empty();
    }

    private FiscalPeriod period(JsonNode input, String field) {
        JsonNode node = input.get(field);
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Missing required input '" + field + "' for " + kind().wireName());
        }
        return FiscalPeriod.parse(ToolInputs.requireText(node, "fiscalYear", kind().wireName()),
                ToolInputs.requireText(node, "quarter", kind().wireName()));
    }

    private static Map<String, Object> periodValue(FiscalPeriod period, OptionalDouble value) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("period", period.label());
        entry.put("value", value.isPresent() ? value.getAsDouble() : null);
        return entry;
    }
}
