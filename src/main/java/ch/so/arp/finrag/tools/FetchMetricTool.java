package ch.so.arp.finrag.tools;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ch.so.arp.finrag.financials.FinancialDataRepository;
import ch.so.arp.finrag.financials.FinancialMetric;
import ch.so.arp.finrag.financials.FiscalPeriod;
import ch.so.arp.finrag.financials.QuarterFinancials;
import ch.so.arp.finrag.llm.ToolDefinition;

/**
 * Reported metrics of one company for one fiscal quarter.
 */
class FetchMetricTool implements FinancialTool {

    private static final String DESCRIPTION = """
            Retrieve exact financial metrics for a single fiscal quarter from structured statements.

            USE FOR:
            - Any question asking for specific numbers (revenue, EPS, margins, profit, cash flow) for one quarter.

            DO NOT USE FOR:
            - Qualitative/strategy/guidance commentary (use search_earnings_transcript).
            - Multi-quarter trends (use get_multi_quarter_metrics).

            Returns only verified values from financial statements. Never estimate.""";

    private final FinancialDataRepository repository;
    private final ToolDefinition definition;

    FetchMetricTool(FinancialDataRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository");
        ObjectNode schema = ToolSchemas.object(List.of("ticker", "metrics"));
        ToolSchemas.property(schema, "ticker", ToolSchemas.ticker());
        ToolSchemas.property(schema, "fiscalYear", ToolSchemas.string(
                "Fiscal year (e.g. \"2025\") or \"latest\" for the most recent quarter. Fiscal calendars differ "
                        + "per company."));
        ToolSchemas.property(schema, "quarter", ToolSchemas.quarter("Fiscal quarter. Optional if fiscalYear is \"latest\"."));
        ToolSchemas.property(schema, "metrics", ToolSchemas.array(ToolSchemas.metric(false, null),
                "Metrics to retrieve; choose only what is asked"));
        this.definition = new ToolDefinition(kind().wireName(), DESCRIPTION, schema);
    }

    @Override
    public ToolKind kind() {
        return ToolKind.FETCH_METRIC;
    }

    @Override
    public ToolDefinition definition() {
        return definition;
    }

    @Override
    public ToolOutput execute(JsonNode input, ToolContext context) {
        String ticker = ToolInputs.ticker(input, context, kind().wireName());
        List<FinancialMetric> metrics = ToolInputs.metrics(input, kind().wireName());
        String fiscalYear = ToolInputs.optionalText(input, "fiscalYear");
        String quarter = ToolInputs.optionalText(input, "quarter");

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("ticker", ticker);

        Optional<FiscalPeriod> period = ToolInputs.isLatest(fiscalYear) || quarter == null
                ? repository.mostRecentPeriod(ticker)
                : Optional.of(FiscalPeriod.parse(fiscalYear, quarter));
        if (period.isEmpty()) {
            payload.put("found", false);
            payload.put("error", "No financial data available for this ticker");
            return ToolOutput.of(payload, "No financial data available for " + ticker);
        }
        String label = period.get().label();
        payload.put("period", label);

        Optional<QuarterFinancials> quarterData = repository.findQuarter(ticker, period.get());
        if (quarterData.isEmpty()) {
            payload.put("found", false);
            payload.put("missingMetrics", metrics.stream().map(FinancialMetric::wireName).toList());
            return ToolOutput.of(payload, "No financial data for " + ticker + " " + label);
        }

        QuarterFinancials data = quarterData.get();
        Map<FinancialMetric, Double> found = new EnumMap<>(FinancialMetric.class);
        Map<String, Double> segments = Map.of();
        List<String> missing = new ArrayList<>();
        for (FinancialMetric metric : metrics) {
            if (metric == FinancialMetric.REVENUE_SEGMENTS) {
                if (data.revenueSegments().isEmpty()) {
                    missing.add(metric.wireName());
                } else {
                    segments = data.revenueSegments();
                }
            } else if (data.value(metric).isPresent()) {
                found.put(metric, data.value(metric).getAsDouble());
            } else {
                missing.add(metric.wireName());
            }
        }

        Map<String, Object> values = new LinkedHashMap<>();
        found.forEach((metric, value) -> values.put(metric.wireName(), value));
        if (!segments.isEmpty()) {
            values.put(FinancialMetric.REVENUE_SEGMENTS.wireName(), segments);
        }
        payload.put("found", !values.isEmpty());
        payload.put("metrics", values);
        if (!missing.isEmpty()) {
            payload.put("missingMetrics", missing);
        }
        String summary = ticker + " " + MetricFormatter.summarize(label, found, segments);
        if (!missing.isEmpty()) {
            summary += " (not reported: " + String.join(", ", missing) + ")";
        }
        return ToolOutput.of(payload, summary);
    }
}
