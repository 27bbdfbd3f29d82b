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
 * Metrics of one company across several quarters.
 */
class FetchMultiPeriodTool implements FinancialTool {

    static final int LATEST_QUARTERS = 4;

    private static final String DESCRIPTION = """
            Retrieve metrics across multiple quarters for trend/comparison analysis.

            USE FOR:
            - Trend or comparison questions (e.g. "last 4 quarters", "Q1-Q4 FY25").

            DO NOT USE FOR:
            - Single-quarter asks (use get_financial_metrics).
            - Qualitative commentary (use search_earnings_transcript).""";

    private final FinancialDataRepository repository;
    private final ToolDefinition definition;

    FetchMultiPeriodTool(FinancialDataRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository");
        ObjectNode schema = ToolSchemas.object(List.of("ticker", "periods", "metrics"));
        ToolSchemas.property(schema, "ticker", ToolSchemas.ticker());
        ToolSchemas.property(schema, "periods", ToolSchemas.array(ToolSchemas.period(List.of("fiscalYear")),
                "List of {fiscalYear, quarter} objects. Use [{fiscalYear: \"latest\"}] for the 4 most recent "
                        + "quarters of this ticker."));
        ToolSchemas.property(schema, "metrics", ToolSchemas.array(ToolSchemas.metric(false, null),
                "Metrics to retrieve for each period"));
        this.definition = new ToolDefinition(kind().wireName(), DESCRIPTION, schema);
    }

    @Override
    public ToolKind kind() {
        return ToolKind.FETCH_MULTI_PERIOD;
    }

    @Override
    public ToolDefinition definition() {
        return definition;
    }

    @Override
    public ToolOutput execute(JsonNode input, ToolContext context) {
        String ticker = ToolInputs.ticker(input, context, kind().wireName());
        List<FinancialMetric> metrics = ToolInputs.metrics(input, kind().wireName());
        List<FiscalPeriod> periods = periods(ticker, input.get("periods"));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("ticker", ticker);
        if (periods.isEmpty()) {
            payload.put("periods", List.of());
            payload.put("error", "No financial data available for this ticker");
            return ToolOutput.of(payload, "No financial data available for " + ticker);
        }

        List<Map<String, Object>> entries = new ArrayList<>();
        List<String> summaries = new ArrayList<>();
        for (FiscalPeriod period : periods) {
            Optional<QuarterFinancials> data = repository.findQuarter(ticker, period);
            Map<FinancialMetric, Double> found = new EnumMap<>(FinancialMetric.class);
            Map<String, Double> segments = Map.of();
            List<String> missing = new ArrayList<>();
            for (FinancialMetric metric : metrics) {
                if (metric == FinancialMetric.REVENUE_SEGMENTS) {
                    if (data.isPresent() && !data.get().revenueSegments().isEmpty()) {
                        segments = data.get().revenueSegments();
                    } else {
                        missing.add(metric.wireName());
                    }
                } else if (data.isPresent() && data.get().value(metric).isPresent()) {
                    found.put(metric, data.get().value(metric).getAsDouble());
                } else {
                    missing.add(metric.wireName());
                }
            }
            Map<String, Object> values = new LinkedHashMap<>();
            found.forEach((metric, value) -> values.put(metric.wireName(), value));
            if (!segments.isEmpty()) {
                values.put(FinancialMetric.REVENUE_SEGMENTS.wireName(), segments);
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("period", period.label());
            entry.put("metrics", values);
            entry.put("missingMetrics", missing);
            entries.add(entry);
            summaries.add(MetricFormatter.summarize(period.label(), found, segments));
        }
        payload.put("periods", entries);
        payload.put("summaries", summaries);
        return ToolOutput.of(payload, ticker + "\n" + String.join("\n", summaries));
    }

    private List<FiscalPeriod> periods(String ticker, JsonNode periods) {
        if (periods == null || !periods.isArray() || periods.isEmpty()
                || (periods.size() == 1 && ToolInputs.isLatest(ToolInputs.optionalText(periods.get(0), "fiscalYear")))) {
            return repository.mostRecentPeriods(ticker, LATEST_QUARTERS);
        }
        List<FiscalPeriod> parsed = new ArrayList<>();
        for (JsonNode period : periods) {
            String fiscalYear = ToolInputs.optionalText(period, "fiscalYear");
            String quarter = ToolInputs.optionalText(period, "quarter");
            if (quarter == null) {
                int year = FiscalPeriod.parseYear(fiscalYear);
                repository.periods(ticker).stream().filter(candidate -> candidate.fiscalYear() == year)
                        .forEach(parsed::add);
            } else {
                parsed.add(FiscalPeriod.parse(fiscalYear, quarter));
            }
        }
        return parsed;
    }
}
