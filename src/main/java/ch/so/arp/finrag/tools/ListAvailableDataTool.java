package ch.so.arp.finrag.tools;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ch.so.arp.finrag.financials.FinancialDataRepository;
import ch.so.arp.finrag.financials.FiscalPeriod;
import ch.so.arp.finrag.llm.ToolDefinition;

/**
 * Coverage of the financial statements per ticker.
 */
class ListAvailableDataTool implements FinancialTool {

    private static final String DESCRIPTION = """
            List available financial data coverage for a ticker (or all tickers).

            USE FOR:
            - Edge cases where data may not exist.
            - Before answering out-of-scope tickers (e.g. Tesla).""";

    private final FinancialDataRepository repository;
    private final ToolDefinition definition;

    ListAvailableDataTool(FinancialDataRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository");
        ObjectNode schema = ToolSchemas.object(List.of());
        ToolSchemas.property(schema, "ticker", ToolSchemas.ticker()
                .put("description", "Optional ticker; if omitted, list all"));
        this.definition = new ToolDefinition(kind().wireName(), DESCRIPTION, schema);
    }

    @Override
    public ToolKind kind() {
        return ToolKind.LIST_AVAILABLE_DATA;
    }

    @Override
    public ToolDefinition definition() {
        return definition;
    }

    @Override
    public ToolOutput execute(JsonNode input, ToolContext context) {
        String ticker = ToolInputs.optionalText(input, "ticker");
        List<String> tickers = ticker == null ? new ArrayList<>(repository.tickers()) : List.of(ticker.toUpperCase(Locale.ROOT));

        Map<String, Object> coverage = new LinkedHashMap<>();
        StringJoiner summary = new StringJoiner("\n");
        for (String symbol : tickers) {
            Map<Integer, List<String>> byYear = new TreeMap<>();
            for (FiscalPeriod period : repository.periods(symbol)) {
                byYear.computeIfAbsent(period.fiscalYear(), year -> new ArrayList<>()).add(period.quarterLabel());
            }
            List<Map<String, Object>> years = new ArrayList<>();
            byYear.forEach((year, quarters) -> {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("fiscalYear", year);
                entry.put("quarters", quarters);
                years.add(entry);
            });
            coverage.put(symbol, years);
            summary.add(byYear.isEmpty() ? symbol + ": no data" : symbol + ": " + byYear);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("ticker", ticker);
        payload.put("financials", coverage);
        return ToolOutput.of(payload, summary.length() == 0 ? "No financial data available" : summary.toString());
    }
}
