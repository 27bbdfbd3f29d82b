package ch.so.arp.finrag.tools;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ch.so.arp.finrag.financials.FiscalPeriod;
import ch.so.arp.finrag.index.Chunk;
import ch.so.arp.finrag.index.MetadataFilter;
import ch.so.arp.finrag.llm.ToolDefinition;
import ch.so.arp.finrag.retrieval.RankedChunk;
import ch.so.arp.finrag.retrieval.RetrievalQuery;
import ch.so.arp.finrag.retrieval.RetrievalResult;
import ch.so.arp.finrag.retrieval.RetrievalService;
import ch.so.arp.finrag.retrieval.StrategyType;

/**
 * Searches the earnings call transcripts with a retrieval strategy. When the
 * filtered search finds nothing, the fiscal year and then all filters are
 * dropped.
 */
class SearchTranscriptsTool implements FinancialTool {

    private static final Logger LOGGER = LoggerFactory.getLogger(SearchTranscriptsTool.class);

    static final int DEFAULT_TOP_K = 10;
    static final int MAX_TOP_K = 20;
    private static final int MAX_EXCERPT_LENGTH = 500;

    private static final String DESCRIPTION = """
            Semantic search over earnings call transcripts (prepared remarks + Q&A).

            USE FOR:
            - Qualitative asks: management commentary, AI plans, guidance, risks, strategy.

            DO NOT USE FOR:
            - Numeric metrics (use the financial tools instead).""";

    private final RetrievalService retrievalService;
    private final ToolDefinition definition;

    SearchTranscriptsTool(RetrievalService retrievalService) {
        this.retrievalService = Objects.requireNonNull(retrievalService, "retrievalService");
        ObjectNode schema = ToolSchemas.object(List.of("ticker", "query"));
        ToolSchemas.property(schema, "ticker", ToolSchemas.ticker());
        ToolSchemas.property(schema, "query",
                ToolSchemas.string("What to search for (e.g. \"AI demand\", \"data center\")"));
        ToolSchemas.property(schema, "fiscalYear", ToolSchemas.string("Optional fiscal year filter"));
        ToolSchemas.property(schema, "quarter", ToolSchemas.quarter("Optional fiscal quarter filter"));
        ToolSchemas.property(schema, "topK", ToolSchemas.integer(1, MAX_TOP_K,
                "Max results to return (default: " + DEFAULT_TOP_K + ")"));
        ToolSchemas.property(schema, "strategy", ToolSchemas.enumeration(
                List.of("dense-only", "hybrid-bm25", "hyde", "multi-query", "auto"),
                "Optional retrieval strategy; leave empty to use the request's strategy"));
        this.definition = new ToolDefinition(kind().wireName(), DESCRIPTION, schema);
    }

    @Override
    public ToolKind kind() {
        return ToolKind.SEARCH_TRANSCRIPTS;
    }

    @Override
    public ToolDefinition definition() {
        return definition;
    }

    @Override
    public ToolOutput execute(JsonNode input, ToolContext context) {
        String query = ToolInputs.requireText(input, "query", kind().wireName());
        String ticker = ToolInputs.optionalText(input, "ticker");
        if (ticker == null && context.tickers().size() == 1) {
            ticker = context.tickers().get(0);
        }
        String fiscalYear = ToolInputs.optionalText(input, "fiscalYear");
        String quarter = ToolInputs.optionalText(input, "quarter");
        int topK = input.hasNonNull("topK") ? Math.max(1, Math.min(MAX_TOP_K, input.get("topK").asInt())) : DEFAULT_TOP_K;
        String strategyName = ToolInputs.optionalText(input, "strategy");
        StrategyType strategy = strategyName != null ? StrategyType.fromWireName(strategyName) : context.strategy();

        MetadataFilter filter = new MetadataFilter(ticker,
                fiscalYear == null || ToolInputs.isLatest(fiscalYear) ? null : FiscalPeriod.parseYear(fiscalYear),
                quarter == null ? null : "Q" + FiscalPeriod.parseQuarter(quarter));
        RetrievalQuery retrievalQuery = new RetrievalQuery(query, strategy,
                ticker == null ? context.tickers() : List.of(ticker));

        List<String> searched = new ArrayList<>();
        RetrievalResult result = null;
        for (MetadataFilter attempt : relaxations(filter)) {
            searched.add(describe(attempt));
            result = retrievalService.retrieve(retrievalQuery, topK, attempt);
            if (!result.isEmpty()) {
                break;
            }
        }
        boolean hadFallback = searched.size() > 1;
        if (hadFallback) {
            LOGGER.debug("Relaxed transcript filters for '{}': {}", query, searched);
        }

        List<Map<String, Object>> results = new ArrayList<>();
        for (RankedChunk ranked : result.chunks()) {
            results.add(toResult(ranked));
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("ticker", ticker);
        payload.put("query", query);
        payload.put("strategy", result.strategy().wireName());
        payload.put("autoSelected", result.autoSelected());
        payload.put("searchedFilters", searched);
        payload.put("hadFallback", hadFallback);
        payload.put("results", results);
        if (!result.queryVariants().isEmpty()) {
            payload.put("queryVariants", result.queryVariants());
        }
        return new ToolOutput(payload, summary(result), results.size());
    }

    static List<MetadataFilter> relaxations(MetadataFilter filter) {
        List<MetadataFilter> attempts = new ArrayList<>();
        attempts.add(filter);
        if (filter.fiscalYear() != null || filter.quarter() != null) {
            attempts.add(filter.withoutFiscalYear());
        }
        if (!filter.isEmpty()) {
            attempts.add(MetadataFilter.none());
        }
        return attempts;
    }

    private static String describe(MetadataFilter filter) {
        if (filter.isEmpty()) {
            return "all";
        }
        StringBuilder builder = new StringBuilder();
        if (filter.ticker() != null) {
            builder.append(filter.ticker());
        }
        if (filter.fiscalYear() != null) {
            builder.append(" FY").append(filter.fiscalYear());
        }
        if (filter.quarter() != null) {
            builder.append(' ').append(filter.quarter());
        }
        return builder.toString().trim();
    }

    private static Map<String, Object> toResult(RankedChunk ranked) {
        Chunk chunk = ranked.chunk();
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("id", chunk.id());
        entry.put("score", ranked.score());
        entry.put("text", chunk.text());
        entry.put("ticker", chunk.ticker());
        entry.put("fiscalYear", chunk.fiscalYear());
        entry.put("quarter", chunk.quarter());
        entry.put("section", chunk.section());
        entry.put("source", chunk.source());
        return entry;
    }

    private static String summary(RetrievalResult result) {
        if (result.isEmpty()) {
            return "No transcript excerpts found.";
        }
        StringBuilder builder = new StringBuilder();
        builder.append(String.format(Locale.ROOT, "Found %d transcript excerpts (strategy %s):",
                result.chunks().size(), result.strategy().wireName()));
        int index = 1;
        for (RankedChunk ranked : result.chunks()) {
            String text = ranked.chunk().formatForPrompt();
            if (text.length() > MAX_EXCERPT_LENGTH) {
                text = text.substring(0, MAX_EXCERPT_LENGTH) + "...";
            }
            builder.append(String.format(Locale.ROOT, "\n[%d] (score %.3f) %s", index++, ranked.score(), text));
        }
        return builder.toString();
    }
}
