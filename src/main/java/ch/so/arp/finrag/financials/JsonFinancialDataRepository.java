package ch.so.arp.finrag.financials;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Financial statements read once from JSON resources, one file per ticker:
 * <pre>
 * { "ticker": "AMD",
 *   "quarters": [ { "fiscalYear": 2024, "quarter": "Q3", "revenue": 6819,
 *                   "revenue_segments": { "data_center": 3549 } } ] }
 * </pre>
 */
class JsonFinancialDataRepository implements FinancialDataRepository {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonFinancialDataRepository.class);

    private final Map<String, NavigableMap<FiscalPeriod, QuarterFinancials>> quarters;

    JsonFinancialDataRepository(ResourcePatternResolver resolver, ObjectMapper objectMapper, String location) {
        Map<String, NavigableMap<FiscalPeriod, QuarterFinancials>> loaded = new LinkedHashMap<>();
        try {
            for (Resource resource : resolver.getResources(location)) {
                try (InputStream input = resource.getInputStream()) {
                    read(objectMapper.readTree(input), loaded);
                }
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Could not read financial statements from " + location, ex);
        }
        this.quarters = Collections.unmodifiableMap(loaded);
        LOGGER.info("Loaded financial statements for {} tickers from {}", loaded.size(), location);
    }

    private static void read(JsonNode root, Map<String, NavigableMap<FiscalPeriod, QuarterFinancials>> target) {
        String ticker = normalize(root.path("ticker").asText(null));
        if (ticker == null) {
            throw new IllegalArgumentException("Financial statement file without ticker");
        }
        NavigableMap<FiscalPeriod, QuarterFinancials> byPeriod = target.computeIfAbsent(ticker,
                key -> new TreeMap<>());
        for (JsonNode quarter : root.path("quarters")) {
            FiscalPeriod period = FiscalPeriod.parse(quarter.path("fiscalYear").asText(),
                    quarter.path("quarter").asText());
            Map<FinancialMetric, Double> metrics = new EnumMap<>(FinancialMetric.class);
            for (FinancialMetric metric : FinancialMetric.values()) {
                JsonNode value = quarter.get(metric.wireName());
                if (metric.isScalar() && value != null && value.isNumber()) {
                    metrics.put(metric, value.asDouble());
                }
            }
            Map<String, Double> segments = new LinkedHashMap<>();
            quarter.path(FinancialMetric.REVENUE_SEGMENTS.wireName()).fields().forEachRemaining(entry -> {
                if (entry.getValue().isNumber()) {
                    segments.put(entry.getKey(), entry.getValue().asDouble());
                }
            });
            byPeriod.put(period, new QuarterFinancials(ticker, period, metrics, segments));
        }
    }

    @Override
    public Optional<QuarterFinancials> findQuarter(String ticker, FiscalPeriod period) {
        NavigableMap<FiscalPeriod, QuarterFinancials> byPeriod = quarters.get(normalize(ticker));
        return byPeriod == null ? Optional.empty() : Optional.ofNullable(byPeriod.get(period));
    }

    @Override
    public List<FiscalPeriod> mostRecentPeriods(String ticker, int limit) {
        NavigableMap<FiscalPeriod, QuarterFinancials> byPeriod = quarters.get(normalize(ticker));
        if (byPeriod == null) {
            return List.of();
        }
        return byPeriod.descendingKeySet().stream().limit(Math.max(0, limit)).toList();
    }

    @Override
    public List<FiscalPeriod> periods(String ticker) {
        NavigableMap<FiscalPeriod, QuarterFinancials> byPeriod = quarters.get(normalize(ticker));
        return byPeriod == null ? List.of() : new ArrayList<>(byPeriod.keySet());
    }

    @Override
    public Set<String> tickers() {
        return Collections.unmodifiableSet(new TreeSet<>(quarters.keySet()));
    }

    private static String normalize(String ticker) {
        return ticker == null || ticker.isBlank() ? null : ticker.trim().toUpperCase(Locale.ROOT);
    }
}
