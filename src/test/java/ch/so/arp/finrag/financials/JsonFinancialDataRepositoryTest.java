package ch.so.arp.finrag.financials;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;

import com.fasterxml.jackson.databind.ObjectMapper;

class JsonFinancialDataRepositoryTest {

    private final JsonFinancialDataRepository repository = new JsonFinancialDataRepository(
            new PathMatchingResourcePatternResolver(), new ObjectMapper(), "classpath:financials/*.json");

    @Test
    void loadsBundledStatements() {
        assertThat(repository.tickers()).containsExactly("AMD", "MSFT", "NVDA");

        QuarterFinancials amd = repository.findQuarter("amd", new FiscalPeriod(2024, 3)).orElseThrow();
        assertThat(amd.value(FinancialMetric.REVENUE)).hasValue(6819.0d);
        assertThat(amd.value(FinancialMetric.NET_INCOME)).hasValue(771.0d);
        assertThat(amd.revenueSegments()).containsEntry("data_center", 3549.0d);
    }

    @Test
    void ordersPeriodsPerTicker() {
        assertThat(repository.periods("NVDA")).first().isEqualTo(new FiscalPeriod(2024, 4));
        assertThat(repository.mostRecentPeriods("AMD", 2))
                .containsExactly(new FiscalPeriod(2024, 3), new FiscalPeriod(2024, 2));
        assertThat(repository.mostRecentPeriod("MSFT")).contains(new FiscalPeriod(2025, 2));
    }

    @Test
    void unknownTickerHasNoData() {
        assertThat(repository.periods("TSLA")).isEmpty();
        assertThat(repository.mostRecentPeriod("TSLA")).isEmpty();
        assertThat(repository.findQuarter("TSLA", new FiscalPeriod(2024, 1))).isEmpty();
    }

    @Test
    void missingLocationYieldsEmptyRepository() {
        JsonFinancialDataRepository empty = new JsonFinancialDataRepository(new PathMatchingResourcePatternResolver(),
                new ObjectMapper(), "classpath*:no-such-dir/*.json");

        assertThat(empty.tickers()).isEmpty();
    }

    @Test
    void parsesLooseFiscalPeriods() {
        assertThat(FiscalPeriod.parse("FY2025", "q3")).isEqualTo(new FiscalPeriod(2025, 3));
        assertThat(FiscalPeriod.parse("25", "Q1").label()).isEqualTo("Q1 FY2025");
        assertThat(new FiscalPeriod(2024, 4)).isLessThan(new FiscalPeriod(2025, 1));
        assertThatThrownBy(() -> FiscalPeriod.parse("2024", "Q5")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FiscalPeriod.parse("next year", "Q1")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void detectsTickersByNameOrSymbol() {
        assertThat(TickerAliases.detect("Compare Nvidia with AMD and nvidia again"))
                .containsExactly("NVDA", "AMD");
        assertThat(TickerAliases.detect("What is the weather?")).isEmpty();
    }
}
