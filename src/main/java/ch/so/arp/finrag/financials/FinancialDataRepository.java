package ch.so.arp.finrag.financials;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read access to structured quarterly financial statements.
 */
public interface FinancialDataRepository {

    Optional<QuarterFinancials> findQuarter(String ticker, FiscalPeriod period);

    /**
     * The most recent periods of a ticker, newest first.
     *
     * @param limit maximum number of periods
     */
    List<FiscalPeriod> mostRecentPeriods(String ticker, int limit);

    default Optional<FiscalPeriod> mostRecentPeriod(String ticker) {
        return mostRecentPeriods(ticker, 1).stream().findFirst();
    }

    /**
     * All periods of a ticker, oldest first; empty for unknown tickers.
     */
    List<FiscalPeriod> periods(String ticker);

    Set<String> tickers();
}
