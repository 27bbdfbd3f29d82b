package ch.so.arp.finrag.financials;

import java.util.Comparator;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fiscal quarter of a company. Fiscal calendars differ per company, so
 * periods are only comparable within one ticker.
 */
public record FiscalPeriod(int fiscalYear, int quarter) implements Comparable<FiscalPeriod> {

    private static final Pattern YEAR = Pattern.compile("(\\d{4}|\\d{2})");
    private static final Pattern QUARTER = Pattern.compile("^\\s*[qQ]?([1-4])\\s*$");

    private static final Comparator<FiscalPeriod> ORDER = Comparator.comparingInt(FiscalPeriod::fiscalYear)
            .thenComparingInt(FiscalPeriod::quarter);

    public FiscalPeriod {
        if (quarter < 1 || quarter > 4) {
            throw new IllegalArgumentException("quarter must be within 1..4: " + quarter);
        }
    }

    /**
     * Parse a period from loosely formatted input such as {@code "FY2025"}
     * and {@code "q3"}.
     *
     * @throws IllegalArgumentException if either part cannot be parsed
     */
    public static FiscalPeriod parse(String fiscalYear, String quarter) {
        return new FiscalPeriod(parseYear(fiscalYear), parseQuarter(quarter));
    }

    public static int parseYear(String fiscalYear) {
        Matcher matcher = YEAR.matcher(fiscalYear == null ? "" : fiscalYear);
        if (!matcher.find()) {
            throw new IllegalArgumentException("Invalid fiscal year: " + fiscalYear);
        }
        int year = Integer.parseInt(matcher.group(1));
        return year < 100 ? 2000 + year : year;
    }

    public static int parseQuarter(String quarter) {
        Matcher matcher = QUARTER.matcher(quarter == null ? "" : quarter);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid quarter: " + quarter);
        }
        return Integer.parseInt(matcher.group(1));
    }

    public String quarterLabel() {
        return "Q" + quarter;
    }

    /**
     * Label in the form {@code Q3 FY2024}.
     */
    public String label() {
        return String.format(Locale.ROOT, "Q%d FY%d", quarter, fiscalYear);
    }

    @Override
    public int compareTo(FiscalPeriod other) {
        return ORDER.compare(this, other);
    }
}
