package ch.so.arp.finrag.index;

import java.util.Locale;

/**
 * Equality filter on chunk metadata. A {@code null} field does not restrict
 * the result.
 */
public record MetadataFilter(String ticker, Integer fiscalYear, String quarter) {

    private static final MetadataFilter NONE = new MetadataFilter(null, null, null);

    public MetadataFilter {
        ticker = ticker == null || ticker.isBlank() ? null : ticker.trim().toUpperCase(Locale.ROOT);
        quarter = quarter == null || quarter.isBlank() ? null : quarter.trim().toUpperCase(Locale.ROOT);
    }

    public static MetadataFilter none() {
        return NONE;
    }

    public static MetadataFilter forTicker(String ticker) {
        return new MetadataFilter(ticker, null, null);
    }

    public boolean isEmpty() {
        return ticker == null && fiscalYear == null && quarter == null;
    }

    public boolean matches(Chunk chunk) {
        if (ticker != null && !ticker.equalsIgnoreCase(chunk.ticker())) {
            return false;
        }
        if (fiscalYear != null && !fiscalYear.equals(chunk.fiscalYear())) {
            return false;
        }
        return quarter == null || quarter.equalsIgnoreCase(chunk.quarter());
    }

    public MetadataFilter withoutFiscalYear() {
        return new MetadataFilter(ticker, null, null);
    }
}
