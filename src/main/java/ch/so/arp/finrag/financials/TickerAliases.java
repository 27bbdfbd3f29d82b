package ch.so.arp.finrag.financials;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects the companies named in a question by name or ticker.
 */
public final class TickerAliases {

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("apple", "AAPL"),
            Map.entry("aapl", "AAPL"),
            Map.entry("meta", "META"),
            Map.entry("facebook", "META"),
            Map.entry("fb", "META"),
            Map.entry("nvidia", "NVDA"),
            Map.entry("nvda", "NVDA"),
            Map.entry("google", "GOOGL"),
            Map.entry("alphabet", "GOOGL"),
            Map.entry("googl", "GOOGL"),
            Map.entry("goog", "GOOGL"),
            Map.entry("amazon", "AMZN"),
            Map.entry("amzn", "AMZN"),
            Map.entry("amd", "AMD"),
            Map.entry("avago", "AVGO"),
            Map.entry("broadcom", "AVGO"),
            Map.entry("avgo", "AVGO"),
            Map.entry("salesforce", "CRM"),
            Map.entry("crm", "CRM"),
            Map.entry("microsoft", "MSFT"),
            Map.entry("msft", "MSFT"),
            Map.entry("oracle", "ORCL"),
            Map.entry("orcl", "ORCL"));

    private static final Pattern WORD = Pattern.compile("[a-z]+");

    private TickerAliases() {
    }

    /**
     * Tickers named in the text, in order of first mention.
     */
    public static List<String> detect(String text) {
        Set<String> tickers = new LinkedHashSet<>();
        if (text != null) {
            Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
            while (matcher.find()) {
                String ticker = ALIASES.get(matcher.group());
                if (ticker != null) {
                    tickers.add(ticker);
                }
            }
        }
        return List.copyOf(tickers);
    }

    public static Set<String> knownTickers() {
        return Set.copyOf(ALIASES.values());
    }
}
