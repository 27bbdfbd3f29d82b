package ch.so.arp.finrag.orchestration;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes boilerplate phrases from generated answers and enforces a soft
 * length limit.
 */
public class OutputGuardrails {

    private final List<Pattern> prohibitedPhrases;
    private final List<String> phrases;
    private final int maxResponseLength;
    private final int holdBack;

    public OutputGuardrails(List<String> prohibitedPhrases, int maxResponseLength) {
        if (maxResponseLength <= 0) {
            throw new IllegalArgumentException("maxResponseLength must be positive");
        }
        this.phrases = List.copyOf(prohibitedPhrases);
        this.prohibitedPhrases = phrases.stream()
                .map(phrase -> Pattern.compile(Pattern.quote(phrase), Pattern.CASE_INSENSITIVE))
                .toList();
        this.maxResponseLength = maxResponseLength;
        this.holdBack = phrases.stream().mapToInt(String::length).max().orElse(1) - 1;
    }

    /**
     * Clean a complete answer.
     */
    public Sanitized sanitize(String text) {
        List<String> violations = new ArrayList<>();
        String cleaned = removePhrases(text == null ? "" : text, violations);
        if (cleaned.length() > maxResponseLength) {
            cleaned = cleaned.substring(0, maxResponseLength) + "...";
            violations.add("Response truncated at " + maxResponseLength + " characters");
        }
        return new Sanitized(cleaned, violations);
    }

    /**
     * Starts cleaning a streamed answer. The filter holds back a tail as long
     * as the longest phrase so a phrase split across fragments is still
     * removed.
     */
    public FragmentFilter fragmentFilter() {
        return new FragmentFilter();
    }

    private String removePhrases(String text, List<String> violations) {
        String result = text;
        for (int i = 0; i < prohibitedPhrases.size(); i++) {
            Matcher matcher = prohibitedPhrases.get(i).matcher(result);
            if (matcher.find()) {
                violations.add("Removed phrase: \"" + phrases.get(i).toLowerCase(Locale.ROOT) + "\"");
                result = matcher.replaceAll("");
            }
        }
        return result;
    }

    /**
     * Cleans the fragments of one streamed answer, in order. Not thread-safe.
     */
    public final class FragmentFilter {

        private final StringBuilder pending = new StringBuilder();
        private final Set<String> violations = new LinkedHashSet<>();
        private int emittedLength;

        private FragmentFilter() {
        }

        /**
         * Add the next fragment and return the text that can be emitted now.
         */
        public String accept(String fragment) {
            pending.append(fragment == null ? "" : fragment);
            String cleaned = clean(pending.toString());
            int hold = Math.min(cleaned.length(), holdBack);
            pending.setLength(0);
            pending.append(cleaned, cleaned.length() - hold, cleaned.length());
            return limit(cleaned.substring(0, cleaned.length() - hold));
        }

        /**
         * Release the held back tail once the stream has ended.
         */
        public String finish() {
            String cleaned = clean(pending.toString());
            pending.setLength(0);
            return limit(cleaned);
        }

        public List<String> violations() {
            return List.copyOf(violations);
        }

        private String clean(String text) {
            List<String> found = new ArrayList<>();
            String cleaned = removePhrases(text, found);
            violations.addAll(found);
            return cleaned;
        }

        private String limit(String text) {
            if (text.isEmpty()) {
                return text;
            }
            int remaining = maxResponseLength - emittedLength;
            String allowed = text.length() > remaining ? text.substring(0, Math.max(0, remaining)) : text;
            if (allowed.length() < text.length()) {
                violations.add("Response truncated at " + maxResponseLength + " characters");
            }
            emittedLength += allowed.length();
            return allowed;
        }
    }

    /**
     * Cleaned text and the rules that fired.
     */
    public record Sanitized(String text, List<String> violations) {

        public Sanitized {
            violations = List.copyOf(violations);
        }

        public boolean hasViolations() {
            return !violations.isEmpty();
        }
    }
}
