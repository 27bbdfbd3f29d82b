package ch.so.arp.finrag.index;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Retrievable unit of evidence text with its provenance metadata. Instances
 * are read-only copies handed out by a {@link VectorIndex} per query.
 */
public record Chunk(
        String id,
        String text,
        String source,
        String ticker,
        Integer fiscalYear,
        String quarter,
        String section) {

    public Chunk {
        Objects.requireNonNull(id, "id");
        text = text == null ? "" : text;
        source = source == null ? "" : source;
        section = section == null ? "" : section;
    }

    /**
     * Formats the chunk for use inside a prompt, keeping the metadata next to
     * the text so the model can cite the source.
     */
    public String formatForPrompt() {
        StringJoiner joiner = new StringJoiner("\n");
        StringJoiner header = new StringJoiner(" ");
        if (ticker != null) {
            header.add(ticker);
        }
        if (quarter != null) {
            header.add(quarter);
        }
        if (fiscalYear != null) {
            header.add("FY" + fiscalYear);
        }
        if (header.length() > 0) {
            joiner.add("[" + header + "]");
        }
        if (!section.isBlank()) {
            joiner.add("Section: " + section);
        }
        joiner.add(text);
        if (!source.isBlank()) {
            joiner.add("Source: " + source);
        }
        return joiner.toString();
    }
}
