package ch.so.arp.finrag.llm;

import java.util.Locale;

/**
 * Whether the model may request tools. {@link #NONE} still allows tool
 * history in the conversation but forces a text answer.
 */
public enum ToolChoice {
    AUTO,
    NONE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
