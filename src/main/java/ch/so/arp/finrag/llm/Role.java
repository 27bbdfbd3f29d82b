package ch.so.arp.finrag.llm;

import java.util.Locale;

public enum Role {
    USER,
    ASSISTANT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
