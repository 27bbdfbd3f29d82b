package ch.so.arp.finrag.embedding;

/**
 * Side of an asymmetric embedding model the text is embedded for.
 */
public enum EmbeddingKind {

    QUERY("query"),
    DOCUMENT("document");

    private final String wireName;

    EmbeddingKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
