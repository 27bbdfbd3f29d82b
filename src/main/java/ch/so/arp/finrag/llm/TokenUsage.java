package ch.so.arp.finrag.llm;

public record TokenUsage(int inputTokens, int outputTokens) {

    private static final TokenUsage EMPTY = new TokenUsage(0, 0);

    public static TokenUsage empty() {
        return EMPTY;
    }

    public int total() {
        return inputTokens + outputTokens;
    }
}
