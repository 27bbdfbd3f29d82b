package ch.so.arp.finrag.orchestration;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Limits and output settings of the tool orchestration loop.
 */
@ConfigurationProperties(prefix = "finrag.orchestration")
public class OrchestrationProperties {

    private int maxToolLoops = 4;

    private int maxToolCallsPerLoop = 3;

    /**
     * Hard cap over all iterations, including the proactive financials fetch.
     */
    private int maxTotalToolCalls = 6;

    /**
     * Characters per {@code content} frame when a complete answer is replayed.
     */
    private int contentChunkSize = 5;

    private int maxTokens = 2400;

    private double temperature = 0.2;

    /**
     * Fetch the latest quarters up front when a question names a company and a
     * financial keyword.
     */
    private boolean prefetchFinancials = true;

    private List<String> prefetchKeywords = new ArrayList<>(
            List.of("revenue", "growth", "margin", "guidance", "data center", "datacenter", "earnings"));

    private int maxResponseLength = 2000;

    private List<String> prohibitedPhrases = new ArrayList<>(List.of(
            "based on the provided context",
            "i don't have access to",
            "as an ai language model",
            "i cannot provide financial advice"));

    public int getMaxToolLoops() {
        return maxToolLoops;
    }

    public void setMaxToolLoops(int maxToolLoops) {
        this.maxToolLoops = maxToolLoops;
    }

    public int getMaxToolCallsPerLoop() {
        return maxToolCallsPerLoop;
    }

    public void setMaxToolCallsPerLoop(int maxToolCallsPerLoop) {
        this.maxToolCallsPerLoop = maxToolCallsPerLoop;
    }

    public int getMaxTotalToolCalls() {
        return maxTotalToolCalls;
    }

    public void setMaxTotalToolCalls(int maxTotalToolCalls) {
        this.maxTotalToolCalls = maxTotalToolCalls;
    }

    public int getContentChunkSize() {
        return contentChunkSize;
    }

    public void setContentChunkSize(int contentChunkSize) {
        this.contentChunkSize = contentChunkSize;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public boolean isPrefetchFinancials() {
        return prefetchFinancials;
    }

    public void setPrefetchFinancials(boolean prefetchFinancials) {
        this.prefetchFinancials = prefetchFinancials;
    }

    public List<String> getPrefetchKeywords() {
        return prefetchKeywords;
    }

    public void setPrefetchKeywords(List<String> prefetchKeywords) {
        this.prefetchKeywords = prefetchKeywords;
    }

    public int getMaxResponseLength() {
        return maxResponseLength;
    }

    public void setMaxResponseLength(int maxResponseLength) {
        this.maxResponseLength = maxResponseLength;
    }

    public List<String> getProhibitedPhrases() {
        return prohibitedPhrases;
    }

    public void setProhibitedPhrases(List<String> prohibitedPhrases) {
        this.prohibitedPhrases = prohibitedPhrases;
    }
}
