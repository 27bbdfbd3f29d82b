package ch.so.arp.finrag.retrieval;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import ch.so.arp.finrag.sparse.SparseVectorizer;

/**
 * Tuning of the retrieval strategies and of the auto-selector.
 */
@ConfigurationProperties(prefix = "finrag.retrieval")
public class RetrievalProperties {

    private int defaultTopK = 10;

    /**
     * Strategy used when a request names none.
     */
    private StrategyType defaultStrategy = StrategyType.AUTO;

    /**
     * Weight of the dense score in hybrid retrieval.
     */
    private double hybridAlpha = 0.6d;

    /**
     * Dense candidates fetched per requested chunk when hybrid scores are
     * combined on the client.
     */
    private int hybridPoolFactor = 3;

    /**
     * Always re-rank on the client, even if the index fuses scores itself.
     */
    private boolean hybridClientRerank = false;

    private int rrfK = 60;

    /**
     * Queries searched by multi-query retrieval, the original included.
     */
    private int multiQueryVariants = 3;

    private int perVariantTopK = 20;

    private int sparseHashSpace = SparseVectorizer.DEFAULT_HASH_SPACE;

    private long sparseCacheSize = 1000;

    private final Auto auto = new Auto();

    public int getDefaultTopK() {
        return defaultTopK;
    }

    public void setDefaultTopK(int defaultTopK) {
        this.defaultTopK = defaultTopK;
    }

    public StrategyType getDefaultStrategy() {
        return defaultStrategy;
    }

    public void setDefaultStrategy(StrategyType defaultStrategy) {
        this.defaultStrategy = defaultStrategy;
    }

    public double getHybridAlpha() {
        return hybridAlpha;
    }

    public void setHybridAlpha(double hybridAlpha) {
        this.hybridAlpha = hybridAlpha;
    }

    public int getHybridPoolFactor() {
        return hybridPoolFactor;
    }

    public void setHybridPoolFactor(int hybridPoolFactor) {
        this.hybridPoolFactor = hybridPoolFactor;
    }

    public boolean isHybridClientRerank() {
        return hybridClientRerank;
    }

    public void setHybridClientRerank(boolean hybridClientRerank) {
        this.hybridClientRerank = hybridClientRerank;
    }

    public int getRrfK() {
        return rrfK;
    }

    public void setRrfK(int rrfK) {
        this.rrfK = rrfK;
    }

    public int getMultiQueryVariants() {
        return multiQueryVariants;
    }

    public void setMultiQueryVariants(int multiQueryVariants) {
        this.multiQueryVariants = multiQueryVariants;
    }

    public int getPerVariantTopK() {
        return perVariantTopK;
    }

    public void setPerVariantTopK(int perVariantTopK) {
        this.perVariantTopK = perVariantTopK;
    }

    public int getSparseHashSpace() {
        return sparseHashSpace;
    }

    public void setSparseHashSpace(int sparseHashSpace) {
        this.sparseHashSpace = sparseHashSpace;
    }

    public long getSparseCacheSize() {
        return sparseCacheSize;
    }

    public void setSparseCacheSize(long sparseCacheSize) {
        this.sparseCacheSize = sparseCacheSize;
    }

    public Auto getAuto() {
        return auto;
    }

    /**
     * Rules of the auto-selector.
     */
    public static class Auto {

        private List<String> comparisonMarkers = new ArrayList<>(List.of(
                "compare", "comparison", " vs ", " vs. ", "versus", "difference between", "relative to",
                "better than", "outperform"));

        private List<String> numericPatterns = new ArrayList<>(List.of(
                "\\bq[1-4]\\b",
                "\\b(19|20)\\d{2}\\b",
                "\\bfy\\s?\\d{2,4}\\b",
                "\\$\\s?\\d",
                "\\d+(\\.\\d+)?\\s?%",
                "\\b\\d+(\\.\\d+)?\\s?(billion|million|bn|mm)\\b",
                "\\b(eps|ebitda)\\b"));

        private List<String> vaguePhrases = new ArrayList<>(List.of(
                "what's going on", "what is going on", "any concerns", "tell me about", "thoughts on",
                "what about", "how are things", "anything interesting", "overview of", "big picture"));

        private int vagueMaxWords = 3;

        public List<String> getComparisonMarkers() {
            return comparisonMarkers;
        }

        public void setComparisonMarkers(List<String> comparisonMarkers) {
            this.comparisonMarkers = comparisonMarkers;
        }

        public List<String> getNumericPatterns() {
            return numericPatterns;
        }

        public void setNumericPatterns(List<String> numericPatterns) {
            this.numericPatterns = numericPatterns;
        }

        public List<String> getVaguePhrases() {
            return vaguePhrases;
        }

        public void setVaguePhrases(List<String> vaguePhrases) {
            this.vaguePhrases = vaguePhrases;
        }

        public int getVagueMaxWords() {
            return vagueMaxWords;
        }

        public void setVagueMaxWords(int vagueMaxWords) {
            this.vagueMaxWords = vagueMaxWords;
        }

        ClassificationRules toRules() {
            return ClassificationRules.of(comparisonMarkers, numericPatterns, vaguePhrases, vagueMaxWords);
        }
    }
}
