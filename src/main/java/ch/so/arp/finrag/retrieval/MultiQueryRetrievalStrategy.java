package ch.so.arp.finrag.retrieval;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.finrag.index.MetadataFilter;
import ch.so.arp.finrag.llm.CompletionRequest;
import ch.so.arp.finrag.llm.LanguageModel;
import ch.so.arp.finrag.resilience.RequestCancelledException;

/**
 * Searches the original query and model-written variants separately and
 * merges the lists with {@link ReciprocalRankFusion}. Without variants it
 * degrades to a single fused dense search.
 */
class MultiQueryRetrievalStrategy implements RetrievalStrategy {

    private static final Logger LOGGER = LoggerFactory.getLogger(MultiQueryRetrievalStrategy.class);

    private static final int MAX_TOKENS = 200;
    private static final int MIN_VARIANT_LENGTH = 10;

    private final LanguageModel languageModel;
    private final DenseRetrievalStrategy dense;
    private final int totalQueries;
    private final int perVariantTopK;
    private final int rrfK;

    MultiQueryRetrievalStrategy(LanguageModel languageModel, DenseRetrievalStrategy dense, int totalQueries,
            int perVariantTopK, int rrfK) {
        this.languageModel = Objects.requireNonNull(languageModel, "languageModel");
        this.dense = Objects.requireNonNull(dense, "dense");
        this.totalQueries = Math.max(1, totalQueries);
        this.perVariantTopK = perVariantTopK;
        this.rrfK = rrfK;
    }

    @Override
    public StrategyType type() {
        return StrategyType.MULTI_QUERY;
    }

    @Override
    public RetrievalResult retrieve(RetrievalQuery query, int topK, MetadataFilter filter) {
        List<String> queries = queries(query.text());
        int limit = Math.max(perVariantTopK, topK);
        List<List<RankedChunk>> lists = new ArrayList<>(queries.size());
        for (String variant : queries) {
            lists.add(dense.search(variant, limit, filter, StrategyType.MULTI_QUERY));
        }
        List<RankedChunk> fused = ReciprocalRankFusion.fuse(lists, rrfK, StrategyType.MULTI_QUERY);
        LOGGER.debug("{} searches fused into {} chunks", queries.size(), fused.size());
        return new RetrievalResult(StrategyType.MULTI_QUERY, false,
                fused.subList(0, Math.min(topK, fused.size())), queries, null);
    }

    List<String> queries(String original) {
        Set<String> queries = new LinkedHashSet<>();
        queries.add(original);
        if (totalQueries > 1) {
            for (String variant : generateVariants(original)) {
                if (queries.size() >= totalQueries) {
                    break;
                }
                queries.add(variant);
            }
        }
        return List.copyOf(queries);
    }

    private List<String> generateVariants(String query) {
        String text;
        try {
            text = languageModel.complete(CompletionRequest.prompt(
                    RetrievalPrompts.queryVariants(query, totalQueries), MAX_TOKENS, 0.7d)).text();
        } catch (RequestCancelledException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            LOGGER.warn("Query variant generation failed, searching the original query only: {}", ex.getMessage());
            return List.of();
        }
        return parseVariants(text);
    }

    static List<String> parseVariants(String text) {
        List<String> variants = new ArrayList<>();
        for (String line : text.split("\\R")) {
            String cleaned = line.trim()
                    .replaceFirst("^(\\d+[.)]|[-*•])\\s*", "")
                    .replaceAll("^\"|\"$", "")
                    .trim();
            if (cleaned.length() > MIN_VARIANT_LENGTH && !cleaned.toLowerCase(Locale.ROOT).startsWith("here are")) {
                variants.add(cleaned);
            }
        }
        return variants;
    }
}
