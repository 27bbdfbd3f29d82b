package ch.so.arp.finrag.retrieval;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.finrag.index.MetadataFilter;
import ch.so.arp.finrag.llm.CompletionRequest;
import ch.so.arp.finrag.llm.LanguageModel;
import ch.so.arp.finrag.resilience.RequestCancelledException;

/**
 * Hypothetical document embedding: a short answer to the query, written in
 * the style of an earnings call, is embedded instead of the query itself. If
 * the answer cannot be generated the query is searched as-is.
 */
class HydeRetrievalStrategy implements RetrievalStrategy {

    private static final Logger LOGGER = LoggerFactory.getLogger(HydeRetrievalStrategy.class);

    private static final int MAX_TOKENS = 300;

    private final LanguageModel languageModel;
    private final DenseRetrievalStrategy dense;

    HydeRetrievalStrategy(LanguageModel languageModel, DenseRetrievalStrategy dense) {
        this.languageModel = Objects.requireNonNull(languageModel, "languageModel");
        this.dense = Objects.requireNonNull(dense, "dense");
    }

    @Override
    public StrategyType type() {
        return StrategyType.HYDE;
    }

    @Override
    public RetrievalResult retrieve(RetrievalQuery query, int topK, MetadataFilter filter) {
        String document = generate(query.text());
        if (document == null) {
            return new RetrievalResult(StrategyType.HYDE, false,
                    dense.search(query.text(), topK, filter, StrategyType.HYDE), null, null);
        }
        return new RetrievalResult(StrategyType.HYDE, false, dense.search(document, topK, filter, StrategyType.HYDE),
                null, document);
    }

    private String generate(String query) {
        try {
            String text = languageModel.complete(CompletionRequest.prompt(RetrievalPrompts.hyde(query), MAX_TOKENS, 0.3d))
                    .text()
                    .trim();
            if (text.isEmpty()) {
                LOGGER.warn("HyDE generation returned no text, searching with the raw query");
                return null;
            }
            return text;
        } catch (RequestCancelledException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            LOGGER.warn("HyDE generation failed, searching with the raw query: {}", ex.getMessage());
            return null;
        }
    }
}
