package ch.so.arp.finrag.retrieval;

import java.util.List;

import ch.so.arp.finrag.index.MetadataFilter;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Payload of a direct retrieval request.
 */
public record RetrievalRequest(
        @NotBlank String query,
        StrategyType strategy,
        @Positive @Max(50) Integer topK,
        String ticker,
        Integer fiscalYear,
        String quarter) {

    RetrievalQuery toQuery() {
        return new RetrievalQuery(query, strategy, ticker == null || ticker.isBlank() ? List.of() : List.of(ticker));
    }

    MetadataFilter filter() {
        return new MetadataFilter(ticker, fiscalYear, quarter);
    }
}
