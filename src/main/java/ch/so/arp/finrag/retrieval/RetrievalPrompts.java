package ch.so.arp.finrag.retrieval;

/**
 * Prompts used to rewrite queries before retrieval.
 */
final class RetrievalPrompts {

    private RetrievalPrompts() {
    }

    static String hyde(String query) {
        return """
                You are a financial document generator. Given this question, write a hypothetical paragraph that \
                would appear in an earnings call transcript or financial filing that perfectly answers it.

                ## Requirements
                - Write 2-3 sentences as if from an actual earnings call
                - Use realistic but placeholder numbers (e.g., $X billion, Y%% growth)
                - Include typical financial terminology and phrasing
                - Sound like a CFO or CEO speaking on an earnings call

                ## Question
                "%s"

                ## Hypothetical Document Excerpt:""".formatted(query);
    }

    static String queryVariants(String query, int count) {
        return """
                Generate %d alternative search queries that capture different aspects of this financial question. \
                Each should surface different relevant documents.

                Original: "%s"

                ## Guidelines
                - Vary terminology (revenue vs. sales vs. top-line)
                - Vary specificity (broader context vs. exact metric)
                - Consider what a CFO vs. CEO vs. analyst might say about this topic

                ## Output
                Return exactly %d queries, one per line, no numbering or bullets.""".formatted(count, query, count);
    }
}
