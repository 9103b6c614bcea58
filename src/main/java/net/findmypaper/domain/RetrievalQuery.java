package net.findmypaper.domain;

/**
 * One retrieval call: the text sent to the candidate retriever and its result bound K.
 *
 * @param label short description used in logs (a library title, or the query itself)
 * @param text text the retriever matches against the corpus
 * @param resultBound maximum number of candidates requested (K)
 */
public record RetrievalQuery(String label, String text, int resultBound) {

    public RetrievalQuery {
        if (resultBound < 1) {
            throw new IllegalArgumentException("resultBound must be positive, got " + resultBound);
        }
    }
}
