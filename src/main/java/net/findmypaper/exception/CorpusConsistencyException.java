package net.findmypaper.exception;

/**
 * Corpus metadata and its abstracts disagree, or a corpus file cannot be parsed.
 * Raised before any retrieval happens.
 */
public class CorpusConsistencyException extends PaperRecommendationException {

    public CorpusConsistencyException(String message) {
        super(ErrorCode.DATA_CONSISTENCY, message);
    }

    public CorpusConsistencyException(String message, Throwable cause) {
        super(ErrorCode.DATA_CONSISTENCY, message, cause);
    }

    public static CorpusConsistencyException countMismatch(int papers, int abstracts) {
        return new CorpusConsistencyException(
            "Error while loading corpus. Expected same number of papers and abstracts, found %d papers and %d abstracts"
                .formatted(papers, abstracts));
    }
}
