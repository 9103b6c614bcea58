package net.findmypaper.exception;

import java.util.Objects;

/**
 * Base type for failures that abort a recommendation run.
 *
 * <p>Every subtype carries an {@link ErrorCode} so the command runner can report the
 * failing resource without inspecting the concrete exception class. Non-fatal conditions
 * (a query with no candidates, an empty filtered set) are never raised as exceptions.</p>
 */
public class PaperRecommendationException extends RuntimeException {

    /**
     * Canonical failure categories for a recommendation run.
     */
    public enum ErrorCode {
        DATA_CONSISTENCY,
        INPUT_LOAD,
        MISSING_RESOURCE
    }

    private final ErrorCode errorCode;

    public PaperRecommendationException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public PaperRecommendationException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
    }

    /**
     * Returns the canonical classification for this failure.
     */
    public ErrorCode errorCode() {
        return errorCode;
    }
}
