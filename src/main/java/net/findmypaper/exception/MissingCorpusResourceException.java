package net.findmypaper.exception;

import java.nio.file.Path;

/**
 * A file the engine needs (corpus metadata, abstracts) is absent.
 * RETRYABLE: No (the file has to be provided before the next run)
 */
public class MissingCorpusResourceException extends PaperRecommendationException {

    private final Path resource;

    public MissingCorpusResourceException(Path resource) {
        super(ErrorCode.MISSING_RESOURCE, "At least one necessary file is missing: " + resource);
        this.resource = resource;
    }

    public Path resource() {
        return resource;
    }
}
