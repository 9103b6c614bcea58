package net.findmypaper.exception;

import java.nio.file.Path;

/**
 * The user library file is missing, unreadable, of an unknown format or holds no usable entries.
 */
public class LibraryLoadException extends PaperRecommendationException {

    private final Path path;

    public LibraryLoadException(Path path, String reason) {
        this(path, reason, null);
    }

    public LibraryLoadException(Path path, String reason, Throwable cause) {
        super(ErrorCode.INPUT_LOAD, "Failed to load library " + path + ": " + reason, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
