package net.findmypaper.domain;

/**
 * How the initial candidate set of a recommendation run is produced.
 */
public enum QueryMode {
    /** One retrieval per paper of the user's library, aggregated. */
    LIBRARY,
    /** A single free-text retrieval. */
    TEXT,
    /** Author-name filter over the corpus, no retrieval. */
    AUTHORS
}
