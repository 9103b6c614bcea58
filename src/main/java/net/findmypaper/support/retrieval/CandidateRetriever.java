package net.findmypaper.support.retrieval;

import java.util.List;

/**
 * Nearest-neighbour lookup from a text to corpus paper ids.
 *
 * <p>Implementations return at most {@code limit} ids, best match first. The returned order
 * is authoritative: callers never re-break ties. An empty list means nothing matched and is
 * not an error.</p>
 */
public interface CandidateRetriever {

    /**
     * @param text query text (an abstract, a title or a free-text query)
     * @param limit maximum number of ids to return (K)
     * @return ordered paper ids, possibly empty
     */
    List<String> retrieve(String text, int limit);
}
