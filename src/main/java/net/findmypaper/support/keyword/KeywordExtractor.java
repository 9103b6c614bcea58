package net.findmypaper.support.keyword;

import java.util.List;

/**
 * Extracts the most representative keywords of a text, most representative first.
 */
public interface KeywordExtractor {

    /**
     * @param text text to analyse, possibly blank
     * @param limit maximum number of keywords (K)
     * @return distinct keywords, best first, at most {@code limit}
     */
    List<String> extract(String text, int limit);
}
