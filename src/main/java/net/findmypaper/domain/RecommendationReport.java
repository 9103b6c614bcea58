package net.findmypaper.domain;

/**
 * Everything one recommendation run produces.
 *
 * @param mode how candidates were produced
 * @param recommendations final ranked and truncated set
 * @param keywords keyword profile of the query side (library abstracts or query text)
 * @param authors author frequencies across the recommendations
 */
public record RecommendationReport(
    QueryMode mode,
    RecommendationSet recommendations,
    KeywordProfile keywords,
    AuthorProfile authors
) {
}
