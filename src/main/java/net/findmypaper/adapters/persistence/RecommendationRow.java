package net.findmypaper.adapters.persistence;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import jakarta.annotation.Nullable;
import net.findmypaper.domain.ScoredPaper;
import net.findmypaper.model.Paper;

import java.util.Arrays;
import java.util.List;

/**
 * One line of a saved recommendation file.
 *
 * @param rank 1-based position in the ranked output
 * @param authors author names joined by {@value #AUTHOR_SEPARATOR}
 * @param score normalised recommendation score
 */
@JsonPropertyOrder({"rank", "id", "title", "year", "authors", "journal", "doi", "url", "score"})
public record RecommendationRow(
    int rank,
    String id,
    String title,
    @Nullable Integer year,
    @Nullable String authors,
    @Nullable String journal,
    @Nullable String doi,
    @Nullable String url,
    double score
) {

    public static final String AUTHOR_SEPARATOR = "; ";

    static RecommendationRow from(int rank, ScoredPaper scored) {
        Paper paper = scored.paper();
        return new RecommendationRow(
            rank,
            paper.getId(),
            paper.getTitle(),
            paper.getYear(),
            String.join(AUTHOR_SEPARATOR, paper.getAuthors()),
            paper.getJournal(),
            paper.getDoi(),
            paper.getUrl(),
            scored.score());
    }

    public List<String> authorList() {
        if (authors == null || authors.isBlank()) {
            return List.of();
        }
        return Arrays.stream(authors.split(";"))
            .map(String::trim)
            .filter(name -> !name.isEmpty())
            .toList();
    }
}
