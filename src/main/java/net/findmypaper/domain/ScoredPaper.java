package net.findmypaper.domain;

import net.findmypaper.model.Paper;

import java.util.Objects;

/**
 * Value object tracking a corpus paper with its normalised recommendation score.
 *
 * @param paper the recommended paper
 * @param score normalised relevance in {@code (0, 1]}, higher is more relevant
 */
public record ScoredPaper(Paper paper, double score) {

    public ScoredPaper {
        Objects.requireNonNull(paper, "paper must not be null");
    }

    public String title() {
        return paper.getTitle();
    }

    public Integer year() {
        return paper.getYear();
    }
}
