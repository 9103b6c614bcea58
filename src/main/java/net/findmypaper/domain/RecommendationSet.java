package net.findmypaper.domain;

import lombok.extern.slf4j.Slf4j;
import net.findmypaper.model.LibraryEntry;
import net.findmypaper.model.Paper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Scored recommendation rows owned by a single query invocation.
 *
 * <p>Rows are unique by title. The set is narrowed in place through its lifecycle:
 * {@link #removeOverlap} and {@link #filterByYear} drop rows, then {@link #rankAndTruncate}
 * orders the survivors and keeps the top N. Truncation is only ever applied after filtering,
 * so every kept slot belongs to an eligible paper. Table and CSV export live in the
 * presentation and persistence adapters.</p>
 */
@Slf4j
public final class RecommendationSet implements Iterable<ScoredPaper> {

    private static final Comparator<ScoredPaper> BY_SCORE_DESCENDING =
        Comparator.comparingDouble(ScoredPaper::score).reversed();

    private final List<ScoredPaper> rows;

    private RecommendationSet(List<ScoredPaper> rows) {
        this.rows = rows;
    }

    public static RecommendationSet empty() {
        return new RecommendationSet(new ArrayList<>());
    }

    /**
     * Builds a set from already scored rows, keeping the first row for each title.
     */
    public static RecommendationSet of(Collection<ScoredPaper> scoredPapers) {
        List<ScoredPaper> unique = new ArrayList<>();
        Set<String> seenTitles = new HashSet<>();
        if (scoredPapers != null) {
            for (ScoredPaper scored : scoredPapers) {
                if (scored != null && seenTitles.add(scored.title())) {
                    unique.add(scored);
                }
            }
        }
        return new RecommendationSet(unique);
    }

    /**
     * Materialises a score map against the corpus.
     *
     * <p>Each title resolves to its first corpus paper, so duplicate-titled corpus entries
     * collapse into one row. Titles the corpus does not know are dropped. Scores are
     * normalised by the map's maximum attainable points. Rows keep the order in which
     * titles were first surfaced.</p>
     */
    public static RecommendationSet fromScores(ScoreMap scores, Corpus corpus) {
        Objects.requireNonNull(scores, "scores must not be null");
        Objects.requireNonNull(corpus, "corpus must not be null");
        List<ScoredPaper> rows = new ArrayList<>(scores.size());
        for (String title : scores.titles()) {
            Paper paper = corpus.findByTitle(title).orElse(null);
            if (paper == null) {
                log.debug("Dropping scored title with no corpus paper: \"{}\"", title);
                continue;
            }
            rows.add(new ScoredPaper(paper, scores.normalizedScore(title)));
        }
        return new RecommendationSet(rows);
    }

    /**
     * Removes every row whose title exactly matches a library entry title.
     *
     * @return number of rows removed
     */
    public int removeOverlap(Collection<LibraryEntry> library) {
        if (library == null || library.isEmpty()) {
            return 0;
        }
        Set<String> libraryTitles = new HashSet<>();
        for (LibraryEntry entry : library) {
            if (entry != null && entry.title() != null) {
                libraryTitles.add(entry.title());
            }
        }
        return removeTitles(libraryTitles);
    }

    /**
     * Removes every row whose title is in {@code titles} (exact, case-sensitive).
     *
     * @return number of rows removed
     */
    public int removeTitles(Collection<String> titles) {
        if (titles == null || titles.isEmpty()) {
            return 0;
        }
        Set<String> excluded = titles instanceof Set<String> set ? set : new HashSet<>(titles);
        int before = rows.size();
        rows.removeIf(row -> excluded.contains(row.title()));
        return before - rows.size();
    }

    /**
     * Keeps only rows whose publication year lies in {@code range} (inclusive).
     *
     * @return number of rows removed
     */
    public int filterByYear(YearRange range) {
        if (range == null || !range.isBounded()) {
            return 0;
        }
        int before = rows.size();
        rows.removeIf(row -> !range.contains(row.year()));
        return before - rows.size();
    }

    /**
     * Sorts rows by score, highest first, and keeps the first {@code count}.
     *
     * <p>The sort is stable: rows with exactly equal scores keep their current relative order.
     * A non-positive count empties the set; a count above the size keeps every row.</p>
     *
     * @return this set, for chaining
     */
    public RecommendationSet rankAndTruncate(int count) {
        rows.sort(BY_SCORE_DESCENDING);
        if (count <= 0) {
            rows.clear();
        } else if (count < rows.size()) {
            rows.subList(count, rows.size()).clear();
        }
        return this;
    }

    public List<ScoredPaper> rows() {
        return List.copyOf(rows);
    }

    public List<String> titles() {
        return rows.stream().map(ScoredPaper::title).toList();
    }

    public Stream<ScoredPaper> stream() {
        return rows.stream();
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    @Override
    public Iterator<ScoredPaper> iterator() {
        return rows().iterator();
    }
}
