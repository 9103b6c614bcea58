package net.findmypaper.domain;

import net.findmypaper.model.Paper;
import org.springframework.util.StringUtils;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only, in-memory view of the paper corpus with id and title lookups.
 *
 * <p>Titles are not guaranteed unique; {@link #findByTitle} returns the first paper in
 * corpus order carrying the title, which is the row recommendations are built from.</p>
 */
public final class Corpus {

    private final List<Paper> papers;
    private final Map<String, Paper> byId;
    private final Map<String, Paper> byTitle;

    private Corpus(List<Paper> papers) {
        this.papers = List.copyOf(papers);
        Map<String, Paper> ids = new HashMap<>();
        Map<String, Paper> titles = new HashMap<>();
        for (Paper paper : this.papers) {
            if (StringUtils.hasText(paper.getId())) {
                ids.putIfAbsent(paper.getId(), paper);
            }
            if (StringUtils.hasText(paper.getTitle())) {
                titles.putIfAbsent(paper.getTitle(), paper);
            }
        }
        this.byId = Collections.unmodifiableMap(ids);
        this.byTitle = Collections.unmodifiableMap(titles);
    }

    public static Corpus of(List<Paper> papers) {
        return new Corpus(papers == null ? List.of() : papers);
    }

    /** Papers in corpus order, duplicates included. */
    public List<Paper> papers() {
        return papers;
    }

    public Optional<Paper> findById(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
    }

    public Optional<Paper> findByTitle(String title) {
        return title == null ? Optional.empty() : Optional.ofNullable(byTitle.get(title));
    }

    public int size() {
        return papers.size();
    }

    public boolean isEmpty() {
        return papers.isEmpty();
    }
}
