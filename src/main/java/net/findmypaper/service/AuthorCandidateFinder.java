package net.findmypaper.service;

import lombok.extern.slf4j.Slf4j;
import net.findmypaper.domain.Corpus;
import net.findmypaper.domain.RecommendationSet;
import net.findmypaper.domain.ScoredPaper;
import net.findmypaper.model.Paper;
import net.findmypaper.util.AuthorNames;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Builds a candidate set from author names instead of retrieval.
 *
 * <p>Query names and every paper's author list go through {@link AuthorNames#normalize};
 * a paper matches when any query name is one of its normalised authors. Every match scores
 * {@value #MATCH_SCORE}, so ranking falls back to corpus order.</p>
 */
@Component
@Slf4j
public class AuthorCandidateFinder {

    static final double MATCH_SCORE = 1.0;

    public RecommendationSet findByAuthors(Collection<String> authorNames, Corpus corpus) {
        Set<String> wanted = AuthorNames.normalizeAll(authorNames);
        if (wanted.isEmpty()) {
            log.warn("No usable author names in query {}", authorNames);
            return RecommendationSet.empty();
        }

        List<ScoredPaper> matches = new ArrayList<>();
        for (Paper paper : corpus.papers()) {
            if (!Collections.disjoint(wanted, AuthorNames.normalizeAll(paper.getAuthors()))) {
                matches.add(new ScoredPaper(paper, MATCH_SCORE));
            }
        }
        log.debug("Found {} papers by authors {}", matches.size(), wanted);
        return RecommendationSet.of(matches);
    }
}
