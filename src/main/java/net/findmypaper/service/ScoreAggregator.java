package net.findmypaper.service;

import lombok.extern.slf4j.Slf4j;
import net.findmypaper.domain.Corpus;
import net.findmypaper.domain.RetrievalQuery;
import net.findmypaper.domain.ScoreMap;
import net.findmypaper.model.Paper;
import net.findmypaper.repository.CorpusRepository;
import net.findmypaper.support.progress.ProgressListener;
import net.findmypaper.support.retrieval.CandidateRetriever;
import net.findmypaper.util.PagingUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Borda-count aggregation of retrieval results into a {@link ScoreMap}.
 *
 * <p>The candidate at rank {@code r} (0-based) of a query with result bound {@code K}
 * earns {@code K - r} points, never less than {@value #MIN_RANK_WEIGHT}. Candidates are
 * resolved to their corpus title immediately and points are summed per title, so papers
 * surfaced often and high across many queries outrank papers surfaced once at the top.</p>
 */
@Component
@Slf4j
public class ScoreAggregator {

    static final int MIN_RANK_WEIGHT = 1;

    private final CandidateRetriever retriever;
    private final CorpusRepository corpusRepository;

    public ScoreAggregator(CandidateRetriever retriever, CorpusRepository corpusRepository) {
        this.retriever = retriever;
        this.corpusRepository = corpusRepository;
    }

    /**
     * Runs every query and sums their rank weights into one map.
     */
    public ScoreMap aggregate(List<RetrievalQuery> queries, ProgressListener progress) {
        ScoreMap scores = new ScoreMap();
        int total = queries.size();
        int completed = 0;
        for (RetrievalQuery query : queries) {
            accumulate(scores, query);
            progress.onStep("Selecting best matches", ++completed, total);
        }
        log.debug("Aggregated {} queries into {} scored titles", scores.queryCount(), scores.size());
        return scores;
    }

    /**
     * Runs one query and adds its rank weights to {@code scores}.
     *
     * <p>The query always counts towards the normalisation denominator, even when it
     * surfaces nothing. Within one query a title keeps the weight of its best rank only.
     * Ids the corpus does not know still occupy their rank but contribute nothing.</p>
     */
    public void accumulate(ScoreMap scores, RetrievalQuery query) {
        int bound = query.resultBound();
        scores.recordQuery(bound);

        List<String> candidateIds = retriever.retrieve(query.text(), bound);
        if (candidateIds == null || candidateIds.isEmpty()) {
            log.debug("Could not find any suggested papers for: \"{}\"", query.label());
            return;
        }
        if (candidateIds.size() > bound) {
            log.warn("Retriever returned {} candidates for a bound of {}; ignoring the excess", candidateIds.size(), bound);
        }

        Corpus corpus = corpusRepository.corpus();
        Set<String> seenTitles = new HashSet<>();
        int limit = Math.min(bound, candidateIds.size());
        for (int rank = 0; rank < limit; rank++) {
            String candidateId = candidateIds.get(rank);
            String title = corpus.findById(candidateId).map(Paper::getTitle).orElse(null);
            if (!StringUtils.hasText(title)) {
                log.debug("Retriever returned unknown paper id {}; skipping", candidateId);
                continue;
            }
            if (seenTitles.add(title)) {
                scores.add(title, rankWeight(bound, rank));
            }
        }
    }

    /**
     * Points earned by the candidate at {@code rank} of a query bounded by {@code bound}.
     */
    public static int rankWeight(int bound, int rank) {
        return PagingUtils.atLeast(bound - rank, MIN_RANK_WEIGHT);
    }
}
