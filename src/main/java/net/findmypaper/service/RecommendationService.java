/**
 * Service for recommending corpus papers from a library, a free-text query or author names.
 *
 * <p>Composes {@link ScoreAggregator} (retrieval and rank voting), {@link AuthorCandidateFinder}
 * (author-name candidates) and the {@link RecommendationSet} filters, then derives the keyword
 * and author summaries of the run.</p>
 */
package net.findmypaper.service;

import lombok.extern.slf4j.Slf4j;
import net.findmypaper.config.RecommendationProperties;
import net.findmypaper.domain.AuthorProfile;
import net.findmypaper.domain.Corpus;
import net.findmypaper.domain.KeywordProfile;
import net.findmypaper.domain.QueryMode;
import net.findmypaper.domain.RecommendationReport;
import net.findmypaper.domain.RecommendationRequest;
import net.findmypaper.domain.RecommendationSet;
import net.findmypaper.domain.RetrievalQuery;
import net.findmypaper.domain.ScoreMap;
import net.findmypaper.domain.ScoredPaper;
import net.findmypaper.model.LibraryEntry;
import net.findmypaper.model.Paper;
import net.findmypaper.repository.CorpusRepository;
import net.findmypaper.support.progress.ProgressListener;
import net.findmypaper.util.StringUtils;
import net.findmypaper.util.ValidationUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Service
@Slf4j
public class RecommendationService {

    private final CorpusRepository corpusRepository;
    private final ScoreAggregator scoreAggregator;
    private final KeywordAggregator keywordAggregator;
    private final AuthorAggregator authorAggregator;
    private final AuthorCandidateFinder authorCandidateFinder;
    private final RecommendationProperties properties;

    /**
     * Constructs the RecommendationService with required dependencies.
     */
    public RecommendationService(CorpusRepository corpusRepository,
                                 ScoreAggregator scoreAggregator,
                                 KeywordAggregator keywordAggregator,
                                 AuthorAggregator authorAggregator,
                                 AuthorCandidateFinder authorCandidateFinder,
                                 RecommendationProperties properties) {
        this.corpusRepository = corpusRepository;
        this.scoreAggregator = scoreAggregator;
        this.keywordAggregator = keywordAggregator;
        this.authorAggregator = authorAggregator;
        this.authorCandidateFinder = authorCandidateFinder;
        this.properties = properties;
    }

    /**
     * Recommends papers similar to the user's library.
     *
     * @param library papers the user already has; never recommended back
     * @param request output count, year window and any extra titles to exclude
     * @param progress stage observer
     * @return ranked recommendations with keyword and author summaries
     *
     * @implNote One retrieval per library paper (its abstract, or its title when the
     * abstract is missing), rank weights summed per title across all of them, scores
     * normalised by {@code K x library size}. Overlap and year filters run before truncation.
     */
    public RecommendationReport recommendForLibrary(List<LibraryEntry> library,
                                                    RecommendationRequest request,
                                                    ProgressListener progress) {
        if (ValidationUtils.isNullOrEmpty(library)) {
            log.warn("Empty library: nothing to recommend from");
            return emptyReport(QueryMode.LIBRARY);
        }
        log.debug("Getting suggestions for {} papers", library.size());

        progress.onStage("Loading corpus");
        Corpus corpus = corpusRepository.corpus();

        progress.onStage("Finding matches");
        int bound = properties.getCandidatesPerQuery();
        List<RetrievalQuery> queries = library.stream()
            .map(entry -> new RetrievalQuery(entry.title(), queryText(entry), bound))
            .toList();
        ScoreMap scores = scoreAggregator.aggregate(queries, progress);

        progress.onStage("Collating suggestions");
        List<LibraryEntry> exclusions = new ArrayList<>(library);
        exclusions.addAll(request.context());
        RecommendationSet recommendations = narrow(RecommendationSet.fromScores(scores, corpus),
            request.withContext(exclusions));

        progress.onStage("Extracting keywords");
        KeywordProfile keywords = keywordAggregator.aggregate(library, properties.getKeywordsPerDocument());
        return report(QueryMode.LIBRARY, recommendations, keywords);
    }

    /**
     * Recommends papers matching a single free-text query.
     *
     * @param query free text matched against the corpus
     * @param request output count, year window and optional library context to exclude
     * @param progress stage observer
     * @return ranked recommendations with the query's keywords and author summary
     */
    public RecommendationReport recommendForText(String query,
                                                 RecommendationRequest request,
                                                 ProgressListener progress) {
        if (query == null || query.isBlank()) {
            log.warn("Blank query: nothing to recommend from");
            return emptyReport(QueryMode.TEXT);
        }

        progress.onStage("Loading corpus");
        Corpus corpus = corpusRepository.corpus();

        progress.onStage("Finding matches");
        ScoreMap scores = scoreAggregator.aggregate(
            List.of(new RetrievalQuery(query, query, properties.getCandidatesPerQuery())), progress);

        progress.onStage("Collating suggestions");
        RecommendationSet recommendations = narrow(RecommendationSet.fromScores(scores, corpus), request);

        KeywordProfile keywords = keywordAggregator.aggregateText(query, properties.getKeywordsPerDocument());
        return report(QueryMode.TEXT, recommendations, keywords);
    }

    /**
     * Recommends papers written by any of the given authors. No retrieval is involved.
     *
     * @param authors author names, compared after normalisation
     * @param request output count, year window and optional library context to exclude
     * @param progress stage observer
     * @return matching papers in corpus order, with keywords of their abstracts
     */
    public RecommendationReport recommendForAuthors(List<String> authors,
                                                    RecommendationRequest request,
                                                    ProgressListener progress) {
        if (ValidationUtils.isNullOrEmpty(authors)) {
            log.warn("No authors given: nothing to recommend from");
            return emptyReport(QueryMode.AUTHORS);
        }

        progress.onStage("Loading corpus");
        Corpus corpus = corpusRepository.corpus();

        progress.onStage("Finding papers by author");
        RecommendationSet recommendations = narrow(authorCandidateFinder.findByAuthors(authors, corpus), request);

        KeywordProfile keywords = keywordAggregator.aggregateTexts(
            recommendations.stream().map(ScoredPaper::paper).map(Paper::getAbstractText).toList(),
            properties.getKeywordsPerDocument());
        return report(QueryMode.AUTHORS, recommendations, keywords);
    }

    private RecommendationSet narrow(RecommendationSet candidates, RecommendationRequest request) {
        int candidateCount = candidates.size();
        int overlapping = candidates.removeOverlap(request.context());
        int outOfRange = candidates.filterByYear(request.years());
        candidates.rankAndTruncate(request.count());

        log.debug("{} candidates: {} already in library, {} outside {}; keeping {}",
            candidateCount, overlapping, outOfRange, request.years(), candidates.size());
        if (candidates.isEmpty()) {
            log.warn("No recommendations left after filtering {} candidates", candidateCount);
        }
        return candidates;
    }

    private RecommendationReport report(QueryMode mode, RecommendationSet recommendations, KeywordProfile keywords) {
        AuthorProfile authors = authorAggregator.aggregate(recommendations);
        log.info("Recommending {} papers ({} query)", recommendations.size(), mode.name().toLowerCase(Locale.ROOT));
        return new RecommendationReport(mode, recommendations, keywords, authors);
    }

    private static RecommendationReport emptyReport(QueryMode mode) {
        return new RecommendationReport(mode, RecommendationSet.empty(), new KeywordProfile(), new AuthorProfile());
    }

    private static String queryText(LibraryEntry entry) {
        return StringUtils.coalesce(entry.abstractText(), entry.title());
    }
}
