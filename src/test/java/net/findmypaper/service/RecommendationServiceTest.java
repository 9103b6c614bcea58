package net.findmypaper.service;

import net.findmypaper.config.RecommendationProperties;
import net.findmypaper.domain.Corpus;
import net.findmypaper.domain.QueryMode;
import net.findmypaper.domain.RecommendationReport;
import net.findmypaper.domain.RecommendationRequest;
import net.findmypaper.domain.ScoredPaper;
import net.findmypaper.domain.YearRange;
import net.findmypaper.model.LibraryEntry;
import net.findmypaper.repository.CorpusRepository;
import net.findmypaper.support.keyword.FrequencyKeywordExtractor;
import net.findmypaper.support.progress.ProgressListener;
import net.findmypaper.support.retrieval.CandidateRetriever;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static net.findmypaper.testutil.PaperTestData.aPaper;
import static net.findmypaper.testutil.PaperTestData.corpusOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class RecommendationServiceTest {

    private static final Corpus CORPUS = corpusOf(
        aPaper().id("p1").title("Mine").year(2018).authors("Ada Lovelace").build(),
        aPaper().id("p2").title("Graphs 2010").year(2010).authors("Alan Turing").build(),
        aPaper().id("p3").title("Graphs 2015").year(2015).authors("Alan Turing", "Ada Lovelace").build(),
        aPaper().id("p4").title("Graphs 2019").year(2019).authors("Grace Hopper").build(),
        aPaper().id("p5").title("Graphs 2021").year(2021).authors("Alan Turing").build());

    @Mock
    private CorpusRepository corpusRepository;

    private final Map<String, List<String>> retrievals = new HashMap<>();
    private RecommendationService service;

    @BeforeEach
    void setUp() {
        lenient().when(corpusRepository.corpus()).thenReturn(CORPUS);
        CandidateRetriever retriever = (text, limit) -> retrievals.getOrDefault(text, List.of());
        RecommendationProperties properties = new RecommendationProperties();
        properties.setCandidatesPerQuery(10);
        properties.setKeywordsPerDocument(5);
        service = new RecommendationService(
            corpusRepository,
            new ScoreAggregator(retriever, corpusRepository),
            new KeywordAggregator(new FrequencyKeywordExtractor()),
            new AuthorAggregator(),
            new AuthorCandidateFinder(),
            properties);
    }

    @Test
    void should_ExcludeLibraryAndApplyYearWindow_When_RecommendingForLibrary() {
        retrievals.put("graph abstract", List.of("p1", "p2", "p3", "p4", "p5"));
        List<LibraryEntry> library = List.of(LibraryEntry.of("Mine", "graph abstract"));

        RecommendationReport report = service.recommendForLibrary(
            library, RecommendationRequest.of(10, YearRange.of(2015, 2019)), ProgressListener.NONE);

        assertThat(report.mode()).isEqualTo(QueryMode.LIBRARY);
        assertThat(report.recommendations().titles()).containsExactly("Graphs 2015", "Graphs 2019");
        assertThat(report.keywords().topKeywords(2)).containsExactly("graph", "abstract");
    }

    @Test
    void should_RankByAggregatedVotes_When_SeveralLibraryPapersAgree() {
        retrievals.put("first", List.of("p2", "p3"));
        retrievals.put("second", List.of("p3", "p4"));
        List<LibraryEntry> library = List.of(LibraryEntry.of("A", "first"), LibraryEntry.of("B", "second"));

        RecommendationReport report = service.recommendForLibrary(
            library, RecommendationRequest.of(2, YearRange.unbounded()), ProgressListener.NONE);

        List<ScoredPaper> rows = report.recommendations().rows();
        assertThat(rows).extracting(ScoredPaper::title).containsExactly("Graphs 2015", "Graphs 2010");
        assertThat(rows.get(0).score()).isEqualTo(19 / 20.0);
        assertThat(rows).allSatisfy(row -> assertThat(row.score()).isGreaterThan(0.0).isLessThanOrEqualTo(1.0));
    }

    @Test
    void should_FillSingleSlotWithNextEligiblePaper_When_TopCandidateIsInLibrary() {
        retrievals.put("graph abstract", List.of("p1", "p3", "p4"));
        List<LibraryEntry> library = List.of(LibraryEntry.of("Mine", "graph abstract"));

        RecommendationReport report = service.recommendForLibrary(
            library, RecommendationRequest.of(1, YearRange.unbounded()), ProgressListener.NONE);

        assertThat(report.recommendations().titles()).containsExactly("Graphs 2015");
    }

    @Test
    void should_FillSingleSlotWithNextEligiblePaper_When_TopCandidatesOutsideYearWindow() {
        retrievals.put("graph abstract", List.of("p2", "p5", "p4", "p3"));
        List<LibraryEntry> library = List.of(LibraryEntry.of("Mine", "graph abstract"));

        RecommendationReport report = service.recommendForLibrary(
            library, RecommendationRequest.of(1, YearRange.of(2015, 2019)), ProgressListener.NONE);

        assertThat(report.recommendations().titles()).containsExactly("Graphs 2019");
        assertThat(report.recommendations().rows().get(0).score()).isEqualTo(0.8);
    }

    @Test
    void should_QueryByTitle_When_LibraryEntryHasNoAbstract() {
        retrievals.put("Untitled work", List.of("p4"));

        RecommendationReport report = service.recommendForLibrary(
            List.of(LibraryEntry.of("Untitled work", null)), RecommendationRequest.of(5, null), ProgressListener.NONE);

        assertThat(report.recommendations().titles()).containsExactly("Graphs 2019");
    }

    @Test
    void should_ReturnEmptyReport_When_RetrieverFindsNothingForAnyEntry() {
        List<LibraryEntry> library = List.of(
            LibraryEntry.of("A", "a"), LibraryEntry.of("B", "b"), LibraryEntry.of("C", "c"));

        RecommendationReport report = service.recommendForLibrary(
            library, RecommendationRequest.of(10, null), ProgressListener.NONE);

        assertThat(report.recommendations().isEmpty()).isTrue();
        assertThat(report.authors().isEmpty()).isTrue();
    }

    @Test
    void should_ReturnEmptyReportWithoutLoadingCorpus_When_LibraryEmpty() {
        RecommendationReport report = service.recommendForLibrary(
            List.of(), RecommendationRequest.of(10, null), ProgressListener.NONE);

        assertThat(report.recommendations().isEmpty()).isTrue();
        verifyNoInteractions(corpusRepository);
    }

    @Test
    void should_ExcludeContextTitles_When_RecommendingForText() {
        retrievals.put("graphs", List.of("p1", "p3"));
        RecommendationRequest request = RecommendationRequest.of(5, null)
            .withContext(List.of(LibraryEntry.of("Mine", null)));

        RecommendationReport report = service.recommendForText("graphs", request, ProgressListener.NONE);

        assertThat(report.mode()).isEqualTo(QueryMode.TEXT);
        assertThat(report.recommendations().titles()).containsExactly("Graphs 2015");
        assertThat(report.recommendations().rows().get(0).score()).isEqualTo(0.9);
        assertThat(report.keywords().topKeywords(5)).containsExactly("graphs");
    }

    @Test
    void should_ReturnAuthorPapersInCorpusOrder_When_RecommendingForAuthors() {
        RecommendationReport report = service.recommendForAuthors(
            List.of("alan turing"), RecommendationRequest.of(2, null), ProgressListener.NONE);

        assertThat(report.mode()).isEqualTo(QueryMode.AUTHORS);
        assertThat(report.recommendations().titles()).containsExactly("Graphs 2010", "Graphs 2015");
        assertThat(report.authors().countOf("Alan Turing")).isEqualTo(2);
    }

    @Test
    void should_ReturnNothing_When_CountIsZero() {
        RecommendationReport report = service.recommendForAuthors(
            List.of("Alan Turing"), RecommendationRequest.of(0, null), ProgressListener.NONE);

        assertThat(report.recommendations().isEmpty()).isTrue();
    }
}
