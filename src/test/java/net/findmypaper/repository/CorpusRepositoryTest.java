package net.findmypaper.repository;

import net.findmypaper.config.RecommendationProperties;
import net.findmypaper.domain.Corpus;
import net.findmypaper.exception.CorpusConsistencyException;
import net.findmypaper.exception.MissingCorpusResourceException;
import net.findmypaper.exception.PaperRecommendationException.ErrorCode;
import net.findmypaper.model.Paper;
import net.findmypaper.testutil.TestFiles;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tools.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CorpusRepositoryTest {

    private static final String PAPERS = """
        [
          {"id": "a", "title": "Graph  Networks\\n for Molecules", "year": 2019, "authors": ["Ada Lovelace"], "extra": true},
          {"id": "b", "title": "Protein Folding", "year": null}
        ]
        """;
    private static final String ABSTRACTS = """
        [
          {"id": "b", "abstract": "Folding proteins."},
          {"id": "a", "abstract": "Graphs of molecules."}
        ]
        """;

    @TempDir
    Path corpusDir;

    private CorpusRepository repository() {
        RecommendationProperties properties = new RecommendationProperties();
        properties.setCorpusDir(corpusDir.toString());
        return new CorpusRepository(properties, JsonMapper.builder().build());
    }

    @Test
    void should_JoinAbstractsById_When_CorpusFilesConsistent() throws IOException {
        TestFiles.writeCorpus(corpusDir, PAPERS, ABSTRACTS);

        Corpus corpus = repository().corpus();

        assertThat(corpus.size()).isEqualTo(2);
        Paper first = corpus.papers().get(0);
        assertThat(first.getTitle()).isEqualTo("Graph Networks for Molecules");
        assertThat(first.getAbstractText()).isEqualTo("Graphs of molecules.");
        assertThat(first.getAuthors()).containsExactly("Ada Lovelace");
        assertThat(corpus.findById("b")).get().extracting(Paper::getYear).isNull();
    }

    @Test
    void should_LoadOnce_When_CorpusRequestedTwice() throws IOException {
        TestFiles.writeCorpus(corpusDir, PAPERS, ABSTRACTS);
        CorpusRepository repository = repository();

        assertThat(repository.corpus()).isSameAs(repository.corpus());
    }

    @Test
    void should_NameMissingFile_When_AbstractsAbsent() throws IOException {
        TestFiles.writeString(corpusDir, CorpusRepository.PAPERS_FILE, PAPERS);

        assertThatThrownBy(() -> repository().corpus())
            .isInstanceOf(MissingCorpusResourceException.class)
            .hasMessageContaining(CorpusRepository.ABSTRACTS_FILE)
            .satisfies(ex -> assertThat(((MissingCorpusResourceException) ex).errorCode())
                .isEqualTo(ErrorCode.MISSING_RESOURCE));
    }

    @Test
    void should_ReportBothCounts_When_PaperAndAbstractCountsDiffer() throws IOException {
        TestFiles.writeCorpus(corpusDir, PAPERS, """
            [{"id": "a", "abstract": "Graphs of molecules."}]
            """);

        assertThatThrownBy(() -> repository().corpus())
            .isInstanceOf(CorpusConsistencyException.class)
            .hasMessageContaining("2 papers")
            .hasMessageContaining("1 abstracts");
    }

    @Test
    void should_NamePaper_When_AbstractMissingForId() throws IOException {
        TestFiles.writeCorpus(corpusDir, PAPERS, """
            [{"id": "a", "abstract": "x"}, {"id": "z", "abstract": "y"}]
            """);

        assertThatThrownBy(() -> repository().corpus())
            .isInstanceOf(CorpusConsistencyException.class)
            .hasMessageContaining("b");
    }

    @Test
    void should_RejectPaper_When_TitleMissing() throws IOException {
        TestFiles.writeCorpus(corpusDir, """
            [{"id": "p1", "year": 2019, "authors": ["Ada Lovelace"]}, {"id": "p2", "title": "  "}]
            """, """
            [{"id": "p1", "abstract": "x"}, {"id": "p2", "abstract": "y"}]
            """);

        assertThatThrownBy(() -> repository().corpus())
            .isInstanceOf(CorpusConsistencyException.class)
            .hasMessageContaining("p1")
            .hasMessageContaining("no title");
    }

    @Test
    void should_RaiseConsistencyError_When_CorpusFileMalformed() throws IOException {
        TestFiles.writeCorpus(corpusDir, "[{\"id\": ", ABSTRACTS);

        assertThatThrownBy(() -> repository().corpus())
            .isInstanceOf(CorpusConsistencyException.class)
            .hasMessageContaining(CorpusRepository.PAPERS_FILE);
    }
}
