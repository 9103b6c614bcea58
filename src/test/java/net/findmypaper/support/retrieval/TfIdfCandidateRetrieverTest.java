package net.findmypaper.support.retrieval;

import net.findmypaper.repository.CorpusRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static net.findmypaper.testutil.PaperTestData.aPaper;
import static net.findmypaper.testutil.PaperTestData.corpusOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class TfIdfCandidateRetrieverTest {

    @Mock
    private CorpusRepository corpusRepository;

    private TfIdfCandidateRetriever retriever;

    @BeforeEach
    void setUp() {
        lenient().when(corpusRepository.corpus()).thenReturn(corpusOf(
            aPaper().id("g1").title("Graph networks").abstractText("Graph neural networks for molecules.").build(),
            aPaper().id("p1").title("Protein folding").abstractText("Attention for protein structure prediction.").build(),
            aPaper().id("g2").title("Molecular graphs").abstractText("Message passing over molecule graph structure.").build(),
            aPaper().id("c1").title("Reaction yields").abstractText("Bayesian optimisation of chemical reactions.").build()));
        retriever = new TfIdfCandidateRetriever(corpusRepository);
    }

    @Test
    void should_RankClosestPaperFirst_When_QuerySharesTerms() {
        List<String> ids = retriever.retrieve("graph neural networks", 10);

        assertThat(ids).first().isEqualTo("g1");
        assertThat(ids).contains("g2").doesNotContain("p1", "c1");
    }

    @Test
    void should_ReturnAtMostLimit_When_ManyPapersMatch() {
        assertThat(retriever.retrieve("graph molecules protein structure", 2)).hasSize(2);
    }

    @Test
    void should_ReturnEmpty_When_NoTermMatchesOrTextBlank() {
        assertThat(retriever.retrieve("astronomy telescopes", 10)).isEmpty();
        assertThat(retriever.retrieve("  ", 10)).isEmpty();
        assertThat(retriever.retrieve("graph", 0)).isEmpty();
    }

    @Test
    void should_BuildIndexOnce_When_QueriedRepeatedly() {
        retriever.retrieve("graph", 5);
        retriever.retrieve("protein", 5);

        verify(corpusRepository, times(1)).corpus();
    }
}
