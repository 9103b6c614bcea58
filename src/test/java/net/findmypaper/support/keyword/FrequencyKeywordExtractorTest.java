package net.findmypaper.support.keyword;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FrequencyKeywordExtractorTest {

    private final FrequencyKeywordExtractor extractor = new FrequencyKeywordExtractor();

    @Test
    void should_RankByFrequencyThenFirstOccurrence_When_Extracting() {
        String text = "Protein folding with attention. Attention models protein structure; protein design.";

        assertThat(extractor.extract(text, 3)).containsExactly("protein", "attention", "folding");
    }

    @Test
    void should_ReturnEmpty_When_LimitNotPositive() {
        assertThat(extractor.extract("protein folding", 0)).isEmpty();
    }
}
