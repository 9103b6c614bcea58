package net.findmypaper.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProfileTest {

    @Test
    void should_AccumulateKeywordWeights_When_KeywordRepeats() {
        KeywordProfile profile = new KeywordProfile();
        profile.add("graph", 10);
        profile.add("protein", 9);
        profile.add("graph", 8);

        assertThat(profile.weightOf("graph")).isEqualTo(18);
        assertThat(profile.topKeywords(1)).containsExactly("graph");
    }

    @Test
    void should_KeepFirstSeenOrder_When_KeywordWeightsTie() {
        KeywordProfile profile = new KeywordProfile();
        profile.add("beta", 5);
        profile.add("alpha", 5);

        assertThat(profile.topKeywords(2)).containsExactly("beta", "alpha");
        assertThat(profile.top(0)).isEmpty();
    }

    @Test
    void should_CountNormalisedAuthorOnce_When_SpellingsDiffer() {
        AuthorProfile profile = new AuthorProfile();
        profile.add("Turing, A.");
        profile.add("turing a");
        profile.add("Grace Hopper");

        assertThat(profile.size()).isEqualTo(2);
        assertThat(profile.countOf("TURING A")).isEqualTo(2);
        assertThat(profile.top(1)).containsExactly(new AuthorProfile.AuthorCount("Turing, A.", 2));
    }
}
