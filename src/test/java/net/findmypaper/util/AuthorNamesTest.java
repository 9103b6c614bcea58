package net.findmypaper.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class AuthorNamesTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "'  Hubel, D.  H. '|hubel d h",
        "Neil-Smith (Jr.)|neil smith jr",
        "GRACE   HOPPER|grace hopper",
        "[Anon.]|anon"
    })
    void should_NormaliseName_When_PunctuationCaseOrSpacingDiffers(String raw, String expected) {
        assertThat(AuthorNames.normalize(raw)).isEqualTo(expected);
    }

    @Test
    void should_ReturnEmptyKey_When_NameNullOrPunctuationOnly() {
        assertThat(AuthorNames.normalize(null)).isEmpty();
        assertThat(AuthorNames.normalize(" .;- ")).isEmpty();
    }

    @Test
    void should_DropEmptyKeysAndDuplicates_When_NormalisingAll() {
        assertThat(AuthorNames.normalizeAll(Arrays.asList("Ada Lovelace", "ada lovelace.", null, "--")))
            .containsExactly("ada lovelace");
    }
}
