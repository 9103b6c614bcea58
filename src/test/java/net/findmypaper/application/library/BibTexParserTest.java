package net.findmypaper.application.library;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BibTexParserTest {

    @Test
    void should_ReadBracedQuotedAndBareValues_When_ParsingEntry() {
        List<Map<String, String>> entries = BibTexParser.parse("""
            @Article{key2020,
              Title = {Deep {Learning} for \\emph{Graphs}},
              author = "Doe, Jane and Roe, Richard",
              year = 2020,
            }
            """);

        assertThat(entries).singleElement().satisfies(entry -> {
            assertThat(entry).containsEntry(BibTexParser.ENTRY_TYPE, "article");
            assertThat(entry).containsEntry(BibTexParser.CITATION_KEY, "key2020");
            assertThat(entry).containsEntry("title", "Deep Learning for Graphs");
            assertThat(entry).containsEntry("author", "Doe, Jane and Roe, Richard");
            assertThat(entry).containsEntry("year", "2020");
        });
    }

    @Test
    void should_SkipCommentStringAndPreambleBlocks_When_Parsing() {
        List<Map<String, String>> entries = BibTexParser.parse("""
            @comment{ignored {nested} text}
            @string{acm = "ACM"}
            @preamble{"\\newcommand{\\x}{y}"}
            @misc(only, title = {Kept})
            """);

        assertThat(entries).extracting(entry -> entry.get("title")).containsExactly("Kept");
    }

    @Test
    void should_ConcatenateParts_When_ValueUsesHash() {
        List<Map<String, String>> entries = BibTexParser.parse("@book{k, title = \"Part\" # { One}}");

        assertThat(entries.get(0)).containsEntry("title", "Part One");
    }

    @Test
    void should_Throw_When_EntryUnterminated() {
        assertThatThrownBy(() -> BibTexParser.parse("@article{k, title = {Open"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unterminated");
    }

    @Test
    void should_KeepEscapedCharactersAndDropAccents_When_Cleaning() {
        assertThat(BibTexParser.clean("Smith \\& {Sons} 50\\% G\\\"odel")).isEqualTo("Smith & Sons 50% Godel");
    }

    @Test
    void should_ReturnNoEntries_When_ContentBlank() {
        assertThat(BibTexParser.parse("  ")).isEmpty();
    }
}
