package net.findmypaper.model;

import jakarta.annotation.Nullable;
import java.util.List;

/**
 * One paper from the user's own library, as read from a BibTeX or JSON file.
 *
 * @param title paper title, used for overlap matching
 * @param abstractText abstract, the preferred retrieval query text
 * @param authors author names in file order
 * @param year publication year when the file provides one
 * @param doi digital object identifier when the file provides one
 */
public record LibraryEntry(
    String title,
    @Nullable String abstractText,
    List<String> authors,
    @Nullable Integer year,
    @Nullable String doi
) {

    public LibraryEntry {
        authors = authors == null ? List.of() : List.copyOf(authors);
    }

    public static LibraryEntry of(String title, String abstractText) {
        return new LibraryEntry(title, abstractText, List.of(), null, null);
    }
}
