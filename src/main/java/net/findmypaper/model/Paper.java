/**
 * Corpus paper: bibliographic metadata joined with its abstract.
 *
 * Features:
 * - Immutable once loaded; owned by the corpus repository
 * - Title is the natural key for aggregation and overlap matching
 * - Identity (equals/hashCode) is the corpus id
 */
package net.findmypaper.model;

import java.util.List;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@ToString(onlyExplicitlyIncluded = true)
public final class Paper {

    @EqualsAndHashCode.Include
    @ToString.Include
    private final String id;
    @ToString.Include
    private final String title;
    private final String abstractText;
    @ToString.Include
    private final Integer year;
    @Singular
    private final List<String> authors;
    private final String journal;
    private final String doi;
    private final String url;
    private final String source;
}
