package net.findmypaper.util;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Single source of truth for author-name comparison.
 *
 * <p>Both the author query and the author summary compare names through {@link #normalize},
 * so a name matches wherever it is compared:
 * <ul>
 *   <li>case-folded with {@link java.util.Locale#ROOT}</li>
 *   <li>punctuation from a fixed set removed: {@code . , ; : ' " ( ) { } [ ] -}</li>
 *   <li>internal whitespace collapsed, ends trimmed</li>
 * </ul>
 *
 * <p><strong>Example:</strong>
 * <pre>
 * Input:  "  Hubel, D.  H. "
 * Output: "hubel d h"
 * </pre>
 */
public final class AuthorNames {

    /** Punctuation removed before comparison. */
    private static final Pattern STRIPPED_PUNCTUATION = Pattern.compile("[.,;:'\"(){}\\[\\]\\-]");

    private AuthorNames() {
        // Utility class - no instantiation
    }

    /**
     * Normalizes one author name for comparison.
     *
     * @param name raw author name, possibly null
     * @return comparison key; empty string for null or punctuation-only input
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String stripped = STRIPPED_PUNCTUATION.matcher(name).replaceAll(" ");
        String collapsed = StringUtils.collapseWhitespace(stripped);
        return StringUtils.normalizeLowercase(collapsed);
    }

    /**
     * Normalizes a list of names into a set of non-empty comparison keys.
     */
    public static Set<String> normalizeAll(Collection<String> names) {
        if (ValidationUtils.isNullOrEmpty(names)) {
            return Set.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String name : names) {
            String key = normalize(name);
            if (!key.isEmpty()) {
                normalized.add(key);
            }
        }
        return normalized;
    }
}
