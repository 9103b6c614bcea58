package net.findmypaper.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits free text into lower-case alphanumeric terms, dropping stop words and short tokens.
 */
public final class TextTokenizer {

    private static final int MIN_TOKEN_LENGTH = 3;

    /** Stop words for abstracts and queries. */
    private static final Set<String> STOP_WORDS = Set.of(
        "the", "and", "for", "with", "are", "was", "were", "from", "that", "this", "these", "those",
        "but", "not", "you", "your", "will", "all", "any", "uses", "using", "used", "its", "into",
        "then", "also", "than", "has", "have", "had", "been", "being", "can", "may", "our", "their",
        "which", "what", "when", "where", "while", "how", "such", "both", "each", "other", "more",
        "most", "between", "within", "across", "here", "there", "they", "them", "show", "shows",
        "shown", "well", "however", "thus", "via", "upon", "whether", "through", "during", "after",
        "before", "over", "under", "about", "only", "one", "two", "new", "use"
    );

    private TextTokenizer() {
    }

    /**
     * Tokenizes {@code text} in reading order; repeated terms are kept.
     *
     * @param text free text, possibly null
     * @return terms longer than two characters that are not stop words
     */
    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String[] raw = text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+");
        List<String> terms = new ArrayList<>(raw.length);
        for (String token : raw) {
            if (token.length() >= MIN_TOKEN_LENGTH && !STOP_WORDS.contains(token)) {
                terms.add(token);
            }
        }
        return terms;
    }
}
