package net.findmypaper.domain;

import net.findmypaper.util.AuthorNames;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Occurrence count per author across a recommendation set.
 *
 * <p>Names are counted under their {@link AuthorNames#normalize normalised} key; the
 * spelling reported back is the first one seen for that key.</p>
 */
public final class AuthorProfile {

    private final Map<String, String> displayNames = new LinkedHashMap<>();
    private final Map<String, Integer> counts = new LinkedHashMap<>();

    public void add(String authorName) {
        String key = AuthorNames.normalize(authorName);
        if (key.isEmpty()) {
            return;
        }
        displayNames.putIfAbsent(key, authorName.trim());
        counts.merge(key, 1, Integer::sum);
    }

    /**
     * Count for {@code authorName}, compared through the shared normalisation.
     */
    public int countOf(String authorName) {
        return counts.getOrDefault(AuthorNames.normalize(authorName), 0);
    }

    /**
     * Top {@code n} authors by count; equal counts keep first-seen order.
     */
    public List<AuthorCount> top(int n) {
        if (n <= 0) {
            return List.of();
        }
        List<AuthorCount> ranked = new ArrayList<>(counts.size());
        counts.forEach((key, count) -> ranked.add(new AuthorCount(displayNames.get(key), count)));
        ranked.sort(Comparator.comparingInt(AuthorCount::count).reversed());
        return List.copyOf(ranked.subList(0, Math.min(n, ranked.size())));
    }

    public int size() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    /**
     * @param author author name as first spelled in the recommendations
     * @param count number of recommended papers listing the author
     */
    public record AuthorCount(String author, int count) {
    }
}
