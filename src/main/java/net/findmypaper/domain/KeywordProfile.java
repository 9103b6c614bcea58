package net.findmypaper.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rank-weighted keyword votes accumulated over a set of texts.
 */
public final class KeywordProfile {

    private final Map<String, Integer> weights = new LinkedHashMap<>();

    /**
     * Adds {@code weight} to {@code keyword}; repeated keywords accumulate.
     */
    public void add(String keyword, int weight) {
        if (keyword == null || keyword.isBlank()) {
            return;
        }
        weights.merge(keyword, weight, Integer::sum);
    }

    public int weightOf(String keyword) {
        return weights.getOrDefault(keyword, 0);
    }

    /**
     * Top {@code n} keywords by weight; equal weights keep first-seen order.
     */
    public List<KeywordWeight> top(int n) {
        if (n <= 0) {
            return List.of();
        }
        List<KeywordWeight> ranked = new ArrayList<>(weights.size());
        weights.forEach((keyword, weight) -> ranked.add(new KeywordWeight(keyword, weight)));
        ranked.sort(Comparator.comparingInt(KeywordWeight::weight).reversed());
        return List.copyOf(ranked.subList(0, Math.min(n, ranked.size())));
    }

    public List<String> topKeywords(int n) {
        return top(n).stream().map(KeywordWeight::keyword).toList();
    }

    public Map<String, Integer> asMap() {
        return Collections.unmodifiableMap(weights);
    }

    public int size() {
        return weights.size();
    }

    public boolean isEmpty() {
        return weights.isEmpty();
    }

    /**
     * @param keyword extracted keyword
     * @param weight accumulated rank weight
     */
    public record KeywordWeight(String keyword, int weight) {
    }
}
