package net.findmypaper.support.keyword;

import net.findmypaper.util.TextTokenizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ranks non-stop-word terms by how often they occur; ties keep first-occurrence order.
 */
@Component
public class FrequencyKeywordExtractor implements KeywordExtractor {

    @Override
    public List<String> extract(String text, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String term : TextTokenizer.tokenize(text)) {
            counts.merge(term, 1, Integer::sum);
        }
        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(counts.entrySet());
        ranked.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()));
        return ranked.stream()
            .limit(limit)
            .map(Map.Entry::getKey)
            .toList();
    }
}
