package net.findmypaper.support.retrieval;

import lombok.extern.slf4j.Slf4j;
import net.findmypaper.domain.Corpus;
import net.findmypaper.model.Paper;
import net.findmypaper.repository.CorpusRepository;
import net.findmypaper.util.TextTokenizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory cosine-similarity retriever over TF-IDF vectors of corpus titles and abstracts.
 *
 * <p>The index is built once, on the first lookup, from the corpus repository. Papers
 * sharing no term with the query are never returned; equal similarities keep corpus order.</p>
 */
@Component
@Slf4j
public class TfIdfCandidateRetriever implements CandidateRetriever {

    private final CorpusRepository corpusRepository;
    private Index index;

    public TfIdfCandidateRetriever(CorpusRepository corpusRepository) {
        this.corpusRepository = corpusRepository;
    }

    @Override
    public List<String> retrieve(String text, int limit) {
        if (limit <= 0 || text == null || text.isBlank()) {
            return List.of();
        }
        Index idx = index();
        Map<String, Double> queryVector = idx.vectorize(TextTokenizer.tokenize(text));
        if (queryVector.isEmpty()) {
            return List.of();
        }

        double[] similarity = new double[idx.paperIds.size()];
        for (Map.Entry<String, Double> term : queryVector.entrySet()) {
            List<Posting> postings = idx.postings.getOrDefault(term.getKey(), List.of());
            for (Posting posting : postings) {
                similarity[posting.paperIndex()] += term.getValue() * posting.weight();
            }
        }

        Integer[] order = new Integer[similarity.length];
        int matched = 0;
        for (int i = 0; i < similarity.length; i++) {
            if (similarity[i] > 0) {
                order[matched++] = i;
            }
        }
        Integer[] candidates = Arrays.copyOf(order, matched);
        Arrays.sort(candidates, Comparator.comparingDouble((Integer i) -> similarity[i]).reversed());

        int size = Math.min(limit, candidates.length);
        List<String> ids = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            ids.add(idx.paperIds.get(candidates[i]));
        }
        return ids;
    }

    private synchronized Index index() {
        if (index == null) {
            index = Index.build(corpusRepository.corpus());
            log.debug("Built TF-IDF index over {} papers with {} terms", index.paperIds.size(), index.idf.size());
        }
        return index;
    }

    private record Posting(int paperIndex, double weight) {
    }

    private static final class Index {
        private final List<String> paperIds;
        private final Map<String, Double> idf;
        private final Map<String, List<Posting>> postings;

        private Index(List<String> paperIds, Map<String, Double> idf, Map<String, List<Posting>> postings) {
            this.paperIds = paperIds;
            this.idf = idf;
            this.postings = postings;
        }

        static Index build(Corpus corpus) {
            List<String> ids = new ArrayList<>(corpus.size());
            List<Map<String, Integer>> termCounts = new ArrayList<>(corpus.size());
            Map<String, Integer> documentFrequency = new HashMap<>();

            for (Paper paper : corpus.papers()) {
                ids.add(paper.getId());
                Map<String, Integer> counts = countTerms(TextTokenizer.tokenize(
                    (paper.getTitle() == null ? "" : paper.getTitle()) + " "
                        + (paper.getAbstractText() == null ? "" : paper.getAbstractText())));
                termCounts.add(counts);
                counts.keySet().forEach(term -> documentFrequency.merge(term, 1, Integer::sum));
            }

            int documents = ids.size();
            Map<String, Double> idf = new HashMap<>(documentFrequency.size());
            documentFrequency.forEach((term, df) ->
                idf.put(term, Math.log((documents + 1.0) / (df + 1.0)) + 1.0));

            Index index = new Index(ids, idf, new HashMap<>());
            for (int i = 0; i < termCounts.size(); i++) {
                Map<String, Double> vector = index.weigh(termCounts.get(i));
                for (Map.Entry<String, Double> entry : vector.entrySet()) {
                    index.postings.computeIfAbsent(entry.getKey(), term -> new ArrayList<>())
                        .add(new Posting(i, entry.getValue()));
                }
            }
            return index;
        }

        Map<String, Double> vectorize(List<String> terms) {
            Map<String, Integer> known = new LinkedHashMap<>();
            for (Map.Entry<String, Integer> entry : countTerms(terms).entrySet()) {
                if (idf.containsKey(entry.getKey())) {
                    known.put(entry.getKey(), entry.getValue());
                }
            }
            return weigh(known);
        }

        private Map<String, Double> weigh(Map<String, Integer> counts) {
            Map<String, Double> vector = new LinkedHashMap<>(counts.size());
            double norm = 0.0;
            for (Map.Entry<String, Integer> entry : counts.entrySet()) {
                double weight = entry.getValue() * idf.getOrDefault(entry.getKey(), 0.0);
                vector.put(entry.getKey(), weight);
                norm += weight * weight;
            }
            if (norm == 0.0) {
                return Map.of();
            }
            double length = Math.sqrt(norm);
            vector.replaceAll((term, weight) -> weight / length);
            return vector;
        }

        private static Map<String, Integer> countTerms(List<String> terms) {
            Map<String, Integer> counts = new LinkedHashMap<>();
            for (String term : terms) {
                counts.merge(term, 1, Integer::sum);
            }
            return counts;
        }
    }
}
