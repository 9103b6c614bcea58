package net.findmypaper.service;

import lombok.extern.slf4j.Slf4j;
import net.findmypaper.domain.KeywordProfile;
import net.findmypaper.model.LibraryEntry;
import net.findmypaper.support.keyword.KeywordExtractor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Merges per-document keyword extractions into one rank-weighted {@link KeywordProfile}.
 *
 * <p>Weights follow the same rank voting as {@link ScoreAggregator}: the keyword at rank
 * {@code r} of a document earns {@code K - r}, and a keyword extracted from several
 * documents accumulates every one of its weights. The profile is informational; it never
 * feeds back into paper scores.</p>
 */
@Component
@Slf4j
public class KeywordAggregator {

    private final KeywordExtractor keywordExtractor;

    public KeywordAggregator(KeywordExtractor keywordExtractor) {
        this.keywordExtractor = keywordExtractor;
    }

    /**
     * Keyword profile of the library abstracts.
     */
    public KeywordProfile aggregate(List<LibraryEntry> library, int keywordsPerDocument) {
        return aggregateTexts(library.stream().map(LibraryEntry::abstractText).toList(), keywordsPerDocument);
    }

    /**
     * Keyword profile of several texts; blank texts contribute nothing.
     */
    public KeywordProfile aggregateTexts(List<String> texts, int keywordsPerDocument) {
        KeywordProfile profile = new KeywordProfile();
        for (String text : texts) {
            accumulate(profile, text, keywordsPerDocument);
        }
        log.debug("Keyword profile holds {} keywords from {} texts", profile.size(), texts.size());
        return profile;
    }

    /**
     * Keyword profile of a single text, such as a free-text query.
     */
    public KeywordProfile aggregateText(String text, int keywords) {
        KeywordProfile profile = new KeywordProfile();
        accumulate(profile, text, keywords);
        return profile;
    }

    private void accumulate(KeywordProfile profile, String text, int keywordsPerDocument) {
        if (text == null || text.isBlank()) {
            return;
        }
        List<String> keywords = keywordExtractor.extract(text, keywordsPerDocument);
        int limit = Math.min(keywordsPerDocument, keywords.size());
        for (int rank = 0; rank < limit; rank++) {
            profile.add(keywords.get(rank), ScoreAggregator.rankWeight(keywordsPerDocument, rank));
        }
    }
}
