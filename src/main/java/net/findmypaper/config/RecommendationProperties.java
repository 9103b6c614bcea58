package net.findmypaper.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.nio.file.Path;

/**
 * Strongly typed configuration for the recommendation engine.
 */
@Component
@ConfigurationProperties(prefix = "recommendation")
public class RecommendationProperties {

    /**
     * Directory holding {@code papers.json} and {@code abstracts.json}.
     */
    private String corpusDir = "data/corpus";

    /**
     * Candidates requested from the retriever per query (K). Also the rank-0 weight.
     */
    private int candidatesPerQuery = 100;

    /**
     * Recommendations returned when the caller does not ask for a count (N).
     */
    private int defaultCount = 20;

    /**
     * Keywords extracted per library paper for the keyword profile.
     */
    private int keywordsPerDocument = 10;

    /**
     * Keywords listed in the console report.
     */
    private int topKeywords = 10;

    /**
     * Authors listed in the console report.
     */
    private int topAuthors = 10;

    /**
     * Whether profile keywords are highlighted in the titles of the console report.
     */
    private boolean highlightKeywords = true;

    @PostConstruct
    void validate() {
        Assert.hasText(corpusDir, "recommendation.corpus-dir must not be blank");
        Assert.isTrue(candidatesPerQuery > 0, "recommendation.candidates-per-query must be positive");
        Assert.isTrue(defaultCount >= 0, "recommendation.default-count must be non-negative");
        Assert.isTrue(keywordsPerDocument > 0, "recommendation.keywords-per-document must be positive");
        Assert.isTrue(topKeywords >= 0, "recommendation.top-keywords must be non-negative");
        Assert.isTrue(topAuthors >= 0, "recommendation.top-authors must be non-negative");
    }

    public Path corpusPath() {
        return Path.of(corpusDir);
    }

    public String getCorpusDir() {
        return corpusDir;
    }

    public void setCorpusDir(String corpusDir) {
        this.corpusDir = corpusDir;
    }

    public int getCandidatesPerQuery() {
        return candidatesPerQuery;
    }

    public void setCandidatesPerQuery(int candidatesPerQuery) {
        this.candidatesPerQuery = candidatesPerQuery;
    }

    public int getDefaultCount() {
        return defaultCount;
    }

    public void setDefaultCount(int defaultCount) {
        this.defaultCount = defaultCount;
    }

    public int getKeywordsPerDocument() {
        return keywordsPerDocument;
    }

    public void setKeywordsPerDocument(int keywordsPerDocument) {
        this.keywordsPerDocument = keywordsPerDocument;
    }

    public int getTopKeywords() {
        return topKeywords;
    }

    public void setTopKeywords(int topKeywords) {
        this.topKeywords = topKeywords;
    }

    public int getTopAuthors() {
        return topAuthors;
    }

    public void setTopAuthors(int topAuthors) {
        this.topAuthors = topAuthors;
    }

    public boolean isHighlightKeywords() {
        return highlightKeywords;
    }

    public void setHighlightKeywords(boolean highlightKeywords) {
        this.highlightKeywords = highlightKeywords;
    }
}
