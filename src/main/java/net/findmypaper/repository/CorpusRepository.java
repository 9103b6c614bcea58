package net.findmypaper.repository;

import lombok.extern.slf4j.Slf4j;
import net.findmypaper.config.RecommendationProperties;
import net.findmypaper.domain.Corpus;
import net.findmypaper.dto.CorpusAbstractRecord;
import net.findmypaper.dto.CorpusPaperRecord;
import net.findmypaper.exception.CorpusConsistencyException;
import net.findmypaper.exception.MissingCorpusResourceException;
import net.findmypaper.model.Paper;
import net.findmypaper.util.StringUtils;
import org.springframework.stereotype.Repository;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the paper corpus from the configured directory, once per process.
 *
 * <p>The corpus is split over two JSON files, {@value #PAPERS_FILE} (metadata) and
 * {@value #ABSTRACTS_FILE} (abstracts keyed by paper id). Both must exist and describe the
 * same papers; otherwise loading fails before any retrieval runs.</p>
 */
@Repository
@Slf4j
public class CorpusRepository {

    public static final String PAPERS_FILE = "papers.json";
    public static final String ABSTRACTS_FILE = "abstracts.json";

    private final RecommendationProperties properties;
    private final ObjectMapper objectMapper;
    private Corpus corpus;

    public CorpusRepository(RecommendationProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * Returns the corpus, loading it on first access.
     *
     * @throws MissingCorpusResourceException when a corpus file is absent
     * @throws CorpusConsistencyException when the files cannot be parsed or disagree
     */
    public synchronized Corpus corpus() {
        if (corpus == null) {
            corpus = load(properties.corpusPath());
        }
        return corpus;
    }

    /**
     * Verifies that every corpus file is present.
     *
     * @throws MissingCorpusResourceException naming the first missing file
     */
    public void checkResources() {
        Path directory = properties.corpusPath();
        for (String fileName : List.of(PAPERS_FILE, ABSTRACTS_FILE)) {
            Path file = directory.resolve(fileName);
            if (!Files.isRegularFile(file)) {
                throw new MissingCorpusResourceException(file);
            }
        }
    }

    private Corpus load(Path directory) {
        checkResources();
        List<CorpusAbstractRecord> abstracts = read(directory.resolve(ABSTRACTS_FILE),
            new TypeReference<List<CorpusAbstractRecord>>() {});
        List<CorpusPaperRecord> records = read(directory.resolve(PAPERS_FILE),
            new TypeReference<List<CorpusPaperRecord>>() {});

        if (records.size() != abstracts.size()) {
            throw CorpusConsistencyException.countMismatch(records.size(), abstracts.size());
        }

        Map<String, String> abstractsById = new HashMap<>(abstracts.size());
        for (CorpusAbstractRecord record : abstracts) {
            if (record != null && record.id() != null) {
                abstractsById.putIfAbsent(record.id(), StringUtils.coalesce(record.abstractText(), ""));
            }
        }

        List<Paper> papers = new ArrayList<>(records.size());
        for (CorpusPaperRecord record : records) {
            if (record == null || !org.springframework.util.StringUtils.hasText(record.id())) {
                throw new CorpusConsistencyException("Corpus paper without an id in " + directory.resolve(PAPERS_FILE));
            }
            if (!org.springframework.util.StringUtils.hasText(record.title())) {
                throw new CorpusConsistencyException("Corpus paper " + record.id() + " has no title");
            }
            String abstractText = abstractsById.get(record.id());
            if (abstractText == null) {
                throw new CorpusConsistencyException("No abstract found for corpus paper " + record.id());
            }
            papers.add(toPaper(record, abstractText));
        }

        Corpus loaded = Corpus.of(papers);
        log.info("Loaded corpus of {} papers from {}", loaded.size(), directory);
        return loaded;
    }

    private <T> List<T> read(Path file, TypeReference<List<T>> type) {
        try (InputStream in = Files.newInputStream(file)) {
            List<T> values = objectMapper.readValue(in, type);
            return values == null ? List.of() : values;
        } catch (IOException | JacksonException ex) {
            throw new CorpusConsistencyException("Failed to read corpus file " + file, ex);
        }
    }

    private static Paper toPaper(CorpusPaperRecord record, String abstractText) {
        return Paper.builder()
            .id(record.id())
            .title(StringUtils.collapseWhitespace(record.title()))
            .abstractText(abstractText)
            .year(record.year())
            .authors(record.authors() == null ? List.of() : record.authors())
            .journal(record.journal())
            .doi(record.doi())
            .url(record.url())
            .source(record.source())
            .build();
    }
}
