package net.findmypaper.adapters.persistence;

import net.findmypaper.domain.RecommendationSet;
import net.findmypaper.domain.ScoredPaper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.dataformat.csv.CsvMapper;
import tools.jackson.dataformat.csv.CsvSchema;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Saves a ranked recommendation set as CSV, one row per paper in rank order.
 */
@Component
public class RecommendationCsvWriter {

    private static final Logger log = LoggerFactory.getLogger(RecommendationCsvWriter.class);

    private final CsvMapper csvMapper = RecommendationCsvFormat.MAPPER;
    private final CsvSchema schema = RecommendationCsvFormat.SCHEMA;

    /**
     * Writes {@code recommendations} to {@code target}, creating parent directories and
     * replacing any existing file.
     *
     * @throws UncheckedIOException when the file cannot be written
     */
    public void write(RecommendationSet recommendations, Path target) {
        List<RecommendationRow> rows = new ArrayList<>(recommendations.size());
        int rank = 1;
        for (ScoredPaper scored : recommendations) {
            rows.add(RecommendationRow.from(rank++, scored));
        }

        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                csvMapper.writer(schema).writeValue(writer, rows);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to save recommendations to " + target, ex);
        } catch (JacksonException ex) {
            throw new UncheckedIOException("Failed to save recommendations to " + target,
                new IOException(ex.getOriginalMessage(), ex));
        }
        log.info("Saved {} recommendations to {}", rows.size(), target);
    }
}
