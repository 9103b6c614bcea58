package net.findmypaper.adapters.persistence;

import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.MappingIterator;
import tools.jackson.dataformat.csv.CsvMapper;
import tools.jackson.dataformat.csv.CsvSchema;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads recommendation files written by {@link RecommendationCsvWriter}.
 */
@Component
public class RecommendationCsvReader {

    private final CsvMapper csvMapper = RecommendationCsvFormat.MAPPER;
    private final CsvSchema schema = RecommendationCsvFormat.SCHEMA;

    public List<RecommendationRow> read(Path source) {
        try (BufferedReader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8);
             MappingIterator<RecommendationRow> rows = csvMapper.readerFor(RecommendationRow.class)
                 .with(schema)
                 .readValues(reader)) {
            return rows.readAll();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read recommendations from " + source, ex);
        } catch (JacksonException ex) {
            throw new UncheckedIOException("Malformed recommendation file " + source,
                new IOException(ex.getOriginalMessage(), ex));
        }
    }
}
