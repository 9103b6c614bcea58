package net.findmypaper.adapters.persistence;

import tools.jackson.dataformat.csv.CsvMapper;
import tools.jackson.dataformat.csv.CsvReadFeature;
import tools.jackson.dataformat.csv.CsvSchema;

/**
 * CSV mapper and header schema shared by the recommendation file reader and writer.
 *
 * <p>Kept out of the application context so the JSON {@code ObjectMapper} stays the only
 * mapper bean. Empty cells read back as null.</p>
 */
final class RecommendationCsvFormat {

    static final CsvMapper MAPPER = CsvMapper.builder()
        .enable(CsvReadFeature.EMPTY_STRING_AS_NULL)
        .build();

    static final CsvSchema SCHEMA = MAPPER.schemaFor(RecommendationRow.class).withHeader();

    private RecommendationCsvFormat() {
    }
}
