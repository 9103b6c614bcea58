package net.findmypaper.application.library;

import lombok.extern.slf4j.Slf4j;
import net.findmypaper.dto.LibraryEntryRecord;
import net.findmypaper.exception.LibraryLoadException;
import net.findmypaper.model.LibraryEntry;
import net.findmypaper.util.StringUtils;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the user's library from a BibTeX ({@code .bib}) or JSON ({@code .json}) file.
 *
 * <p>Entries without a title are skipped. Any failure to produce at least one usable entry
 * is fatal for the run and raised as {@link LibraryLoadException}.</p>
 */
@Component
@Slf4j
public class LibraryLoader {

    private static final Pattern YEAR = Pattern.compile("\\b(\\d{4})\\b");
    private static final Pattern AUTHOR_SEPARATOR = Pattern.compile("\\s+and\\s+", Pattern.CASE_INSENSITIVE);

    private final ObjectMapper objectMapper;

    public LibraryLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param path library file
     * @return entries in file order
     * @throws LibraryLoadException when the file is missing, unreadable, of an unknown
     *         format, malformed, or holds no entry with a title
     */
    public List<LibraryEntry> load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new LibraryLoadException(path, "file not found");
        }
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);

        List<LibraryEntry> entries;
        if (fileName.endsWith(".bib")) {
            entries = loadBibTex(path);
        } else if (fileName.endsWith(".json")) {
            entries = loadJson(path);
        } else {
            throw new LibraryLoadException(path, "unsupported format, expected a .bib or .json file");
        }

        if (entries.isEmpty()) {
            throw new LibraryLoadException(path, "no entries with a title");
        }
        log.info("Loaded {} papers from library {}", entries.size(), path);
        return entries;
    }

    private List<LibraryEntry> loadBibTex(Path path) {
        List<Map<String, String>> rawEntries;
        try {
            rawEntries = BibTexParser.parse(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new LibraryLoadException(path, "cannot read file", ex);
        } catch (IllegalArgumentException ex) {
            throw new LibraryLoadException(path, ex.getMessage(), ex);
        }

        List<LibraryEntry> entries = new ArrayList<>(rawEntries.size());
        for (Map<String, String> fields : rawEntries) {
            String title = fields.get("title");
            if (!org.springframework.util.StringUtils.hasText(title)) {
                log.warn("Skipping BibTeX entry {} without a title", fields.get(BibTexParser.CITATION_KEY));
                continue;
            }
            entries.add(new LibraryEntry(
                title,
                StringUtils.coalesce(fields.get("abstract")),
                splitAuthors(fields.get("author")),
                parseYear(fields.get("year")),
                StringUtils.coalesce(fields.get("doi"))));
        }
        return entries;
    }

    private List<LibraryEntry> loadJson(Path path) {
        List<LibraryEntryRecord> records;
        try (InputStream in = Files.newInputStream(path)) {
            records = objectMapper.readValue(in, new TypeReference<List<LibraryEntryRecord>>() {});
        } catch (IOException ex) {
            throw new LibraryLoadException(path, "cannot read file", ex);
        } catch (JacksonException ex) {
            throw new LibraryLoadException(path, "malformed JSON: " + ex.getOriginalMessage(), ex);
        }
        if (records == null) {
            return List.of();
        }

        List<LibraryEntry> entries = new ArrayList<>(records.size());
        for (LibraryEntryRecord record : records) {
            if (record == null || !org.springframework.util.StringUtils.hasText(record.title())) {
                log.warn("Skipping JSON library entry without a title");
                continue;
            }
            entries.add(new LibraryEntry(
                StringUtils.collapseWhitespace(record.title()),
                record.abstractText(),
                record.authors() == null ? List.of() : record.authors().stream()
                    .filter(org.springframework.util.StringUtils::hasText)
                    .toList(),
                record.year(),
                record.doi()));
        }
        return entries;
    }

    static List<String> splitAuthors(String authorField) {
        if (!org.springframework.util.StringUtils.hasText(authorField)) {
            return List.of();
        }
        return Arrays.stream(AUTHOR_SEPARATOR.split(authorField.trim()))
            .map(String::trim)
            .filter(name -> !name.isEmpty())
            .toList();
    }

    static Integer parseYear(String yearField) {
        if (yearField == null) {
            return null;
        }
        Matcher matcher = YEAR.matcher(yearField);
        return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
    }
}
