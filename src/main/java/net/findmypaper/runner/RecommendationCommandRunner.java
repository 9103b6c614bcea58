package net.findmypaper.runner;

import net.findmypaper.adapters.persistence.RecommendationCsvWriter;
import net.findmypaper.application.library.LibraryLoader;
import net.findmypaper.application.report.RecommendationTableRenderer;
import net.findmypaper.config.RecommendationProperties;
import net.findmypaper.domain.QueryMode;
import net.findmypaper.domain.RecommendationReport;
import net.findmypaper.domain.RecommendationRequest;
import net.findmypaper.domain.YearRange;
import net.findmypaper.exception.PaperRecommendationException;
import net.findmypaper.model.LibraryEntry;
import net.findmypaper.service.RecommendationService;
import net.findmypaper.support.progress.ProgressListener;
import net.findmypaper.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Command-line entry point: runs one recommendation query described by {@code --recommend.*}
 * options, logs the result table and optionally saves it as CSV.
 *
 * <p>Modes, exactly one of which may be given:</p>
 * <ul>
 *   <li>{@code --recommend.library=<file.bib|file.json>}</li>
 *   <li>{@code --recommend.query=<text>}</li>
 *   <li>{@code --recommend.authors=<name;name>} (repeatable)</li>
 * </ul>
 * <p>Without any mode option the runner does nothing.</p>
 */
@Component
public class RecommendationCommandRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(RecommendationCommandRunner.class);

    static final String LIBRARY_OPTION = "recommend.library";
    static final String QUERY_OPTION = "recommend.query";
    static final String AUTHORS_OPTION = "recommend.authors";
    static final String COUNT_OPTION = "recommend.n";
    static final String SINCE_OPTION = "recommend.since";
    static final String TO_OPTION = "recommend.to";
    static final String SAVE_OPTION = "recommend.save";
    static final String CONTEXT_OPTION = "recommend.context";

    private static final Map<QueryMode, String> MODE_OPTIONS = new EnumMap<>(Map.of(
        QueryMode.LIBRARY, LIBRARY_OPTION,
        QueryMode.TEXT, QUERY_OPTION,
        QueryMode.AUTHORS, AUTHORS_OPTION));

    private final ApplicationArguments arguments;
    private final RecommendationService recommendationService;
    private final LibraryLoader libraryLoader;
    private final RecommendationTableRenderer renderer;
    private final RecommendationCsvWriter csvWriter;
    private final RecommendationProperties properties;
    private final ProgressListener progress;

    public RecommendationCommandRunner(ApplicationArguments arguments,
                                       RecommendationService recommendationService,
                                       LibraryLoader libraryLoader,
                                       RecommendationTableRenderer renderer,
                                       RecommendationCsvWriter csvWriter,
                                       RecommendationProperties properties,
                                       ProgressListener progress) {
        this.arguments = arguments;
        this.recommendationService = recommendationService;
        this.libraryLoader = libraryLoader;
        this.renderer = renderer;
        this.csvWriter = csvWriter;
        this.properties = properties;
        this.progress = progress;
    }

    @Override
    public void run(String... args) {
        QueryMode mode = resolveMode();
        if (mode == null) {
            return;
        }

        try {
            RecommendationReport report = execute(mode);
            log.info("Recommendations:\n{}", renderer.render(report));

            if (arguments.containsOption(SAVE_OPTION)) {
                csvWriter.write(report.recommendations(), Path.of(requiredValue(SAVE_OPTION)));
            }
        } catch (PaperRecommendationException ex) {
            LoggingUtils.error(log, ex, "Recommendation run failed [{}]: {}", ex.errorCode(), ex.getMessage());
            throw ex;
        }
    }

    private RecommendationReport execute(QueryMode mode) {
        RecommendationRequest request = new RecommendationRequest(
            parseIntOption(COUNT_OPTION, properties.getDefaultCount()),
            YearRange.of(parseYearOption(SINCE_OPTION), parseYearOption(TO_OPTION)),
            loadContext());

        return switch (mode) {
            case LIBRARY -> recommendationService.recommendForLibrary(
                libraryLoader.load(Path.of(requiredValue(LIBRARY_OPTION))), request, progress);
            case TEXT -> recommendationService.recommendForText(requiredValue(QUERY_OPTION), request, progress);
            case AUTHORS -> recommendationService.recommendForAuthors(authorNames(), request, progress);
        };
    }

    QueryMode resolveMode() {
        List<QueryMode> requested = new ArrayList<>();
        MODE_OPTIONS.forEach((mode, option) -> {
            if (arguments.containsOption(option)) {
                requested.add(mode);
            }
        });
        if (requested.size() > 1) {
            throw new IllegalArgumentException("Options --" + LIBRARY_OPTION + ", --" + QUERY_OPTION
                + " and --" + AUTHORS_OPTION + " are mutually exclusive; got " + requested);
        }
        return requested.isEmpty() ? null : requested.get(0);
    }

    private List<LibraryEntry> loadContext() {
        if (!arguments.containsOption(CONTEXT_OPTION)) {
            return List.of();
        }
        return libraryLoader.load(Path.of(requiredValue(CONTEXT_OPTION)));
    }

    private List<String> authorNames() {
        List<String> names = new ArrayList<>();
        for (String value : arguments.getOptionValues(AUTHORS_OPTION)) {
            Arrays.stream(value.split(";"))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .forEach(names::add);
        }
        if (names.isEmpty()) {
            throw new IllegalArgumentException("Option --" + AUTHORS_OPTION + " needs at least one author name");
        }
        return names;
    }

    private String requiredValue(String option) {
        List<String> values = arguments.getOptionValues(option);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            throw new IllegalArgumentException("Option --" + option + " needs a value");
        }
        return values.get(0);
    }

    private int parseIntOption(String option, int defaultValue) {
        if (!arguments.containsOption(option)) {
            return defaultValue;
        }
        String raw = requiredValue(option);
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid integer for --" + option + ": " + raw, ex);
        }
    }

    private Integer parseYearOption(String option) {
        return arguments.containsOption(option) ? parseIntOption(option, 0) : null;
    }
}
