package net.findmypaper.application.report;

import net.findmypaper.config.RecommendationProperties;
import net.findmypaper.domain.AuthorProfile;
import net.findmypaper.domain.KeywordProfile;
import net.findmypaper.domain.RecommendationReport;
import net.findmypaper.domain.ScoredPaper;
import net.findmypaper.util.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders a {@link RecommendationReport} as a plain-text table followed by the top keywords
 * and top authors of the run.
 */
@Component
public class RecommendationTableRenderer {

    static final int TITLE_WIDTH = 70;
    static final int AUTHORS_WIDTH = 40;
    private static final String[] HEADERS = {"#", "score", "year", "title", "authors"};

    private final RecommendationProperties properties;

    public RecommendationTableRenderer(RecommendationProperties properties) {
        this.properties = properties;
    }

    public String render(RecommendationReport report) {
        if (report.recommendations().isEmpty()) {
            return "No recommendations found.";
        }
        List<String> highlighted = properties.isHighlightKeywords()
            ? report.keywords().topKeywords(properties.getTopKeywords())
            : List.of();

        List<String[]> rows = new ArrayList<>();
        int rank = 1;
        for (ScoredPaper scored : report.recommendations()) {
            rows.add(new String[] {
                Integer.toString(rank++),
                String.format(Locale.ROOT, "%.3f", scored.score()),
                scored.year() == null ? "" : scored.year().toString(),
                highlight(StringUtils.abbreviate(Objects.toString(scored.title(), ""), TITLE_WIDTH), highlighted),
                StringUtils.abbreviate(String.join(", ", scored.paper().getAuthors()), AUTHORS_WIDTH)
            });
        }

        StringBuilder out = new StringBuilder();
        appendTable(out, rows);
        appendKeywords(out, report.keywords());
        appendAuthors(out, report.authors());
        return out.toString();
    }

    private static void appendTable(StringBuilder out, List<String[]> rows) {
        int[] widths = new int[HEADERS.length];
        for (int column = 0; column < HEADERS.length; column++) {
            widths[column] = HEADERS[column].length();
        }
        for (String[] row : rows) {
            for (int column = 0; column < row.length; column++) {
                row[column] = Objects.toString(row[column], "");
                widths[column] = Math.max(widths[column], row[column].length());
            }
        }

        String separator = separator(widths);
        out.append(separator).append('\n');
        appendRow(out, HEADERS, widths);
        out.append(separator).append('\n');
        for (String[] row : rows) {
            appendRow(out, row, widths);
        }
        out.append(separator).append('\n');
    }

    private static void appendRow(StringBuilder out, String[] cells, int[] widths) {
        out.append('|');
        for (int column = 0; column < cells.length; column++) {
            out.append(' ').append(pad(cells[column], widths[column])).append(" |");
        }
        out.append('\n');
    }

    private static String separator(int[] widths) {
        StringBuilder line = new StringBuilder("+");
        for (int width : widths) {
            line.append("-".repeat(width + 2)).append('+');
        }
        return line.toString();
    }

    private static String pad(String value, int width) {
        return value + " ".repeat(width - value.length());
    }

    private void appendKeywords(StringBuilder out, KeywordProfile keywords) {
        List<KeywordProfile.KeywordWeight> top = keywords.top(properties.getTopKeywords());
        if (top.isEmpty()) {
            return;
        }
        out.append("Top keywords: ")
            .append(top.stream()
                .map(entry -> entry.keyword() + " (" + entry.weight() + ")")
                .collect(Collectors.joining(", ")))
            .append('\n');
    }

    private void appendAuthors(StringBuilder out, AuthorProfile authors) {
        List<AuthorProfile.AuthorCount> top = authors.top(properties.getTopAuthors());
        if (top.isEmpty()) {
            return;
        }
        out.append("Top authors: ")
            .append(top.stream()
                .map(entry -> entry.author() + " (" + entry.count() + ")")
                .collect(Collectors.joining(", ")))
            .append('\n');
    }

    /**
     * Wraps whole-word, case-insensitive occurrences of the keywords in asterisks.
     */
    static String highlight(String title, List<String> keywords) {
        if (title == null || keywords.isEmpty()) {
            return Objects.toString(title, "");
        }
        String alternation = keywords.stream()
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
        Pattern pattern = Pattern.compile("(?<![\\p{L}\\p{N}])(" + alternation + ")(?![\\p{L}\\p{N}])",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        Matcher matcher = pattern.matcher(title);
        return matcher.replaceAll(match -> Matcher.quoteReplacement("*" + match.group(1) + "*"));
    }
}
