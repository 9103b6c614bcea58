package net.findmypaper.application.library;

import net.findmypaper.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Minimal BibTeX reader producing one field map per entry.
 *
 * <p>Handles {@code @type{key, name = {value}, name = "value", name = 2019}} with nested
 * braces, {@code #} concatenation and both {@code {}} and {@code ()} entry delimiters.
 * {@code @comment}, {@code @preamble} and {@code @string} blocks are skipped; string macros
 * are not expanded. Field names are lower-cased; values have LaTeX braces and simple
 * commands removed and whitespace collapsed.</p>
 */
final class BibTexParser {

    static final String ENTRY_TYPE = "entrytype";
    static final String CITATION_KEY = "citationkey";

    private static final Set<String> SKIPPED_BLOCKS = Set.of("comment", "preamble", "string");
    private static final String ESCAPED_CHARACTERS = "&%$#_{}";
    private static final String ACCENT_COMMANDS = "'\"^`~=.";

    private final String source;
    private int pos;

    private BibTexParser(String source) {
        this.source = source;
    }

    /**
     * Parses every entry of {@code content}.
     *
     * @throws IllegalArgumentException when an entry is not terminated
     */
    static List<Map<String, String>> parse(String content) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        return new BibTexParser(content).entries();
    }

    private List<Map<String, String>> entries() {
        List<Map<String, String>> entries = new ArrayList<>();
        while (true) {
            int at = source.indexOf('@', pos);
            if (at < 0) {
                return entries;
            }
            pos = at + 1;
            String type = readWord().toLowerCase(Locale.ROOT);
            skipWhitespace();
            if (type.isEmpty() || pos >= source.length() || (peek() != '{' && peek() != '(')) {
                continue;
            }
            char close = peek() == '{' ? '}' : ')';
            int entryStart = at;
            pos++;
            if (SKIPPED_BLOCKS.contains(type)) {
                skipBalanced(close, entryStart);
                continue;
            }
            entries.add(readEntry(type, close, entryStart));
        }
    }

    private Map<String, String> readEntry(String type, char close, int entryStart) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(ENTRY_TYPE, type);
        skipWhitespace();
        int keyStart = pos;
        while (pos < source.length() && source.charAt(pos) != ',' && source.charAt(pos) != close) {
            pos++;
        }
        requireInput(entryStart);
        fields.put(CITATION_KEY, source.substring(keyStart, pos).trim());

        while (true) {
            skipWhitespaceAndCommas();
            requireInput(entryStart);
            if (peek() == close) {
                pos++;
                return fields;
            }
            String name = readFieldName().toLowerCase(Locale.ROOT);
            skipWhitespace();
            requireInput(entryStart);
            if (peek() != '=') {
                throw new IllegalArgumentException("Expected '=' after field \"" + name + "\" in entry at offset " + entryStart);
            }
            pos++;
            String value = readValue(close, entryStart);
            if (!name.isEmpty()) {
                fields.put(name, clean(value));
            }
        }
    }

    private String readValue(char close, int entryStart) {
        StringBuilder value = new StringBuilder();
        while (true) {
            skipWhitespace();
            requireInput(entryStart);
            char c = peek();
            if (c == '{') {
                pos++;
                value.append(readUntilBalanced('}', entryStart));
            } else if (c == '"') {
                pos++;
                value.append(readQuoted(entryStart));
            } else {
                int start = pos;
                while (pos < source.length() && source.charAt(pos) != ',' && source.charAt(pos) != close
                    && source.charAt(pos) != '#' && !Character.isWhitespace(source.charAt(pos))) {
                    pos++;
                }
                value.append(source, start, pos);
            }
            skipWhitespace();
            if (pos < source.length() && peek() == '#') {
                pos++;
                continue;
            }
            return value.toString();
        }
    }

    private String readUntilBalanced(char close, int entryStart) {
        int depth = 1;
        int start = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\') {
                pos += 2;
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    String inner = source.substring(start, pos);
                    pos++;
                    return inner;
                }
            }
            pos++;
        }
        throw unterminated(entryStart);
    }

    private String readQuoted(int entryStart) {
        int depth = 0;
        int start = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\') {
                pos += 2;
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            } else if (c == '"' && depth == 0) {
                String inner = source.substring(start, pos);
                pos++;
                return inner;
            }
            pos++;
        }
        throw unterminated(entryStart);
    }

    private void skipBalanced(char close, int entryStart) {
        if (close == '}') {
            readUntilBalanced('}', entryStart);
            return;
        }
        int depth = 1;
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return;
            }
        }
        throw unterminated(entryStart);
    }

    private String readWord() {
        int start = pos;
        while (pos < source.length() && Character.isLetter(source.charAt(pos))) {
            pos++;
        }
        return source.substring(start, pos);
    }

    private String readFieldName() {
        int start = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '=' || Character.isWhitespace(c)) {
                break;
            }
            pos++;
        }
        return source.substring(start, pos);
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private void skipWhitespaceAndCommas() {
        while (pos < source.length() && (Character.isWhitespace(source.charAt(pos)) || source.charAt(pos) == ',')) {
            pos++;
        }
    }

    private char peek() {
        return source.charAt(pos);
    }

    private void requireInput(int entryStart) {
        if (pos >= source.length()) {
            throw unterminated(entryStart);
        }
    }

    private static IllegalArgumentException unterminated(int entryStart) {
        return new IllegalArgumentException("Unterminated BibTeX entry starting at offset " + entryStart);
    }

    /**
     * Strips LaTeX markup from a raw field value: grouping braces, commands such as
     * {@code \emph}, accent prefixes such as {@code \"}, and the backslash of escaped
     * characters such as {@code \&}.
     */
    static String clean(String raw) {
        if (raw == null) {
            return null;
        }
        StringBuilder out = new StringBuilder(raw.length());
        int i = 0;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            if (c == '\\' && i + 1 < raw.length()) {
                char next = raw.charAt(i + 1);
                if (ESCAPED_CHARACTERS.indexOf(next) >= 0) {
                    out.append(next);
                    i += 2;
                } else if (ACCENT_COMMANDS.indexOf(next) >= 0) {
                    i += 2;
                } else if (Character.isLetter(next)) {
                    i++;
                    while (i < raw.length() && Character.isLetter(raw.charAt(i))) {
                        i++;
                    }
                    out.append(' ');
                } else {
                    i++;
                }
                continue;
            }
            if (c != '{' && c != '}') {
                out.append(c);
            }
            i++;
        }
        return StringUtils.collapseWhitespace(out.toString());
    }
}
