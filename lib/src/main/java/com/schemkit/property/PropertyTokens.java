package com.schemkit.property;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Reads and edits the {@code name=value} token strings carried by most schematic records.
 *
 * <p>Tokens are whitespace separated. A value is either bare (ends at whitespace), double quoted
 * (ends at an unescaped {@code "}) or brace quoted (balanced {@code {...}}). A backslash makes the
 * following character literal in every value form.
 *
 * <p>{@link #getTokValue} answers with the <em>first</em> occurrence of a key while
 * {@link #parseProperties} lets a later duplicate replace an earlier one. Both behaviors are relied
 * upon by callers and are kept distinct.
 */
public final class PropertyTokens {

    private PropertyTokens() {}

    public static String getTokValue(String props, String key) {
        return getTokValue(props, key, false);
    }

    /**
     * Returns the value of the first token named {@code key}.
     *
     * @param keepQuotes when true the raw value text is returned, including its quotes, braces and
     *     escaping backslashes
     * @return the value, or an empty string when the key is absent or carries no value
     */
    public static String getTokValue(String props, String key, boolean keepQuotes) {
        if (props == null || props.isEmpty() || key == null || key.isEmpty()) {
            return "";
        }
        TokenScanner scanner = new TokenScanner(props);
        Token token;
        while ((token = scanner.next()) != null) {
            if (token.name.equals(key)) {
                return keepQuotes ? token.rawValue(props) : token.value;
            }
        }
        return "";
    }

    /** True if {@code key} appears as a whole token name, with or without a value. */
    public static boolean hasToken(String props, String key) {
        if (props == null || props.isEmpty() || key == null || key.isEmpty()) {
            return false;
        }
        Pattern pattern = Pattern.compile("(?:^|\\s)" + Pattern.quote(key) + "(?:=|$|\\s)");
        return pattern.matcher(props).find();
    }

    /**
     * Replaces the value of the first token named {@code key}.
     *
     * @param newValue the replacement value, or {@code null} to delete that token
     * @param addIfMissing append {@code key=newValue} when the key is absent
     * @return the edited property string, trimmed
     */
    public static String substToken(
            String props, String key, String newValue, boolean addIfMissing) {
        Objects.requireNonNull(key, "key");
        if (props == null || props.isEmpty()) {
            if (newValue != null && addIfMissing) {
                return key + "=" + quoteIfNeeded(newValue);
            }
            return "";
        }
        Token match = null;
        TokenScanner scanner = new TokenScanner(props);
        Token token;
        while ((token = scanner.next()) != null) {
            if (token.name.equals(key)) {
                match = token;
                break;
            }
        }
        if (match == null) {
            if (newValue != null && addIfMissing) {
                String base = props.stripTrailing();
                return (base.isEmpty() ? "" : base + " ") + key + "=" + quoteIfNeeded(newValue);
            }
            return props.strip();
        }
        String before = props.substring(0, match.start);
        String after = props.substring(match.end);
        if (newValue != null) {
            return (before + key + "=" + quoteIfNeeded(newValue) + after).strip();
        }
        after = stripLeadingBlanks(after);
        if (after.isEmpty() || after.charAt(0) == '\n') {
            before = stripTrailingBlanks(before);
        }
        if (!after.isEmpty() && after.charAt(0) == '\n' && (before.isEmpty() || before.endsWith("\n"))) {
            after = after.substring(1);
        }
        return (before + after).strip();
    }

    public static String substToken(String props, String key, String newValue) {
        return substToken(props, key, newValue, true);
    }

    /**
     * Parses every token into an insertion ordered map. When a key repeats, the later value
     * replaces the earlier one but keeps its original position.
     */
    public static Map<String, String> parseProperties(String props) {
        Map<String, String> result = new LinkedHashMap<>();
        if (props == null || props.isEmpty()) {
            return result;
        }
        TokenScanner scanner = new TokenScanner(props);
        Token token;
        while ((token = scanner.next()) != null) {
            result.put(token.name, token.value);
        }
        return result;
    }

    /** Lists token names in the order they appear, duplicates included. */
    public static List<String> tokenNames(String props) {
        List<String> names = new ArrayList<>();
        if (props == null || props.isEmpty()) {
            return names;
        }
        TokenScanner scanner = new TokenScanner(props);
        Token token;
        while ((token = scanner.next()) != null) {
            names.add(token.name);
        }
        return names;
    }

    public static String formatProperties(Map<String, String> properties) {
        StringBuilder builder = new StringBuilder();
        for (Map.Entry<String, String> entry : properties.entrySet()) {
            if (builder.length() > 0) {
                builder.append(' ');
            }
            builder.append(entry.getKey()).append('=').append(quoteIfNeeded(entry.getValue()));
        }
        return builder.toString();
    }

    /**
     * Quotes a value so that {@link #getTokValue} reads it back unchanged. Values holding
     * whitespace, {@code "} or {@code =} are double quoted with {@code \} and {@code "} escaped.
     */
    public static String quoteIfNeeded(String value) {
        if (value == null || value.isEmpty()) {
            return "\"\"";
        }
        boolean needsQuotes = value.charAt(0) == '{';
        for (int i = 0; i < value.length() && !needsQuotes; i++) {
            char c = value.charAt(i);
            needsQuotes = Character.isWhitespace(c) || c == '"' || c == '=';
        }
        if (needsQuotes) {
            return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
        }
        if (value.indexOf('\\') >= 0) {
            return value.replace("\\", "\\\\");
        }
        return value;
    }

    private static String stripLeadingBlanks(String text) {
        int i = 0;
        while (i < text.length() && text.charAt(i) != '\n' && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return text.substring(i);
    }

    private static String stripTrailingBlanks(String text) {
        int i = text.length();
        while (i > 0 && text.charAt(i - 1) != '\n' && Character.isWhitespace(text.charAt(i - 1))) {
            i--;
        }
        return text.substring(0, i);
    }

    private static final class Token {
        final String name;
        final String value;
        final int start;
        final int valueStart;
        final int end;

        Token(String name, String value, int start, int valueStart, int end) {
            this.name = name;
            this.value = value;
            this.start = start;
            this.valueStart = valueStart;
            this.end = end;
        }

        String rawValue(String source) {
            return source.substring(valueStart, end);
        }
    }

    /** Walks a property string one token at a time, recording each token's span. */
    private static final class TokenScanner {
        private final String text;
        private int pos;

        TokenScanner(String text) {
            this.text = text;
        }

        Token next() {
            int length = text.length();
            while (pos < length && (Character.isWhitespace(text.charAt(pos)) || text.charAt(pos) == '=')) {
                pos++;
            }
            if (pos >= length) {
                return null;
            }
            int start = pos;
            while (pos < length && text.charAt(pos) != '=' && !Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
            String name = text.substring(start, pos);
            if (pos >= length || text.charAt(pos) != '=') {
                return new Token(name, "", start, pos, pos);
            }
            pos++;
            while (pos < length && text.charAt(pos) != '\n' && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
            if (pos >= length || text.charAt(pos) == '\n') {
                return new Token(name, "", start, pos, pos);
            }
            int valueStart = pos;
            String value;
            char first = text.charAt(pos);
            if (first == '"') {
                pos++;
                value = scanQuoted();
            } else if (first == '{') {
                pos++;
                value = scanBraced();
            } else {
                value = scanBare();
            }
            return new Token(name, value, start, valueStart, pos);
        }

        private String scanBare() {
            StringBuilder value = new StringBuilder();
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (c == '\\') {
                    pos++;
                    if (pos < text.length()) {
                        value.append(text.charAt(pos++));
                    }
                } else if (Character.isWhitespace(c)) {
                    break;
                } else {
                    value.append(c);
                    pos++;
                }
            }
            return value.toString();
        }

        private String scanQuoted() {
            StringBuilder value = new StringBuilder();
            while (pos < text.length()) {
                char c = text.charAt(pos++);
                if (c == '\\') {
                    if (pos < text.length()) {
                        value.append(text.charAt(pos++));
                    }
                } else if (c == '"') {
                    break;
                } else {
                    value.append(c);
                }
            }
            return value.toString();
        }

        private String scanBraced() {
            StringBuilder value = new StringBuilder();
            int depth = 1;
            while (pos < text.length()) {
                char c = text.charAt(pos++);
                if (c == '\\') {
                    if (pos < text.length()) {
                        value.append(text.charAt(pos++));
                    }
                } else if (c == '{') {
                    depth++;
                    value.append(c);
                } else if (c == '}') {
                    if (--depth == 0) {
                        break;
                    }
                    value.append(c);
                } else {
                    value.append(c);
                }
            }
            return value.toString();
        }
    }
}
