package com.schemkit.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands bus labels into their individual signal names.
 *
 * <pre>
 *   A[7:0]      A[7],A[6],...,A[0]
 *   A&lt;0:2&gt;x    A&lt;0&gt;x,A&lt;1&gt;x,A&lt;2&gt;x
 *   D3:1        D3,D2,D1
 *   3*VDD       VDD,VDD,VDD       (the whole list, repeated)
 *   A[1:0]*2    A[1],A[1],A[0],A[0] (each signal, repeated)
 *   D[1:0],CLK  D[1],D[0],CLK
 * </pre>
 *
 * Commas inside brackets or parentheses do not split.
 */
public final class BusLabels {
    private static final Pattern REPEAT_LIST = Pattern.compile("^(\\d+)\\s*\\*\\s*(.+)$");
    private static final Pattern REPEAT_EACH = Pattern.compile("^(.+?)\\s*\\*\\s*(\\d+)$");
    private static final Pattern SQUARE_RANGE =
            Pattern.compile("^([a-zA-Z_][a-zA-Z0-9_]*)\\[(-?\\d+):(-?\\d+)\\](.*)$");
    private static final Pattern ANGLE_RANGE =
            Pattern.compile("^([a-zA-Z_][a-zA-Z0-9_]*)<(-?\\d+):(-?\\d+)>(.*)$");
    private static final Pattern BARE_RANGE =
            Pattern.compile("^([a-zA-Z_][a-zA-Z0-9_]*?)(-?\\d+):(-?\\d+)(.*)$");

    private BusLabels() {}

    /** Signal names in order; blank input expands to nothing. */
    public static List<String> expand(String label) {
        if (label == null || label.isBlank()) {
            return List.of();
        }
        return Collections.unmodifiableList(expandExpression(label.strip()));
    }

    public static int width(String label) {
        return expand(label).size();
    }

    public static boolean isBus(String label) {
        return width(label) > 1;
    }

    /** @throws IndexOutOfBoundsException when {@code index} is outside the expanded width */
    public static String signalAt(String label, int index) {
        List<String> signals = expand(label);
        if (index < 0 || index >= signals.size()) {
            throw new IndexOutOfBoundsException("Index " + index + " out of range for bus width " + signals.size());
        }
        return signals.get(index);
    }

    private static List<String> expandExpression(String expression) {
        String text = expression.strip();
        if (text.isEmpty()) {
            return new ArrayList<>();
        }
        List<String> parts = splitTopLevel(text);
        if (parts.size() > 1) {
            List<String> result = new ArrayList<>();
            for (String part : parts) {
                result.addAll(expandExpression(part));
            }
            return result;
        }
        if (parts.isEmpty()) {
            return new ArrayList<>();
        }
        text = parts.get(0);

        Matcher matcher = REPEAT_LIST.matcher(text);
        if (matcher.matches()) {
            Integer count = parseNumber(matcher.group(1));
            if (count == null) {
                return single(text);
            }
            List<String> once = expandExpression(matcher.group(2));
            List<String> result = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                result.addAll(once);
            }
            return result;
        }
        matcher = REPEAT_EACH.matcher(text);
        if (matcher.matches()) {
            Integer count = parseNumber(matcher.group(2));
            if (count == null) {
                return single(text);
            }
            List<String> result = new ArrayList<>();
            for (String signal : expandExpression(matcher.group(1))) {
                for (int i = 0; i < count; i++) {
                    result.add(signal);
                }
            }
            return result;
        }
        List<String> range = expandRange(text, SQUARE_RANGE, "[", "]");
        if (range == null) {
            range = expandRange(text, ANGLE_RANGE, "<", ">");
        }
        if (range == null) {
            range = expandRange(text, BARE_RANGE, "", "");
        }
        if (range != null) {
            return range;
        }
        return single(text);
    }

    private static List<String> single(String text) {
        List<String> single = new ArrayList<>();
        single.add(text);
        return single;
    }

    /** Null when the digits do not fit an {@code int}. */
    private static Integer parseNumber(String digits) {
        try {
            return Integer.valueOf(digits);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static List<String> expandRange(String text, Pattern pattern, String open, String close) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.matches()) {
            return null;
        }
        String name = matcher.group(1);
        Integer first = parseNumber(matcher.group(2));
        Integer last = parseNumber(matcher.group(3));
        if (first == null || last == null) {
            return null;
        }
        int start = first;
        int end = last;
        String suffix = matcher.group(4);
        int step = start <= end ? 1 : -1;
        List<String> result = new ArrayList<>();
        for (int i = start; ; i += step) {
            result.add(name + open + i + close + suffix);
            if (i == end) {
                break;
            }
        }
        return result;
    }

    private static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int brackets = 0;
        int parens = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '[') {
                brackets++;
            } else if (c == ']') {
                brackets--;
            } else if (c == '(') {
                parens++;
            } else if (c == ')') {
                parens--;
            } else if (c == ',' && brackets == 0 && parens == 0) {
                addPart(parts, current);
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        addPart(parts, current);
        return parts;
    }

    private static void addPart(List<String> parts, StringBuilder part) {
        String text = part.toString().strip();
        if (!text.isEmpty()) {
            parts.add(text);
        }
    }
}
