package com.schemkit.expr;

import com.schemkit.loader.NumberFormats;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/** SPICE style component values: {@code 10k}, {@code 1.5u}, {@code 3.3MEG}. */
public final class SpiceValues {
    private static final Map<String, Double> SUFFIXES = new LinkedHashMap<>();
    private static final double[] ENG_SCALES = {
        1e18, 1e15, 1e12, 1e9, 1e6, 1e3, 1e0, 1e-3, 1e-6, 1e-9, 1e-12, 1e-15, 1e-18
    };
    private static final String[] ENG_SUFFIXES = {"E", "P", "T", "G", "M", "k", "", "m", "u", "n", "p", "f", "a"};
    private static final Pattern PLAIN_NUMBER =
            Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");

    static {
        SUFFIXES.put("T", 1e12);
        SUFFIXES.put("G", 1e9);
        SUFFIXES.put("MEG", 1e6);
        SUFFIXES.put("K", 1e3);
        SUFFIXES.put("M", 1e-3);
        SUFFIXES.put("U", 1e-6);
        SUFFIXES.put("N", 1e-9);
        SUFFIXES.put("P", 1e-12);
        SUFFIXES.put("F", 1e-15);
        SUFFIXES.put("A", 1e-18);
    }

    private SpiceValues() {}

    /**
     * Multiplier for a scale suffix, matched case-insensitively ({@code MEG} is mega, {@code M} is
     * milli).
     *
     * @return the multiplier, or null when {@code suffix} is not a scale suffix
     */
    public static Double multiplier(String suffix) {
        return suffix == null ? null : SUFFIXES.get(suffix.toUpperCase(Locale.ROOT));
    }

    /** Parses a value with an optional scale suffix; text that is not a number yields 0. */
    public static double parse(String text) {
        if (text == null) {
            return 0.0;
        }
        String value = text.strip();
        if (value.isEmpty()) {
            return 0.0;
        }
        String upper = value.toUpperCase(Locale.ROOT);
        for (Map.Entry<String, Double> suffix : SUFFIXES.entrySet()) {
            if (upper.endsWith(suffix.getKey())) {
                String number = value.substring(0, value.length() - suffix.getKey().length());
                if (PLAIN_NUMBER.matcher(number).matches()) {
                    return Double.parseDouble(number) * suffix.getValue();
                }
            }
        }
        return PLAIN_NUMBER.matcher(value).matches() ? Double.parseDouble(value) : 0.0;
    }

    /** Engineering notation with 4 significant digits, for example {@code 10k} or {@code 1.5u}. */
    public static String format(double value) {
        return toEngineering(value, 4);
    }

    /**
     * Scales {@code value} by the largest power of 1000 not above it and appends that scale's
     * letter. The mantissa is written {@code %g} style with {@code digits} significant digits, or
     * rounded to an integer when {@code digits <= 0}.
     */
    public static String toEngineering(double value, int digits) {
        if (value == 0.0) {
            return "0";
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return NumberFormats.formatG(value, 1);
        }
        double magnitude = Math.abs(value);
        String sign = value < 0 ? "-" : "";
        for (int i = 0; i < ENG_SCALES.length; i++) {
            // Values a hair under a boundary still take that scale.
            if (magnitude >= ENG_SCALES[i] * 0.9999) {
                double scaled = magnitude / ENG_SCALES[i];
                String mantissa = digits <= 0
                        ? new BigDecimal(scaled).setScale(0, RoundingMode.HALF_EVEN).toPlainString()
                        : NumberFormats.formatG(scaled, digits);
                return sign + mantissa + ENG_SUFFIXES[i];
            }
        }
        return NumberFormats.formatG(value, Math.max(digits, 1));
    }
}
