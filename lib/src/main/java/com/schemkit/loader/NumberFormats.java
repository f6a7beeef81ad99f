package com.schemkit.loader;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/** Number rendering compatible with C's {@code printf("%.<p>g")}. */
public final class NumberFormats {
    /** Significant digits used for coordinates in written files. */
    public static final int FILE_PRECISION = 16;

    private NumberFormats() {}

    public static String format(double value) {
        return formatG(value, FILE_PRECISION);
    }

    /**
     * Formats like {@code %.<precision>g}: the value is rounded to {@code precision} significant
     * digits, written in scientific notation when the decimal exponent is below -4 or at least
     * {@code precision}, and stripped of trailing zeros.
     */
    public static String formatG(double value, int precision) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == 0.0) {
            return 1.0 / value < 0 ? "-0" : "0";
        }
        int digits = precision <= 0 ? 1 : precision;
        BigDecimal rounded = new BigDecimal(value).round(new MathContext(digits, RoundingMode.HALF_EVEN));
        int exponent = rounded.precision() - rounded.scale() - 1;
        if (exponent < -4 || exponent >= digits) {
            BigDecimal mantissa = rounded.movePointLeft(exponent).setScale(digits - 1, RoundingMode.HALF_EVEN);
            int magnitude = Math.abs(exponent);
            return stripZeros(mantissa.toPlainString())
                    + (exponent < 0 ? "e-" : "e+")
                    + (magnitude < 10 ? "0" : "")
                    + magnitude;
        }
        BigDecimal fixed = rounded.setScale(Math.max(digits - 1 - exponent, 0), RoundingMode.HALF_EVEN);
        return stripZeros(fixed.toPlainString());
    }

    private static String stripZeros(String text) {
        if (text.indexOf('.') < 0) {
            return text;
        }
        int end = text.length();
        while (text.charAt(end - 1) == '0') {
            end--;
        }
        if (text.charAt(end - 1) == '.') {
            end--;
        }
        return text.substring(0, end);
    }
}
