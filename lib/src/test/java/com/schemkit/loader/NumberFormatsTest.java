package com.schemkit.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class NumberFormatsTest {

    @Test
    void fileFormatDropsTrailingZeros() {
        assertEquals("0", NumberFormats.format(0));
        assertEquals("-70", NumberFormats.format(-70));
        assertEquals("2.5", NumberFormats.format(2.5));
        assertEquals("0.1", NumberFormats.format(0.1));
        assertEquals("0.3", NumberFormats.format(0.1 + 0.2));
        assertEquals("-0", NumberFormats.format(-0.0));
    }

    @Test
    void switchesToExponentLikeC() {
        assertEquals("1e+20", NumberFormats.format(1e20));
        assertEquals("1.5e-05", NumberFormats.format(1.5e-5));
        assertEquals("0.0001", NumberFormats.format(1e-4));
        assertEquals("1.23e+05", NumberFormats.formatG(123456, 3));
        assertEquals("100", NumberFormats.formatG(100, 3));
        assertEquals("1e+100", NumberFormats.formatG(1e100, 15));
    }

    @Test
    void roundsHalfToEven() {
        assertEquals("2", NumberFormats.formatG(2.5, 1));
        assertEquals("4", NumberFormats.formatG(3.5, 1));
        assertEquals("3.14159265358979", NumberFormats.formatG(Math.PI, 15));
    }

    @Test
    void nonFiniteValues() {
        assertEquals("nan", NumberFormats.format(Double.NaN));
        assertEquals("inf", NumberFormats.format(Double.POSITIVE_INFINITY));
        assertEquals("-inf", NumberFormats.format(Double.NEGATIVE_INFINITY));
    }
}
