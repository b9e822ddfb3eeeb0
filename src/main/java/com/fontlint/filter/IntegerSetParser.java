package com.fontlint.filter;

import com.fontlint.exception.IntegerSetException;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Parses whitespace separated integer values and inclusive ranges into a set.
 * <p>
 * Examples (decimal): {@code "3 5-7 9"} gives {3, 5, 6, 7, 9}.
 * Examples (hex): {@code "41-5A 2010"} gives code points U+0041..U+005A and U+2010.
 * <p>
 * Overlapping values are an error, not silently merged.
 */
public final class IntegerSetParser {

    /** Largest Unicode code point. */
    public static final int MAX_CODE_POINT = 0x10FFFF;
    /** Largest glyph id a font can address. */
    public static final int MAX_GLYPH_ID = 0xFFFF;

    private static final char RANGE_SEPARATOR = '-';

    private IntegerSetParser() {
    }

    /**
     * Parse a list of values and ranges.
     *
     * @param text Space separated values or {@code lo-hi} ranges
     * @param hex  true to read literals as base 16, false for base 10
     * @return Unmodifiable set of parsed values
     * @throws IntegerSetException if the text is malformed or repeats a value
     */
    public static Set<Integer> parse(String text, boolean hex) {
        return parse(text, hex, Integer.MAX_VALUE);
    }

    /**
     * Parse a list of values and ranges, none of which may exceed {@code max}.
     *
     * @throws IntegerSetException if the text is malformed, repeats a value or goes above max
     */
    public static Set<Integer> parse(String text, boolean hex, int max) {
        if (text == null || text.isBlank()) {
            throw new IntegerSetException("Integer set cannot be empty");
        }

        int radix = hex ? 16 : 10;
        Set<Integer> result = new HashSet<>();
        long count = 0;

        for (String token : text.trim().split("\\s+")) {
            if (token.indexOf(RANGE_SEPARATOR) >= 0) {
                String[] bounds = token.split(String.valueOf(RANGE_SEPARATOR), -1);
                if (bounds.length != 2) {
                    throw new IntegerSetException("Could not parse range from '" + token + "'");
                }
                int lo = parseValue(bounds[0], radix, token);
                int hi = parseValue(bounds[1], radix, token);
                if (lo >= hi) {
                    throw new IntegerSetException("Range '" + token + "' must have high > low");
                }
                checkMax(hi, max, token);
                for (long value = lo; value <= hi; value++) {
                    result.add((int) value);
                }
                count += (long) hi - lo + 1;
            } else {
                int value = parseValue(token, radix, token);
                checkMax(value, max, token);
                result.add(value);
                count++;
            }
        }

        if (result.size() != count) {
            throw new IntegerSetException("Duplicate values in '" + text + "', expected count is "
                    + count + " but set has " + result.size());
        }
        return Collections.unmodifiableSet(result);
    }

    private static void checkMax(int value, int max, String token) {
        if (value > max) {
            throw new IntegerSetException("Value in '" + token + "' is above the maximum "
                    + Integer.toHexString(max).toUpperCase() + " (hex)");
        }
    }

    private static int parseValue(String value, int radix, String token) {
        try {
            return Integer.parseInt(value, radix);
        } catch (NumberFormatException e) {
            throw new IntegerSetException("Invalid " + (radix == 16 ? "hex" : "decimal")
                    + " value '" + value + "' in '" + token + "'", e);
        }
    }
}
