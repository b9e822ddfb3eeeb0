package com.fontlint.filter;

import com.fontlint.exception.IntegerSetException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for IntegerSetParser.
 */
class IntegerSetParserTest {

    @Test
    @DisplayName("Should parse decimal values and ranges")
    void shouldParseDecimal() {
        assertEquals(Set.of(3, 5, 6, 7, 9), IntegerSetParser.parse("3 5-7 9", false));
    }

    @Test
    @DisplayName("Should parse hex values and ranges")
    void shouldParseHex() {
        Set<Integer> result = IntegerSetParser.parse("41-5A 2010", true);

        assertEquals(27, result.size());
        assertTrue(result.contains(0x41));
        assertTrue(result.contains(0x5A));
        assertTrue(result.contains(0x2010));
        assertFalse(result.contains(0x5B));
    }

    @Test
    @DisplayName("Should tolerate repeated whitespace between tokens")
    void shouldTolerateWhitespace() {
        assertEquals(Set.of(1, 2, 3), IntegerSetParser.parse("  1   2\t3 ", false));
    }

    @Test
    @DisplayName("Should reject a value repeated inside a range")
    void shouldRejectDuplicateInRange() {
        assertThrows(IntegerSetException.class, () -> IntegerSetParser.parse("3 3-5", false));
    }

    @Test
    @DisplayName("Should reject repeated literals")
    void shouldRejectDuplicateLiterals() {
        assertThrows(IntegerSetException.class, () -> IntegerSetParser.parse("a A", true));
    }

    @Test
    @DisplayName("Should reject overlapping ranges")
    void shouldRejectOverlappingRanges() {
        assertThrows(IntegerSetException.class, () -> IntegerSetParser.parse("1-5 4-8", false));
    }

    @ParameterizedTest
    @DisplayName("Should reject inverted or empty ranges")
    @ValueSource(strings = {"5-3", "5-5"})
    void shouldRejectInvertedRange(String text) {
        assertThrows(IntegerSetException.class, () -> IntegerSetParser.parse(text, false));
    }

    @ParameterizedTest
    @DisplayName("Should reject malformed input")
    @ValueSource(strings = {"", "   ", "1-2-3", "5-", "-5", "x", "1.5"})
    void shouldRejectMalformed(String text) {
        assertThrows(IntegerSetException.class, () -> IntegerSetParser.parse(text, false));
    }

    @Test
    @DisplayName("Should read hex digits as invalid in decimal mode")
    void shouldRejectHexInDecimalMode() {
        assertThrows(IntegerSetException.class, () -> IntegerSetParser.parse("41-5A", false));
    }

    @Test
    @DisplayName("Range ending at the largest int should terminate")
    void rangeAtIntLimitShouldTerminate() {
        Set<Integer> result = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> IntegerSetParser.parse("7FFFFFFE-7FFFFFFF", true));

        assertEquals(Set.of(Integer.MAX_VALUE - 1, Integer.MAX_VALUE), result);
    }

    @Test
    @DisplayName("Should accept values up to the maximum")
    void shouldAcceptValuesUpToMaximum() {
        assertTrue(IntegerSetParser.parse("10FFFE-10FFFF", true, IntegerSetParser.MAX_CODE_POINT)
                .contains(0x10FFFF));
        assertTrue(IntegerSetParser.parse("65535", false, IntegerSetParser.MAX_GLYPH_ID).contains(65535));
    }

    @ParameterizedTest
    @DisplayName("Should reject code points above the Unicode range")
    @ValueSource(strings = {"110000", "41 110000", "10FFFF-110000", "7FFFFFFE-7FFFFFFF"})
    void shouldRejectCodePointsAboveMaximum(String text) {
        assertThrows(IntegerSetException.class,
                () -> IntegerSetParser.parse(text, true, IntegerSetParser.MAX_CODE_POINT));
    }

    @Test
    @DisplayName("Should reject glyph ids above the maximum")
    void shouldRejectGlyphIdsAboveMaximum() {
        assertThrows(IntegerSetException.class,
                () -> IntegerSetParser.parse("65530-65536", false, IntegerSetParser.MAX_GLYPH_ID));
    }

    @Test
    @DisplayName("Result should be unmodifiable")
    void resultShouldBeUnmodifiable() {
        Set<Integer> result = IntegerSetParser.parse("1 2", false);
        assertThrows(UnsupportedOperationException.class, () -> result.add(3));
    }
}
