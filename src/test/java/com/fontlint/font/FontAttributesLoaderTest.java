package com.fontlint.font;

import com.fontlint.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FontAttributesLoader.
 */
class FontAttributesLoaderTest {

    @Test
    @DisplayName("Should load fonts listed under the fonts key")
    void shouldLoadFontsKey() {
        List<FontAttributes> fonts = FontAttributesLoader.load("classpath:fonts/test-fonts.yaml");

        assertEquals(2, fonts.size());

        FontAttributes deva = fonts.get(0);
        assertEquals("NotoSansDevanagari-Regular.ttf", deva.filename());
        assertEquals("Deva", deva.script());
        assertEquals("1.02", deva.version());
        assertTrue(deva.hinted());
        assertNull(deva.variant());

        FontAttributes latin = fonts.get(1);
        assertEquals("2.001", latin.version());
        assertFalse(latin.monospace());
        assertFalse(latin.hinted());
    }

    @Test
    @DisplayName("Should load a top level list")
    void shouldLoadTopLevelList() {
        List<FontAttributes> fonts = FontAttributesLoader.load("classpath:fonts/font-list.yaml");

        assertEquals(1, fonts.size());
        assertEquals("Thai", fonts.get(0).script());
    }

    @Test
    @DisplayName("Empty file should give no fonts")
    void emptyFileShouldGiveNoFonts() {
        assertTrue(FontAttributesLoader.load("classpath:fonts/empty.yaml").isEmpty());
    }

    @Test
    @DisplayName("Non-list fonts entry should fail")
    void nonListShouldFail() {
        assertThrows(ConfigurationException.class,
                () -> FontAttributesLoader.load("classpath:fonts/not-a-list.yaml"));
    }

    @Test
    @DisplayName("Missing file should fail")
    void missingFileShouldFail() {
        assertThrows(ConfigurationException.class,
                () -> FontAttributesLoader.load("classpath:fonts/absent.yaml"));
    }
}
