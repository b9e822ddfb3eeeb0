package com.fontlint.config;

import com.fontlint.exception.ArgTypeMismatchException;
import com.fontlint.exception.ConfigurationException;
import com.fontlint.font.FontAttributes;
import com.fontlint.selection.RuleList;
import com.fontlint.tag.TagCatalog;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RuleLoader.
 */
class RuleLoaderTest {

    private static final String BASE = "classpath:rules/base-rules.txt";
    private static final String OVERRIDE = "classpath:rules/override-rules.txt";

    private final FontAttributes monotypeDeva = FontAttributes.builder()
            .script("Deva").vendor("Monotype").build();

    @Test
    @DisplayName("Should load rules from the classpath")
    void shouldLoadFromClasspath() {
        RuleList rules = RuleLoader.load(BASE);

        assertEquals(2, rules.size());
        assertSame(TagCatalog.defaultCatalog(), rules.getCatalog());
        Set<String> enabled = rules.resolve(monotypeDeva).getEnabledTags();
        assertFalse(enabled.contains("reachable"));
        assertFalse(enabled.contains("bidi/ompl_rtlm"));
    }

    @Test
    @DisplayName("Later files should override earlier ones")
    void laterFilesShouldOverride() {
        RuleList rules = RuleLoader.loadAll(List.of(BASE, OVERRIDE), TagCatalog.defaultCatalog());

        assertEquals(3, rules.size());
        Set<String> enabled = rules.resolve(monotypeDeva).getEnabledTags();
        assertTrue(enabled.contains("reachable"));
        assertFalse(enabled.contains("bidi"));

        FontAttributes adobe = FontAttributes.builder().script("Latn").vendor("Adobe").build();
        assertFalse(rules.resolve(adobe).getEnabledTags().contains("reachable"));
    }

    @Test
    @DisplayName("Blank paths should be skipped")
    void blankPathsShouldBeSkipped() {
        RuleList rules = RuleLoader.loadAll(Arrays.asList("", null, BASE, "  "), TagCatalog.defaultCatalog());

        assertEquals(2, rules.size());
    }

    @Test
    @DisplayName("Should load rules from the file system")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("rules.txt");
        Files.writeString(file, "condition\nweight Bold; disable advances\n", StandardCharsets.UTF_8);

        RuleList rules = RuleLoader.load(file.toString());

        assertEquals(1, rules.size());
        FontAttributes bold = FontAttributes.builder().weight("Bold").build();
        assertFalse(rules.resolve(bold).getEnabledTags().contains("advances/digits"));
    }

    @Test
    @DisplayName("Missing file should be a configuration error")
    void missingFileShouldFail() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> RuleLoader.load("classpath:rules/missing.txt"));

        assertTrue(e.getMessage().contains("rules/missing.txt"));
        assertNotNull(e.getCause());
    }

    @Test
    @DisplayName("Parse error should name the file and line")
    void parseErrorShouldNameFile() {
        ArgTypeMismatchException e = assertThrows(ArgTypeMismatchException.class,
                () -> RuleLoader.load("classpath:rules/bad-rules.txt"));

        assertTrue(e.getLocation().startsWith("classpath:rules/bad-rules.txt line 2 "));
    }
}
