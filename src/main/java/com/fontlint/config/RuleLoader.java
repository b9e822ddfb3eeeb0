package com.fontlint.config;

import com.fontlint.exception.ConfigurationException;
import com.fontlint.selection.RuleList;
import com.fontlint.tag.TagCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Loads rule text from files or classpath resources.
 */
public class RuleLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleLoader.class);

    /**
     * Load rules from a path over the built-in catalog.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the rule file
     * @return Parsed rules
     */
    public static RuleList load(String path) {
        return load(path, TagCatalog.defaultCatalog());
    }

    public static RuleList load(String path, TagCatalog catalog) {
        return loadAll(List.of(path), catalog);
    }

    /**
     * Load several rule files in order into one rule list. Later files override earlier ones
     * wherever their blocks apply.
     *
     * @param paths   Rule file paths; blank entries are skipped
     * @param catalog Tag catalog the rules refer to
     * @return Parsed rules
     */
    public static RuleList loadAll(List<String> paths, TagCatalog catalog) {
        RuleParser parser = new RuleParser(catalog);
        RuleList rules = new RuleList(catalog);

        for (String path : paths) {
            if (path == null || path.isBlank()) {
                continue;
            }
            log.info("Loading lint rules from: {}", path);
            String text = read(path);
            try {
                parser.parse(text, rules);
            } catch (ConfigurationException e) {
                throw e.withLocation(path + (e.getLocation() != null ? " " + e.getLocation() : ""));
            }
        }

        log.info("Loaded {} rule blocks from {} file(s)", rules.size(), paths.size());
        return rules;
    }

    private static String read(String path) {
        try (InputStream inputStream = Resources.get(path).getInputStream()) {
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load rules from: " + path, e);
        }
    }
}
