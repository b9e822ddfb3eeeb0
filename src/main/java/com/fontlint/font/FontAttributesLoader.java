package com.fontlint.font;

import com.fontlint.config.Resources;
import com.fontlint.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads font attribute snapshots from YAML files.
 * <p>
 * The document is either a list of attribute maps or a map with a {@code fonts} list:
 * <pre>
 * fonts:
 *   - filename: NotoSansDevanagari-Regular.ttf
 *     script: Deva
 *     vendor: Monotype
 *     version: "1.02"
 *     hinted: true
 * </pre>
 * Quote versions so YAML does not read them as numbers.
 */
public class FontAttributesLoader {

    private static final Logger log = LoggerFactory.getLogger(FontAttributesLoader.class);

    /**
     * Load fonts from a path. Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the YAML file
     * @return Fonts in file order
     */
    public static List<FontAttributes> load(String path) {
        log.info("Loading font attributes from: {}", path);

        try (InputStream inputStream = Resources.get(path).getInputStream()) {
            return parseYaml(inputStream, path);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load font attributes from: " + path, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static List<FontAttributes> parseYaml(InputStream inputStream, String path) {
        Object root = new Yaml().load(inputStream);
        if (root == null) {
            log.warn("Font attributes file {} is empty", path);
            return List.of();
        }

        Object fontList = root instanceof Map<?, ?> map ? map.get("fonts") : root;
        if (!(fontList instanceof List<?> entries)) {
            throw new ConfigurationException("Expected a list of fonts in: " + path);
        }

        List<FontAttributes> fonts = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            Object entry = entries.get(i);
            if (!(entry instanceof Map<?, ?>)) {
                throw new ConfigurationException("Font entry " + i + " in " + path + " is not a map");
            }
            fonts.add(FontAttributesFactory.fromMap((Map<String, Object>) entry));
        }

        log.info("Loaded {} fonts from {}", fonts.size(), path);
        return fonts;
    }
}
