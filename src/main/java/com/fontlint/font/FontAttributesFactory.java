package com.fontlint.font;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Factory for creating FontAttributes from JSON payloads or generic maps.
 * Keys match the rule field names plus "monospace"; unknown keys are ignored.
 */
public final class FontAttributesFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private FontAttributesFactory() {
    }

    /**
     * Create FontAttributes from a JSON object.
     *
     * @param json JSON object, e.g. {"name": "Noto Sans", "script": "Latn", "hinted": true}
     * @return Parsed snapshot
     */
    public static FontAttributes fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Font attributes JSON cannot be empty");
        }
        return fromMap(parseJson(json));
    }

    /**
     * Create FontAttributes from a map of attribute values.
     * Non-string scalars (e.g. numeric versions from YAML) are converted with toString.
     */
    public static FontAttributes fromMap(Map<String, ?> map) {
        return FontAttributes.builder()
                .filename(getString(map, "filename"))
                .name(getString(map, "name"))
                .style(getString(map, "style"))
                .script(getString(map, "script"))
                .variant(getString(map, "variant"))
                .weight(getString(map, "weight"))
                .monospace(getBoolean(map, "monospace"))
                .hinted(getBoolean(map, "hinted"))
                .vendor(getString(map, "vendor"))
                .version(getString(map, "version"))
                .build();
    }

    private static Map<String, Object> parseJson(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid font attributes JSON: " + e.getMessage(), e);
        }
    }

    private static String getString(Map<String, ?> map, String key) {
        Object value = map.get(key);
        return value != null ? value.toString() : null;
    }

    private static boolean getBoolean(Map<String, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) return false;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
