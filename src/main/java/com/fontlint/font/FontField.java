package com.fontlint.font;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Font attributes that a rule condition can constrain.
 * Monospace is carried by {@link FontAttributes} but is not addressable from rules.
 */
public enum FontField {
    FILENAME("filename", FontAttributes::filename),
    NAME("name", FontAttributes::name),
    STYLE("style", FontAttributes::style),
    SCRIPT("script", FontAttributes::script),
    VARIANT("variant", FontAttributes::variant),
    WEIGHT("weight", FontAttributes::weight),
    HINTED("hinted", font -> String.valueOf(font.hinted())),
    VENDOR("vendor", FontAttributes::vendor),
    VERSION("version", FontAttributes::version);

    private static final Map<String, FontField> BY_KEY = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(FontField::key, Function.identity()));

    private final String key;
    private final Function<FontAttributes, String> accessor;

    FontField(String key, Function<FontAttributes, String> accessor) {
        this.key = key;
        this.accessor = accessor;
    }

    /**
     * Field name as written in rule text.
     */
    public String key() {
        return key;
    }

    /**
     * Read this field from a font; null when the font does not carry the value.
     */
    public String valueOf(FontAttributes font) {
        return accessor.apply(font);
    }

    public static Optional<FontField> fromKey(String key) {
        return Optional.ofNullable(BY_KEY.get(key));
    }
}
