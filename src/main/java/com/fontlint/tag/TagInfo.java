package com.fontlint.tag;

import java.util.regex.Pattern;

/**
 * Catalog entry for one test tag.
 *
 * @param path            Full slash separated tag path (e.g., "cmap/tables/missing")
 * @param relationPattern Regex of relation words the tag accepts (e.g., "except|only"), or null
 * @param argTypePattern  Regex of argument types the tag accepts (e.g., "cp|gid"), or null
 * @param comment         Human readable description, or null
 */
public record TagInfo(
        String path,
        String relationPattern,
        String argTypePattern,
        String comment
) {
    /**
     * Whether the tag declares a filter signature (relation and argument type).
     */
    public boolean allowsFilter() {
        return relationPattern != null && argTypePattern != null;
    }

    public boolean allowsRelation(String relation) {
        return relationPattern != null && relation != null
                && Pattern.matches(relationPattern, relation);
    }

    public boolean allowsArgType(String argType) {
        return argTypePattern != null && argType != null
                && Pattern.matches(argTypePattern, argType);
    }

    /**
     * Filter signature as written in the catalog, e.g. "except|only cp|gid".
     */
    public String signature() {
        return allowsFilter() ? relationPattern + " " + argTypePattern : null;
    }

    /**
     * Last path segment.
     */
    public String name() {
        int ix = path.lastIndexOf(TagCatalog.PATH_SEPARATOR);
        return ix < 0 ? path : path.substring(ix + 1);
    }
}
