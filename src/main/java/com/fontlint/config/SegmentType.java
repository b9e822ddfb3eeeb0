package com.fontlint.config;

/**
 * Kinds of {@code ;}-separated segments in rule text.
 */
public enum SegmentType {
    /** {@code condition}: start a new block with an empty condition. */
    CONDITION,
    /** {@code enable tag[, tag ...]}, each tag optionally with a filter clause. */
    ENABLE,
    /** {@code disable tag[, tag ...]}. */
    DISABLE,
    /** {@code field relation [operand]} or {@code field literal}: constrain the condition. */
    FIELD;

    /**
     * Classify a trimmed, non-empty segment.
     */
    public static SegmentType of(String segment) {
        if (segment.equals(RuleSyntax.CONDITION)) {
            return CONDITION;
        }
        if (startsWithKeyword(segment, RuleSyntax.ENABLE)) {
            return ENABLE;
        }
        if (startsWithKeyword(segment, RuleSyntax.DISABLE)) {
            return DISABLE;
        }
        return FIELD;
    }

    private static boolean startsWithKeyword(String segment, String keyword) {
        return segment.length() > keyword.length()
                && segment.startsWith(keyword)
                && Character.isWhitespace(segment.charAt(keyword.length()));
    }
}
