package com.fontlint.config;

/**
 * Keywords and delimiters of the rule text.
 */
public final class RuleSyntax {

    private RuleSyntax() {
    }

    public static final String CONDITION = "condition";
    public static final String ENABLE = "enable";
    public static final String DISABLE = "disable";

    /** Relation word clearing a condition field. */
    public static final String WILDCARD = "*";

    public static final char COMMENT = '#';
    public static final char SEGMENT_SEPARATOR = ';';
    public static final char LIST_SEPARATOR = ',';
    public static final char QUOTE_DOUBLE = '"';
    public static final char QUOTE_SINGLE = '\'';

    /** Relation word for filters accepting everything outside the set. */
    public static final String EXCEPT = "except";
    /** Relation word for filters accepting only the set. */
    public static final String ONLY = "only";
    /** Argument type: hex code points. */
    public static final String ARG_CODE_POINT = "cp";
    /** Argument type: decimal glyph ids. */
    public static final String ARG_GLYPH_ID = "gid";

    /**
     * Strip one pair of matching surrounding quotes, if present.
     */
    public static String unquote(String text) {
        if (text == null || text.length() < 2) {
            return text;
        }
        char first = text.charAt(0);
        char last = text.charAt(text.length() - 1);
        if ((first == QUOTE_DOUBLE || first == QUOTE_SINGLE) && first == last) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }
}
