package com.fontlint.engine;

import com.fontlint.font.FontAttributes;
import com.fontlint.selection.ResolvedTests;
import com.fontlint.selection.RuleList;
import com.fontlint.tag.TagCatalog;

/**
 * Decides which lint tests run for a font, and with which filters.
 * Called once per font before its checks run.
 */
public interface FontLintEngine {

    /**
     * Resolve the rules for a font.
     *
     * @param font Font attributes
     * @return A new resolved test set, owned by the caller
     */
    ResolvedTests resolve(FontAttributes font);

    /**
     * Replace the rules with ones parsed from text. On a parse error the current rules stay.
     *
     * @param ruleText Rule text
     */
    void reload(String ruleText);

    RuleList getRules();

    TagCatalog getCatalog();
}
