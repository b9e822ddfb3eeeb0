package com.fontlint.engine;

import com.fontlint.config.RuleParser;
import com.fontlint.font.FontAttributes;
import com.fontlint.selection.ResolvedTests;
import com.fontlint.selection.RuleList;
import com.fontlint.tag.TagCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default implementation of FontLintEngine.
 * Rules are swapped atomically on reload; resolutions in flight keep the rules they started with.
 */
public class DefaultFontLintEngine implements FontLintEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultFontLintEngine.class);

    private volatile RuleList rules;

    public DefaultFontLintEngine(RuleList rules) {
        this.rules = rules;
        log.info("FontLintEngine initialized with {} rule blocks over {} tags",
                rules.size(), rules.getCatalog().size());
    }

    /**
     * Engine with no rules: every test runs.
     */
    public static DefaultFontLintEngine unconfigured() {
        return new DefaultFontLintEngine(new RuleList(TagCatalog.defaultCatalog()));
    }

    @Override
    public ResolvedTests resolve(FontAttributes font) {
        log.debug("Resolving lint tests for: {}", font.filename());
        return rules.resolve(font);
    }

    @Override
    public void reload(String ruleText) {
        RuleList current = rules;
        RuleList reloaded = new RuleParser(current.getCatalog()).parse(ruleText);
        updateRules(reloaded);
    }

    /**
     * Update the rules (used for hot reload).
     */
    public void updateRules(RuleList newRules) {
        this.rules = newRules;
        log.info("FontLintEngine rules updated: {} rule blocks", newRules.size());
    }

    @Override
    public RuleList getRules() {
        return rules;
    }

    @Override
    public TagCatalog getCatalog() {
        return rules.getCatalog();
    }
}
