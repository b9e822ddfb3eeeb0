package com.fontlint.config;

import com.fontlint.condition.FontCondition;
import com.fontlint.exception.ConfigurationException;
import com.fontlint.exception.GrammarException;
import com.fontlint.selection.RuleList;
import com.fontlint.selection.TestSelection;
import com.fontlint.tag.TagCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses rule text into a {@link RuleList}.
 * <p>
 * Rule text is a sequence of statements separated by newlines and/or {@code ;}.
 * {@code #} starts a comment running to the end of the line. Example:
 * <pre>
 * disable reachable
 * condition
 * vendor == "Foo"; enable name/version
 * condition
 * script Deva; disable name
 * enable cmap/script_required except cp 41-5A
 * </pre>
 * Field constraints accumulate into the current condition. Once a block has enable or
 * disable directives, the next field constraint starts a new block that keeps the
 * constraints so far; {@code condition} starts a new block with an empty condition.
 */
public class RuleParser {

    private static final Logger log = LoggerFactory.getLogger(RuleParser.class);

    private final TagCatalog catalog;

    public RuleParser(TagCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Parser over the built-in tag catalog.
     */
    public static RuleParser withDefaultCatalog() {
        return new RuleParser(TagCatalog.defaultCatalog());
    }

    /**
     * Parse rule text into a new rule list.
     *
     * @param text Rule text, may be null or empty (no rules)
     * @return Parsed rule list
     * @throws ConfigurationException on any malformed statement, with its line number
     */
    public RuleList parse(String text) {
        return parse(text, new RuleList(catalog));
    }

    /**
     * Parse rule text and append its blocks to an existing rule list, so that several
     * rule files can be layered in order.
     */
    public RuleList parse(String text, RuleList rules) {
        if (rules.getCatalog() != catalog) {
            throw new IllegalArgumentException("Rule list was built over a different tag catalog");
        }
        if (text == null || text.isBlank()) {
            return rules;
        }

        State state = new State(rules);
        int lineNumber = 0;
        for (String line : text.split("\\R")) {
            lineNumber++;
            int commentStart = line.indexOf(RuleSyntax.COMMENT);
            if (commentStart >= 0) {
                line = line.substring(0, commentStart);
            }
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }

            for (String segment : line.split(String.valueOf(RuleSyntax.SEGMENT_SEPARATOR))) {
                segment = segment.trim();
                if (segment.isEmpty()) {
                    continue;
                }
                try {
                    state.apply(segment);
                } catch (ConfigurationException e) {
                    throw e.withLocation("line " + lineNumber + " '" + segment + "'");
                }
            }
        }
        state.flush();

        log.debug("Parsed {} rule lines into {} blocks", lineNumber, rules.size());
        return rules;
    }

    /** Accumulation of the block being parsed. */
    private final class State {
        private final RuleList rules;
        private FontCondition condition = new FontCondition();
        private TestSelection selection = new TestSelection(catalog);
        private boolean pendingSelectionStarted;

        State(RuleList rules) {
            this.rules = rules;
        }

        void apply(String segment) {
            switch (SegmentType.of(segment)) {
                case CONDITION -> {
                    flush();
                    condition = new FontCondition();
                }
                case ENABLE -> {
                    for (String clause : listOf(segment, RuleSyntax.ENABLE)) {
                        selection.enableClause(clause);
                    }
                    pendingSelectionStarted = true;
                }
                case DISABLE -> {
                    for (String tag : listOf(segment, RuleSyntax.DISABLE)) {
                        selection.disable(tag);
                    }
                    pendingSelectionStarted = true;
                }
                case FIELD -> {
                    flush();
                    condition.modifyLine(segment);
                }
            }
        }

        /**
         * Store the current block if it has directives. The condition is kept so that
         * following field constraints refine it.
         */
        void flush() {
            if (!pendingSelectionStarted) {
                return;
            }
            rules.add(condition, selection);
            log.debug("Rule block {}: {} -> {} touched, {} enabled", rules.size(), condition,
                    selection.getTouchedTags().size(), selection.getEnabledTags().size());
            selection = new TestSelection(catalog);
            pendingSelectionStarted = false;
        }

        private String[] listOf(String segment, String keyword) {
            String[] items = segment.substring(keyword.length()).split(
                    String.valueOf(RuleSyntax.LIST_SEPARATOR), -1);
            for (int i = 0; i < items.length; i++) {
                items[i] = items[i].trim();
                if (items[i].isEmpty()) {
                    throw new GrammarException("Empty tag in " + keyword + " list");
                }
            }
            return items;
        }
    }
}
