package com.fontlint.selection;

import com.fontlint.condition.FontCondition;
import com.fontlint.filter.AttributeFilter;
import com.fontlint.font.FontAttributes;
import com.fontlint.tag.TagCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Ordered list of rule blocks built from rule text.
 * <p>
 * Blocks are applied in order and are cumulative: for any tag, the last matching block
 * that mentions it decides whether it runs and with which filter.
 * Append-only while parsing, read-only afterwards.
 */
public class RuleList {

    private static final Logger log = LoggerFactory.getLogger(RuleList.class);

    private final TagCatalog catalog;
    private final List<RuleBlock> blocks;

    public RuleList(TagCatalog catalog) {
        this.catalog = catalog;
        this.blocks = new ArrayList<>();
    }

    /**
     * Append a block. The condition is copied so later parser changes do not leak in.
     */
    public void add(FontCondition condition, TestSelection selection) {
        blocks.add(new RuleBlock(condition.copy(), selection));
    }

    /**
     * Compute the tests to run for a font.
     * Starts from every catalog tag enabled with no filters, then folds each block whose
     * condition accepts the font, in order.
     *
     * @param font Font attributes
     * @return Fresh resolved test set owned by the caller
     */
    public ResolvedTests resolve(FontAttributes font) {
        Set<String> result = new TreeSet<>(catalog.tags());
        Map<String, AttributeFilter> filters = new HashMap<>();

        int applied = 0;
        for (RuleBlock block : blocks) {
            if (block.condition().accepts(font)) {
                block.selection().applyTo(result, filters);
                applied++;
            }
        }

        log.debug("Resolved {} of {} tags for {} ({} of {} blocks applied)",
                result.size(), catalog.size(), font.filename(), applied, blocks.size());
        return new ResolvedTests(catalog, result, filters);
    }

    public List<RuleBlock> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    public int size() {
        return blocks.size();
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    public TagCatalog getCatalog() {
        return catalog;
    }

    @Override
    public String toString() {
        return blocks.stream()
                .map(RuleBlock::toString)
                .collect(Collectors.joining("\nblock:\n", "block:\n", ""));
    }
}
