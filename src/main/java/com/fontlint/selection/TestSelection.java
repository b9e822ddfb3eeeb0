package com.fontlint.selection;

import com.fontlint.config.RuleSyntax;
import com.fontlint.exception.ArgTypeMismatchException;
import com.fontlint.exception.GrammarException;
import com.fontlint.exception.MultiTagFilterException;
import com.fontlint.exception.UnsupportedRelationException;
import com.fontlint.filter.AttributeFilter;
import com.fontlint.filter.IntegerSetParser;
import com.fontlint.tag.TagCatalog;
import com.fontlint.tag.TagInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tests enabled and disabled by one rule block.
 * <p>
 * Touched tags are all tags the block mentions; enabled tags are the touched tags whose
 * net effect is "run". A touched tag that is not enabled is explicitly disabled.
 * Within a block the last directive for a tag wins.
 */
public class TestSelection {

    // 1: optional quote, 2: tag, 3: relation, 4: arg type, 5: values
    private static final Pattern ENABLE_CLAUSE = Pattern.compile(
            "\\s*([\"']?)([0-9a-z/_]+)\\1(?:\\s+(except|only)\\s+(cp|gid)(?:\\s+(.*?))?)?\\s*");

    private final TagCatalog catalog;
    private final Set<String> touchedTags;
    private final Set<String> enabledTags;
    private final Map<String, AttributeFilter> filters;

    public TestSelection(TagCatalog catalog) {
        this.catalog = catalog;
        this.touchedTags = new TreeSet<>();
        this.enabledTags = new TreeSet<>();
        this.filters = new HashMap<>();
    }

    /**
     * Enable a tag and its subtree, without a filter.
     */
    public void enable(String tag) {
        enable(tag, null, null, null);
    }

    /**
     * Enable a tag and its subtree, optionally attaching a filter to a single tag.
     *
     * @param tag      Full or partial tag
     * @param relation {@code except} or {@code only}, or null for no filter
     * @param argType  {@code cp} (hex code points) or {@code gid} (decimal glyph ids)
     * @param arg      Values and ranges, e.g. "41-5A 2010"
     * @throws MultiTagFilterException       if a filter is given and the tag covers several tags
     * @throws UnsupportedRelationException  if the tag does not allow the relation
     * @throws ArgTypeMismatchException      if the tag does not allow the argument type
     */
    public void enable(String tag, String relation, String argType, String arg) {
        Set<String> tags = catalog.resolveTagSet(RuleSyntax.unquote(tag.trim()));

        AttributeFilter filter = null;
        if (relation != null) {
            if (tags.size() > 1) {
                throw new MultiTagFilterException("Filter '" + relation + " " + argType
                        + "' cannot be applied to tag '" + tag + "' covering " + tags.size() + " tags");
            }
            filter = createFilter(catalog.info(tags.iterator().next()), relation, argType, arg);
        }

        touchedTags.addAll(tags);
        enabledTags.addAll(tags);
        for (String t : tags) {
            if (filter != null) {
                filters.put(t, filter);
            } else {
                filters.remove(t);
            }
        }
    }

    /**
     * Enable from a clause of the form {@code tag [(except|only) (cp|gid) values]}.
     *
     * @throws GrammarException if the clause cannot be parsed
     */
    public void enableClause(String clause) {
        Matcher m = ENABLE_CLAUSE.matcher(clause);
        if (!m.matches()) {
            throw new GrammarException("Could not parse enable clause '" + clause.trim() + "'");
        }
        String arg = m.group(5) == null ? null : RuleSyntax.unquote(m.group(5));
        enable(m.group(2), m.group(3), m.group(4), arg);
    }

    /**
     * Disable a tag and its subtree.
     */
    public void disable(String tag) {
        Set<String> tags = catalog.resolveTagSet(RuleSyntax.unquote(tag.trim()));
        touchedTags.addAll(tags);
        enabledTags.removeAll(tags);
        tags.forEach(filters::remove);
    }

    private AttributeFilter createFilter(TagInfo info, String relation, String argType, String arg) {
        if (!info.allowsFilter()) {
            throw new UnsupportedRelationException("Tag " + info.path() + " does not allow options");
        }
        if (!info.allowsRelation(relation)) {
            throw new UnsupportedRelationException("Tag " + info.path()
                    + " does not allow relation " + relation);
        }
        if (!info.allowsArgType(argType)) {
            throw new ArgTypeMismatchException("Tag " + info.path() + " and relation " + relation
                    + " does not allow arg type " + argType);
        }

        Set<Integer> values = switch (argType) {
            case RuleSyntax.ARG_CODE_POINT -> IntegerSetParser.parse(arg, true, IntegerSetParser.MAX_CODE_POINT);
            case RuleSyntax.ARG_GLYPH_ID -> IntegerSetParser.parse(arg, false, IntegerSetParser.MAX_GLYPH_ID);
            default -> throw new ArgTypeMismatchException("Unable to handle arg type " + argType
                    + " for tag " + info.path());
        };
        return RuleSyntax.EXCEPT.equals(relation)
                ? AttributeFilter.except(values)
                : AttributeFilter.only(values);
    }

    /**
     * Fold this selection onto a running result: touched tags are removed, then enabled
     * tags are added back; filters of touched tags are replaced by this block's filters.
     *
     * @param result  Enabled tags so far (mutated)
     * @param options Filters so far (mutated)
     */
    public void applyTo(Set<String> result, Map<String, AttributeFilter> options) {
        result.removeAll(touchedTags);
        result.addAll(enabledTags);
        touchedTags.forEach(options::remove);
        for (String tag : enabledTags) {
            AttributeFilter filter = filters.get(tag);
            if (filter != null) {
                options.put(tag, filter);
            }
        }
    }

    public boolean isEmpty() {
        return touchedTags.isEmpty();
    }

    public Set<String> getTouchedTags() {
        return Collections.unmodifiableSet(touchedTags);
    }

    public Set<String> getEnabledTags() {
        return Collections.unmodifiableSet(enabledTags);
    }

    public Set<String> getDisabledTags() {
        Set<String> disabled = new TreeSet<>(touchedTags);
        disabled.removeAll(enabledTags);
        return Collections.unmodifiableSet(disabled);
    }

    public Map<String, AttributeFilter> getFilters() {
        return Collections.unmodifiableMap(filters);
    }

    public TagCatalog getCatalog() {
        return catalog;
    }

    @Override
    public String toString() {
        List<String> lines = new ArrayList<>();
        if (!enabledTags.isEmpty()) {
            lines.add("enable:");
            for (String tag : enabledTags) {
                AttributeFilter filter = filters.get(tag);
                lines.add(filter == null ? tag : tag + " " + filter);
            }
        }
        Set<String> disabled = getDisabledTags();
        if (!disabled.isEmpty()) {
            lines.add("disable:");
            lines.addAll(disabled);
        }
        return String.join("\n", lines);
    }
}
