package com.fontlint.selection;

import com.fontlint.exception.UnknownTagException;
import com.fontlint.filter.AttributeFilter;
import com.fontlint.tag.TagCatalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Tests resolved for one font, queried by the checks as they run.
 * <p>
 * Records which tags were queried and ran, and which were queried and skipped, for
 * reporting after a validation pass. Not thread-safe: each font gets its own instance.
 */
public class ResolvedTests {

    private final TagCatalog catalog;
    private final Set<String> enabledTags;
    private final Map<String, AttributeFilter> filters;
    private final Set<String> runLog;
    private final Set<String> skipLog;

    public ResolvedTests(TagCatalog catalog, Set<String> enabledTags, Map<String, AttributeFilter> filters) {
        this.catalog = catalog;
        this.enabledTags = Collections.unmodifiableSet(new TreeSet<>(enabledTags));
        this.filters = Collections.unmodifiableMap(new TreeMap<>(filters));
        this.runLog = new TreeSet<>();
        this.skipLog = new TreeSet<>();
    }

    /**
     * Whether the test for a tag should run, recording the outcome.
     *
     * @throws UnknownTagException if the tag is not in the catalog
     */
    public boolean check(String tag) {
        requireKnown(tag);
        boolean run = enabledTags.contains(tag);
        if (run) {
            runLog.add(tag);
        } else {
            skipLog.add(tag);
        }
        return run;
    }

    /**
     * Whether the test for a tag should run on a particular code point or glyph id.
     * The tag must be enabled and its filter, if any, must accept the value.
     */
    public boolean checkValue(String tag, int value) {
        boolean run = check(tag);
        if (run) {
            AttributeFilter filter = filters.get(tag);
            if (filter != null) {
                run = filter.accept(value);
            }
        }
        return run;
    }

    /**
     * Filter configured for a tag, or null if none.
     */
    public AttributeFilter getFilter(String tag) {
        requireKnown(tag);
        return filters.get(tag);
    }

    public Set<String> getEnabledTags() {
        return enabledTags;
    }

    public Map<String, AttributeFilter> getFilters() {
        return filters;
    }

    public Set<String> runLog() {
        return Collections.unmodifiableSet(runLog);
    }

    public Set<String> skipLog() {
        return Collections.unmodifiableSet(skipLog);
    }

    private void requireKnown(String tag) {
        if (!catalog.contains(tag)) {
            throw new UnknownTagException("Unrecognized tag " + tag);
        }
    }

    @Override
    public String toString() {
        List<String> lines = new ArrayList<>();
        if (runLog.isEmpty() && skipLog.isEmpty()) {
            for (String tag : enabledTags) {
                AttributeFilter filter = filters.get(tag);
                lines.add(filter == null ? tag : tag + " " + filter);
            }
        }
        if (!runLog.isEmpty()) {
            lines.add("run:");
            runLog.forEach(tag -> lines.add("  " + tag));
        }
        if (!skipLog.isEmpty()) {
            lines.add("skipped:");
            skipLog.forEach(tag -> lines.add("  " + tag));
        }
        return String.join("\n", lines);
    }
}
