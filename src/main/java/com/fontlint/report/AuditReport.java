package com.fontlint.report;

import com.fontlint.filter.AttributeFilter;
import com.fontlint.font.FontAttributes;
import com.fontlint.selection.ResolvedTests;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializable view of the tests resolved for one font.
 *
 * @param font     Font the tests were resolved for
 * @param enabled  Enabled tags, sorted
 * @param disabled Catalog tags not enabled, sorted
 * @param filters  Filter description per filtered tag
 * @param run      Tags checked and run
 * @param skipped  Tags checked and skipped
 */
public record AuditReport(
        FontAttributes font,
        List<String> enabled,
        List<String> disabled,
        Map<String, String> filters,
        List<String> run,
        List<String> skipped
) {

    public static AuditReport of(FontAttributes font, ResolvedTests tests, Iterable<String> catalogTags) {
        List<String> disabled = new ArrayList<>();
        for (String tag : catalogTags) {
            if (!tests.getEnabledTags().contains(tag)) {
                disabled.add(tag);
            }
        }

        Map<String, String> filters = new LinkedHashMap<>();
        for (Map.Entry<String, AttributeFilter> entry : tests.getFilters().entrySet()) {
            filters.put(entry.getKey(), entry.getValue().toString());
        }

        return new AuditReport(
                font,
                List.copyOf(tests.getEnabledTags()),
                disabled,
                filters,
                List.copyOf(tests.runLog()),
                List.copyOf(tests.skipLog()));
    }
}
