package com.fontlint.filter;

import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Accepts or rejects a single integer (code point or glyph id) by set membership.
 *
 * @param acceptIfMember true for {@code only} filters, false for {@code except} filters
 * @param values         Values the filter is defined over
 */
public record AttributeFilter(boolean acceptIfMember, Set<Integer> values) {

    public AttributeFilter {
        values = Set.copyOf(values);
    }

    /**
     * Filter accepting only members of the set.
     */
    public static AttributeFilter only(Set<Integer> values) {
        return new AttributeFilter(true, values);
    }

    /**
     * Filter accepting everything except members of the set.
     */
    public static AttributeFilter except(Set<Integer> values) {
        return new AttributeFilter(false, values);
    }

    public boolean accept(int value) {
        return acceptIfMember == values.contains(value);
    }

    @Override
    public String toString() {
        String members = new TreeSet<>(values).stream()
                .map(String::valueOf)
                .collect(Collectors.joining(", "));
        return (acceptIfMember ? "only" : "except") + " {" + members + "}";
    }
}
