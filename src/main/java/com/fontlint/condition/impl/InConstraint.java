package com.fontlint.condition.impl;

import com.fontlint.condition.FieldConstraint;
import com.fontlint.condition.RelationType;

import java.util.Set;
import java.util.TreeSet;

/**
 * Constraint requiring the attribute to be one of a set of alternatives ({@code in}).
 */
public class InConstraint implements FieldConstraint {

    private final Set<String> allowedValues;

    public InConstraint(Set<String> allowedValues) {
        this.allowedValues = Set.copyOf(allowedValues);
    }

    @Override
    public boolean test(String actual) {
        return actual != null && allowedValues.contains(actual);
    }

    @Override
    public RelationType getRelation() {
        return RelationType.IN;
    }

    @Override
    public String toString() {
        return "in " + String.join(",", new TreeSet<>(allowedValues));
    }
}
