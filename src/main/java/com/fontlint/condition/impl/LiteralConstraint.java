package com.fontlint.condition.impl;

import com.fontlint.condition.FieldConstraint;
import com.fontlint.condition.RelationType;

/**
 * Constraint requiring the attribute to equal a literal exactly.
 * Written in rule text as {@code field value}.
 */
public class LiteralConstraint implements FieldConstraint {

    private final String expected;

    public LiteralConstraint(String expected) {
        this.expected = expected;
    }

    @Override
    public boolean test(String actual) {
        return expected.equals(actual);
    }

    @Override
    public RelationType getRelation() {
        return null;
    }

    @Override
    public String toString() {
        return expected;
    }
}
