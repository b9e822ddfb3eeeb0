package com.fontlint.condition.impl;

import com.fontlint.condition.FieldConstraint;
import com.fontlint.condition.RelationType;

/**
 * Constraint requiring exact string equality ({@code is}).
 */
public class IsConstraint implements FieldConstraint {

    private final String expected;

    public IsConstraint(String expected) {
        this.expected = expected;
    }

    @Override
    public boolean test(String actual) {
        return expected.equals(actual);
    }

    @Override
    public RelationType getRelation() {
        return RelationType.IS;
    }

    @Override
    public String toString() {
        return "is " + expected;
    }
}
