package com.fontlint.condition.impl;

import com.fontlint.condition.FieldConstraint;
import com.fontlint.condition.RelationType;

import java.util.regex.Pattern;

/**
 * Constraint requiring the pattern to be found somewhere in the attribute ({@code like}).
 * Unanchored: use ^ and $ to match the whole value.
 */
public class LikeConstraint implements FieldConstraint {

    private final Pattern pattern;

    public LikeConstraint(Pattern pattern) {
        this.pattern = pattern;
    }

    @Override
    public boolean test(String actual) {
        return actual != null && pattern.matcher(actual).find();
    }

    @Override
    public RelationType getRelation() {
        return RelationType.LIKE;
    }

    @Override
    public String toString() {
        return "like " + pattern.pattern();
    }
}
