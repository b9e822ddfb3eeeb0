package com.fontlint.condition.impl;

import com.fontlint.condition.FieldConstraint;
import com.fontlint.condition.RelationType;

/**
 * Numeric comparison ({@code < <= == != >= >}).
 * <p>
 * Both sides are read as floating point, so versions compare numerically ("1.10" > "1.9"
 * is false, "2.0" == "2" is true). Equality relations fall back to string comparison when
 * either side is not a number; ordering relations are false for a non-numeric attribute.
 */
public class ComparisonConstraint implements FieldConstraint {

    private final RelationType type;
    private final String operand;
    private final Double threshold;

    public ComparisonConstraint(RelationType type, String operand) {
        if (!type.isNumeric()) {
            throw new IllegalArgumentException("Not a comparison relation: " + type);
        }
        this.type = type;
        this.operand = operand;
        this.threshold = toDouble(operand);
        if (threshold == null && type.isOrdering()) {
            throw new IllegalArgumentException("Relation " + type.symbol()
                    + " requires a numeric operand, got '" + operand + "'");
        }
    }

    @Override
    public boolean test(String actual) {
        if (actual == null) {
            return false; // Missing attribute = condition is false
        }

        Double actualValue = toDouble(actual);
        if (actualValue == null || threshold == null) {
            return switch (type) {
                case EQUALS -> actual.equals(operand);
                case NOT_EQUALS -> !actual.equals(operand);
                default -> false;
            };
        }

        double lhs = actualValue;
        double rhs = threshold;
        return switch (type) {
            case LESS_THAN -> lhs < rhs;
            case LESS_THAN_OR_EQUALS -> lhs <= rhs;
            case EQUALS -> lhs == rhs;
            case NOT_EQUALS -> lhs != rhs;
            case GREATER_THAN_OR_EQUALS -> lhs >= rhs;
            case GREATER_THAN -> lhs > rhs;
            default -> throw new IllegalStateException("Invalid comparison type: " + type);
        };
    }

    @Override
    public RelationType getRelation() {
        return type;
    }

    private static Double toDouble(String text) {
        try {
            return Double.valueOf(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return type.symbol() + " " + operand;
    }
}
