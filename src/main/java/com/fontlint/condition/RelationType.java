package com.fontlint.condition;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Relations a condition field can apply to a font attribute.
 */
public enum RelationType {
    // Numeric, both sides read as floating point
    LESS_THAN("<"),
    LESS_THAN_OR_EQUALS("<="),
    EQUALS("=="),
    NOT_EQUALS("!="),
    GREATER_THAN_OR_EQUALS(">="),
    GREATER_THAN(">"),

    // String
    IS("is"),
    IN("in"),
    LIKE("like");

    private static final Map<String, RelationType> BY_SYMBOL = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(RelationType::symbol, Function.identity()));

    private final String symbol;

    RelationType(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Relation as written in rule text.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Whether the relation orders values (and so needs a numeric operand).
     */
    public boolean isOrdering() {
        return switch (this) {
            case LESS_THAN, LESS_THAN_OR_EQUALS, GREATER_THAN_OR_EQUALS, GREATER_THAN -> true;
            default -> false;
        };
    }

    public boolean isNumeric() {
        return isOrdering() || this == EQUALS || this == NOT_EQUALS;
    }

    public static Optional<RelationType> fromSymbol(String symbol) {
        return Optional.ofNullable(BY_SYMBOL.get(symbol));
    }
}
