package com.fontlint.condition;

import com.fontlint.condition.impl.ComparisonConstraint;
import com.fontlint.condition.impl.InConstraint;
import com.fontlint.condition.impl.IsConstraint;
import com.fontlint.condition.impl.LikeConstraint;
import com.fontlint.condition.impl.LiteralConstraint;
import com.fontlint.config.RuleSyntax;
import com.fontlint.exception.GrammarException;
import com.fontlint.exception.UnsupportedRelationException;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Creates FieldConstraint instances from rule text.
 */
public final class ConstraintFactory {

    private ConstraintFactory() {
    }

    public static FieldConstraint literal(String value) {
        return new LiteralConstraint(RuleSyntax.unquote(value));
    }

    /**
     * Create a relational constraint.
     *
     * @param type    Relation
     * @param operand Operand text as written after the relation
     * @throws UnsupportedRelationException if an ordering relation gets a non-numeric operand
     * @throws GrammarException             if a {@code like} pattern does not compile
     */
    public static FieldConstraint create(RelationType type, String operand) {
        String text = operand.trim();

        return switch (type) {
            case LESS_THAN, LESS_THAN_OR_EQUALS, EQUALS, NOT_EQUALS,
                    GREATER_THAN_OR_EQUALS, GREATER_THAN -> createComparison(type, RuleSyntax.unquote(text));
            case IS -> new IsConstraint(RuleSyntax.unquote(text));
            // quotes belong to the individual alternatives
            case IN -> new InConstraint(splitAlternatives(text));
            case LIKE -> createLike(RuleSyntax.unquote(text));
        };
    }

    private static FieldConstraint createComparison(RelationType type, String value) {
        try {
            return new ComparisonConstraint(type, value);
        } catch (IllegalArgumentException e) {
            throw new UnsupportedRelationException(e.getMessage(), e);
        }
    }

    private static Set<String> splitAlternatives(String value) {
        Set<String> alternatives = new LinkedHashSet<>();
        for (String item : value.split(String.valueOf(RuleSyntax.LIST_SEPARATOR))) {
            alternatives.add(RuleSyntax.unquote(item.trim()));
        }
        return alternatives;
    }

    private static FieldConstraint createLike(String value) {
        try {
            return new LikeConstraint(Pattern.compile(value));
        } catch (PatternSyntaxException e) {
            throw new GrammarException("Invalid like pattern '" + value + "': " + e.getDescription(), e);
        }
    }
}
