package com.fontlint.condition;

import com.fontlint.config.RuleSyntax;
import com.fontlint.exception.GrammarException;
import com.fontlint.exception.UnsupportedRelationException;
import com.fontlint.font.FontAttributes;
import com.fontlint.font.FontField;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Conjunction of per-field constraints over font attributes.
 * <p>
 * Each field is either unconstrained, constrained to a literal, or constrained by a
 * relation. A condition with no constraints accepts every font.
 * <p>
 * Mutable only while rule text is being parsed; stored copies are treated as read-only.
 */
public class FontCondition {

    // 1: field, 2: relation or literal, 3: operand
    private static final Pattern LINE = Pattern.compile("(\\S+)\\s+(\\S+)(.*)");

    private final Map<FontField, FieldConstraint> constraints;

    public FontCondition() {
        this.constraints = new EnumMap<>(FontField.class);
    }

    private FontCondition(Map<FontField, FieldConstraint> constraints) {
        this.constraints = new EnumMap<>(FontField.class);
        this.constraints.putAll(constraints);
    }

    /**
     * Change the constraint on one field.
     *
     * @param field             Field name as written in rule text (e.g., "script")
     * @param relationOrLiteral Relation symbol, {@code *} to clear, or the literal value itself
     * @param operand           Operand of the relation, or null when a literal is given
     * @throws GrammarException             if the field is unknown
     * @throws UnsupportedRelationException if the relation is unknown or rejects the operand
     */
    public void modify(String field, String relationOrLiteral, String operand) {
        FontField fontField = FontField.fromKey(field)
                .orElseThrow(() -> new GrammarException("Condition does not recognize field: " + field));

        if (RuleSyntax.WILDCARD.equals(relationOrLiteral)) {
            constraints.remove(fontField);
            return;
        }

        if (operand == null || operand.isBlank()) {
            constraints.put(fontField, ConstraintFactory.literal(relationOrLiteral));
            return;
        }

        RelationType relation = RelationType.fromSymbol(relationOrLiteral)
                .orElseThrow(() -> new UnsupportedRelationException("Unknown relation '"
                        + relationOrLiteral + "' for field " + field));
        constraints.put(fontField, ConstraintFactory.create(relation, operand));
    }

    /**
     * Apply a condition line of the form {@code field relation [operand]}.
     *
     * @throws GrammarException if the line does not have at least two tokens
     */
    public void modifyLine(String line) {
        Matcher m = LINE.matcher(line.trim());
        if (!m.matches()) {
            throw new GrammarException("Condition could not match '" + line + "'");
        }
        String operand = m.group(3).trim();
        modify(m.group(1), m.group(2), operand.isEmpty() ? null : operand);
    }

    /**
     * Test a font against every constrained field.
     */
    public boolean accepts(FontAttributes font) {
        for (Map.Entry<FontField, FieldConstraint> entry : constraints.entrySet()) {
            if (!entry.getValue().test(entry.getKey().valueOf(font))) {
                return false;
            }
        }
        return true;
    }

    public boolean isUnconstrained() {
        return constraints.isEmpty();
    }

    public Map<FontField, FieldConstraint> getConstraints() {
        return Collections.unmodifiableMap(constraints);
    }

    public FontCondition copy() {
        return new FontCondition(constraints);
    }

    @Override
    public String toString() {
        return constraints.entrySet().stream()
                .map(e -> e.getKey().key() + " " + e.getValue())
                .collect(Collectors.joining(", ", "FontCondition(", ")"));
    }
}
