package com.fontlint.condition;

/**
 * Constraint on a single font attribute value.
 * Implementations are immutable.
 */
public interface FieldConstraint {

    /**
     * Test an attribute value.
     *
     * @param actual Attribute value from the font, may be null
     * @return true if the value satisfies the constraint; a null value never does
     */
    boolean test(String actual);

    /**
     * Relation applied, or null for a plain literal match.
     */
    RelationType getRelation();
}
