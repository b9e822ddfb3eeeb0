package com.fontlint.selection;

import com.fontlint.condition.FontCondition;

/**
 * One condition block of a rule list: the selection applies to fonts the condition accepts.
 *
 * @param condition Font condition (read-only once stored)
 * @param selection Tests enabled and disabled by the block
 */
public record RuleBlock(FontCondition condition, TestSelection selection) {

    @Override
    public String toString() {
        return condition + "\n" + selection;
    }
}
