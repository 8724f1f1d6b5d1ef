package com.logic.expression;

/**
 * Variants of a propositional logic expression.
 */
public enum ExpressionType {
    // Leaves
    VARIABLE,
    CONSTANT,

    // Logical
    NOT,
    AND,
    OR
}
