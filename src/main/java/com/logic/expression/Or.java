package com.logic.expression;

import java.util.Objects;

/**
 * Logical disjunction.
 *
 * @param left  Left operand
 * @param right Right operand
 */
public record Or(Expression left, Expression right) implements Expression {

    public Or {
        Objects.requireNonNull(left, "OR left operand cannot be null");
        Objects.requireNonNull(right, "OR right operand cannot be null");
    }

    @Override
    public ExpressionType type() {
        return ExpressionType.OR;
    }

    @Override
    public String toString() {
        return ExpressionRenderer.render(this);
    }
}
