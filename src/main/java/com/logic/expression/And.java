package com.logic.expression;

import java.util.Objects;

/**
 * Logical conjunction.
 *
 * @param left  Left operand
 * @param right Right operand
 */
public record And(Expression left, Expression right) implements Expression {

    public And {
        Objects.requireNonNull(left, "AND left operand cannot be null");
        Objects.requireNonNull(right, "AND right operand cannot be null");
    }

    @Override
    public ExpressionType type() {
        return ExpressionType.AND;
    }

    @Override
    public String toString() {
        return ExpressionRenderer.render(this);
    }
}
