package com.logic.expression;

import java.util.Objects;

/**
 * Logical negation.
 *
 * @param operand Negated expression
 */
public record Not(Expression operand) implements Expression {

    public Not {
        Objects.requireNonNull(operand, "NOT operand cannot be null");
    }

    @Override
    public ExpressionType type() {
        return ExpressionType.NOT;
    }

    @Override
    public String toString() {
        return ExpressionRenderer.render(this);
    }
}
