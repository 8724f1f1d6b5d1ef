package com.logic.expression;

/**
 * A boolean constant.
 *
 * @param value Constant value
 */
public record Constant(boolean value) implements Expression {

    public static final Constant TRUE = new Constant(true);
    public static final Constant FALSE = new Constant(false);

    public static Constant of(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * Get the negated constant.
     */
    public Constant negate() {
        return of(!value);
    }

    @Override
    public ExpressionType type() {
        return ExpressionType.CONSTANT;
    }

    @Override
    public String toString() {
        return ExpressionRenderer.render(this);
    }
}
