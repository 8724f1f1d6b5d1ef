package com.logic.expression;

/**
 * A propositional logic expression.
 * <p>
 * The set of variants is closed: {@link Variable}, {@link Constant}, {@link Not},
 * {@link And} and {@link Or}. Every variant is an immutable record, so equality is
 * structural and positional: {@code And(A, B)} equals {@code And(A, B)} built
 * independently, but not {@code And(B, A)}.
 * <p>
 * Operations over expressions switch on {@link #type()}; switch expressions over the
 * enum fail to compile when a variant is left out.
 */
public sealed interface Expression permits Variable, Constant, Not, And, Or {

    /**
     * Get the expression variant.
     */
    ExpressionType type();

    /**
     * Whether this is the constant {@code True}.
     */
    default boolean isTrue() {
        return this instanceof Constant constant && constant.value();
    }

    /**
     * Whether this is the constant {@code False}.
     */
    default boolean isFalse() {
        return this instanceof Constant constant && !constant.value();
    }

    static Variable variable(String name) {
        return new Variable(name);
    }

    static Constant constant(boolean value) {
        return Constant.of(value);
    }

    static Not not(Expression operand) {
        return new Not(operand);
    }

    static And and(Expression left, Expression right) {
        return new And(left, right);
    }

    static Or or(Expression left, Expression right) {
        return new Or(left, right);
    }
}
