package com.logic.simplifier;

import com.logic.expression.Expression;

/**
 * Applies one bottom-up rewriting pass to an expression.
 * Implementations are pure: the input tree is never modified.
 */
public interface Simplifier {

    /**
     * Simplify the given expression once.
     *
     * @param expression Expression to simplify
     * @return Simplified expression, possibly the same instance
     */
    Expression simplify(Expression expression);
}
