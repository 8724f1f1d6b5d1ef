package com.logic.simplifier;

import com.logic.expression.Expression;

/**
 * Result of driving simplification towards a fixed point.
 *
 * @param expression Final expression (best effort when not converged)
 * @param iterations Number of simplification passes performed
 * @param converged  Whether the rendering stopped changing within the iteration cap
 */
public record SimplificationResult(Expression expression, int iterations, boolean converged) {

    public static SimplificationResult converged(Expression expression, int iterations) {
        return new SimplificationResult(expression, iterations, true);
    }

    public static SimplificationResult exhausted(Expression expression, int iterations) {
        return new SimplificationResult(expression, iterations, false);
    }
}
