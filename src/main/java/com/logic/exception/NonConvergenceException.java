package com.logic.exception;

import com.logic.expression.Expression;

/**
 * Exception thrown when simplification has not reached a fixed point within the
 * configured iteration cap and the policy asks to fail.
 */
public class NonConvergenceException extends LogicException {

    private final transient Expression lastExpression;
    private final int iterations;

    public NonConvergenceException(Expression lastExpression, int iterations) {
        super("Simplification did not converge after " + iterations
                + " iterations, last result: " + lastExpression);
        this.lastExpression = lastExpression;
        this.iterations = iterations;
    }

    public Expression getLastExpression() {
        return lastExpression;
    }

    public int getIterations() {
        return iterations;
    }
}
