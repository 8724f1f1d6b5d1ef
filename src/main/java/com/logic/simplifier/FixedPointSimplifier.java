package com.logic.simplifier;

import com.logic.exception.NonConvergenceException;
import com.logic.expression.Expression;
import com.logic.expression.ExpressionRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Repeats simplification passes until the rendered text stops changing.
 * <p>
 * Rendered text rather than structural equality decides convergence. At most
 * {@code maxIterations} passes run; on exhaustion the last computed expression is
 * returned and the {@link NonConvergencePolicy} decides whether that is silent,
 * logged or an error.
 */
public class FixedPointSimplifier {

    private static final Logger log = LoggerFactory.getLogger(FixedPointSimplifier.class);

    public static final int DEFAULT_MAX_ITERATIONS = 10;

    private final Simplifier simplifier;
    private final int maxIterations;
    private final NonConvergencePolicy nonConvergencePolicy;

    public FixedPointSimplifier() {
        this(RuleBasedSimplifier.INSTANCE, DEFAULT_MAX_ITERATIONS, NonConvergencePolicy.WARN);
    }

    public FixedPointSimplifier(Simplifier simplifier, int maxIterations,
                                NonConvergencePolicy nonConvergencePolicy) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
        this.simplifier = simplifier;
        this.maxIterations = maxIterations;
        this.nonConvergencePolicy = nonConvergencePolicy;
    }

    /**
     * Simplify until a fixed point or the iteration cap.
     *
     * @param expression Expression to simplify
     * @return Result with the final expression and convergence details
     * @throws NonConvergenceException if the cap is hit and the policy is FAIL
     */
    public SimplificationResult run(Expression expression) {
        Expression current = expression;
        String currentText = ExpressionRenderer.render(current);

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            Expression next = simplifier.simplify(current);
            String nextText = ExpressionRenderer.render(next);
            log.debug("Pass {}: {} -> {}", iteration, currentText, nextText);

            if (nextText.equals(currentText)) {
                return SimplificationResult.converged(next, iteration);
            }
            current = next;
            currentText = nextText;
        }

        return onExhausted(current);
    }

    private SimplificationResult onExhausted(Expression last) {
        switch (nonConvergencePolicy) {
            case FAIL -> throw new NonConvergenceException(last, maxIterations);
            case WARN -> log.warn("Simplification did not converge after {} iterations, returning {}",
                    maxIterations, last);
            case RETURN_LAST -> log.debug("Iteration cap {} reached, returning {}", maxIterations, last);
        }
        return SimplificationResult.exhausted(last, maxIterations);
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public NonConvergencePolicy getNonConvergencePolicy() {
        return nonConvergencePolicy;
    }
}
