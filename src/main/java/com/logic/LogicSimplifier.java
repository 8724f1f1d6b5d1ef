package com.logic;

import com.logic.config.SimplifierConfig;
import com.logic.exception.ExpressionParseException;
import com.logic.exception.NonConvergenceException;
import com.logic.expression.Expression;
import com.logic.expression.ExpressionRenderer;
import com.logic.parser.LogicExpressionParser;
import com.logic.parser.ParseResult;
import com.logic.simplifier.FixedPointSimplifier;
import com.logic.simplifier.RuleBasedSimplifier;
import com.logic.simplifier.SimplificationResult;
import com.logic.simplifier.Simplifier;

/**
 * Entry point for parsing, simplifying and rendering logic expressions.
 * Instances are immutable and can be shared between threads.
 */
public class LogicSimplifier {

    private final SimplifierConfig config;
    private final Simplifier simplifier;
    private final FixedPointSimplifier fixedPointSimplifier;

    public LogicSimplifier(SimplifierConfig config) {
        this.config = config;
        this.simplifier = RuleBasedSimplifier.INSTANCE;
        this.fixedPointSimplifier = new FixedPointSimplifier(
                simplifier, config.maxIterations(), config.nonConvergencePolicy());
    }

    public static LogicSimplifier defaults() {
        return new LogicSimplifier(SimplifierConfig.defaults());
    }

    /**
     * Parse expression text using the configured tokenizer mode.
     *
     * @throws ExpressionParseException if the text is malformed
     */
    public Expression parse(String text) {
        return LogicExpressionParser.parse(text, config.tokenizerMode());
    }

    /**
     * Parse expression text, reporting malformed input in the result instead of throwing.
     */
    public ParseResult tryParse(String text) {
        return LogicExpressionParser.tryParse(text, config.tokenizerMode());
    }

    /**
     * Apply a single bottom-up simplification pass.
     */
    public Expression simplifyOnce(Expression expression) {
        return simplifier.simplify(expression);
    }

    /**
     * Parse and simplify to a fixed point.
     *
     * @throws ExpressionParseException if the text is malformed
     * @throws NonConvergenceException  if the iteration cap is hit under the FAIL policy
     */
    public Expression simplify(String text) {
        return evaluate(text).expression();
    }

    /**
     * Simplify to a fixed point.
     *
     * @throws NonConvergenceException if the iteration cap is hit under the FAIL policy
     */
    public Expression simplify(Expression expression) {
        return evaluate(expression).expression();
    }

    /**
     * Simplify either expression text or an Expression to a fixed point.
     *
     * @param input String or Expression
     * @throws IllegalArgumentException if the input is neither
     */
    public Expression simplify(Object input) {
        return evaluate(input).expression();
    }

    /**
     * Simplify either expression text or an Expression, returning convergence details.
     *
     * @param input String or Expression
     * @throws IllegalArgumentException if the input is neither
     */
    public SimplificationResult evaluate(Object input) {
        if (input instanceof String text) {
            return fixedPointSimplifier.run(parse(text));
        }
        if (input instanceof Expression expression) {
            return fixedPointSimplifier.run(expression);
        }
        throw new IllegalArgumentException("Input must be a String or an Expression, got "
                + (input == null ? "null" : input.getClass().getName()));
    }

    /**
     * Render an expression to its canonical text.
     */
    public String render(Expression expression) {
        return ExpressionRenderer.render(expression);
    }

    public SimplifierConfig getConfig() {
        return config;
    }
}
