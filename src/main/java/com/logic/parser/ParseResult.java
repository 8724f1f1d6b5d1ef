package com.logic.parser;

import com.logic.exception.ExpressionParseException;
import com.logic.expression.Expression;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of parsing expression text: either an expression or the parse failure.
 *
 * @param expression Parsed expression, null on failure
 * @param error      Parse failure, null on success
 */
public record ParseResult(Expression expression, ExpressionParseException error) {

    public ParseResult {
        if ((expression == null) == (error == null)) {
            throw new IllegalArgumentException("ParseResult needs exactly one of expression or error");
        }
    }

    public static ParseResult success(Expression expression) {
        return new ParseResult(Objects.requireNonNull(expression), null);
    }

    public static ParseResult failure(ExpressionParseException error) {
        return new ParseResult(null, Objects.requireNonNull(error));
    }

    public boolean isSuccess() {
        return expression != null;
    }

    public Optional<Expression> getExpression() {
        return Optional.ofNullable(expression);
    }

    public Optional<ExpressionParseException> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Get the expression or rethrow the parse failure.
     */
    public Expression orElseThrow() {
        if (error != null) {
            throw error;
        }
        return expression;
    }
}
