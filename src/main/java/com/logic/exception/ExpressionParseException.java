package com.logic.exception;

/**
 * Exception thrown when expression text cannot be turned into an expression tree.
 * Parsing is atomic: either a complete tree is produced or this is thrown.
 */
public class ExpressionParseException extends LogicException {

    public ExpressionParseException(String message) {
        super(message);
    }

    public ExpressionParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
