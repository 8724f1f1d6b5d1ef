package com.logic.parser;

import com.logic.exception.ExpressionParseException;
import com.logic.expression.And;
import com.logic.expression.Constant;
import com.logic.expression.Expression;
import com.logic.expression.Not;
import com.logic.expression.Or;
import com.logic.expression.Variable;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for logic expressions.
 * Converts tokens into an Expression tree using recursive descent parsing.
 * <p>
 * Grammar ({@code and} and {@code or} share one precedence level, folded left to right):
 * <pre>
 * expression := primary (('&amp;' | '|') primary)*
 * primary    := TRUE | FALSE | IDENT | '~' primary | '(' expression ')'
 * </pre>
 * So {@code A | B & C} parses as {@code (A | B) & C}, and {@code ~A & B} as
 * {@code (~A) & B}.
 * <p>
 * Trees deeper than {@link #MAX_DEPTH} levels, or inputs nesting {@code ~} and {@code (}
 * more than {@link #MAX_DEPTH} times, are rejected.
 */
public final class ExpressionParser {

    /**
     * Maximum depth of a parsed tree, also the limit on nested {@code ~} and {@code (}.
     */
    public static final int MAX_DEPTH = 1000;

    private final List<Token> tokens;
    private int index;
    private int nesting;
    private int height; // height of the most recently parsed subtree

    public ExpressionParser(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            List<Token> terminated = new ArrayList<>(tokens);
            terminated.add(Token.EOF);
            tokens = terminated;
        }
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parse the token stream into an Expression tree.
     *
     * @return Root expression
     * @throws ExpressionParseException if the tokens do not form exactly one expression
     */
    public Expression parse() {
        Expression result = parseExpression();
        if (!isAtEnd()) {
            throw new ExpressionParseException("Unexpected trailing token '" + peek().text() + "'");
        }
        return result;
    }

    private Expression parseExpression() {
        Expression left = parsePrimary();
        int leftHeight = height;

        while (check(TokenType.AND) || check(TokenType.OR)) {
            Token operator = advance();
            Expression right = parsePrimary();
            left = operator.type() == TokenType.AND
                    ? new And(left, right)
                    : new Or(left, right);
            leftHeight = checkHeight(Math.max(leftHeight, height) + 1);
        }

        height = leftHeight;
        return left;
    }

    private Expression parsePrimary() {
        if (isAtEnd()) {
            throw new ExpressionParseException("Unexpected end of expression");
        }

        Token token = advance();
        return switch (token.type()) {
            case TRUE -> leaf(Constant.TRUE);
            case FALSE -> leaf(Constant.FALSE);
            case IDENT -> leaf(new Variable(token.text()));
            case NOT -> parseNot();
            case LPAREN -> parseGroup();
            default -> throw new ExpressionParseException("Unexpected token '" + token.text() + "'");
        };
    }

    private Expression parseNot() {
        enterNesting();
        try {
            Expression operand = parsePrimary();
            height = checkHeight(height + 1);
            return new Not(operand);
        } finally {
            nesting--;
        }
    }

    private Expression parseGroup() {
        enterNesting();
        try {
            Expression inner = parseExpression();
            if (!match(TokenType.RPAREN)) {
                throw new ExpressionParseException(isAtEnd()
                        ? "Expected closing parenthesis"
                        : "Expected closing parenthesis but found '" + peek().text() + "'");
            }
            return inner;
        } finally {
            nesting--;
        }
    }

    private Expression leaf(Expression expression) {
        height = 1;
        return expression;
    }

    private void enterNesting() {
        if (++nesting > MAX_DEPTH) {
            throw new ExpressionParseException("Expression nested too deeply");
        }
    }

    private int checkHeight(int value) {
        if (value > MAX_DEPTH) {
            throw new ExpressionParseException("Expression nested too deeply");
        }
        return value;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }
}
