package com.logic.parser;

/**
 * Represents a token in a logic expression.
 * Tokens carry no position; errors reference token text only.
 *
 * @param type Token type
 * @param text Token text
 */
public record Token(TokenType type, String text) {

    static final Token EOF = new Token(TokenType.EOF, "");

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
