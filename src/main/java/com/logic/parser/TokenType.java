package com.logic.parser;

/**
 * Token types for logic expression parsing.
 */
public enum TokenType {
    // Identifiers and literals
    IDENT,
    TRUE,
    FALSE,

    // Delimiters
    LPAREN,
    RPAREN,

    // Logical operators
    NOT,
    AND,
    OR,

    // Special
    EOF
}
