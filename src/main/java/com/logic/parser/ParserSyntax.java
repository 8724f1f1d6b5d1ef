package com.logic.parser;

import java.util.Map;

/**
 * Keywords and operator symbols of the logic expression syntax.
 */
public final class ParserSyntax {

    private ParserSyntax() {
    }

    /**
     * Word operators and their symbol form, in the order LEGACY mode replaces them.
     */
    public static final Map<String, Character> WORD_OPERATORS = Map.of(
            "not", Operators.NOT,
            "and", Operators.AND,
            "or", Operators.OR
    );

    static final String[] LEGACY_REPLACEMENT_ORDER = {"not", "and", "or"};

    /**
     * Whole words mapped to token types (STRICT mode).
     */
    public static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            // Logical
            Map.entry("not", TokenType.NOT),
            Map.entry("and", TokenType.AND),
            Map.entry("or", TokenType.OR),

            // Literals
            Map.entry("True", TokenType.TRUE),
            Map.entry("true", TokenType.TRUE),
            Map.entry("False", TokenType.FALSE),
            Map.entry("false", TokenType.FALSE)
    );

    /**
     * Capitalized literals, matched as prefixes in LEGACY mode.
     */
    public static final String TRUE_LITERAL = "True";
    public static final String FALSE_LITERAL = "False";

    /**
     * Lowercase literals, matched as whole alphabetic runs in LEGACY mode.
     */
    public static final String TRUE_LOWERCASE = "true";
    public static final String FALSE_LOWERCASE = "false";

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char NOT = '~';
        public static final char AND = '&';
        public static final char OR = '|';
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';

        private Operators() {
        }
    }
}
