package com.logic.parser;

import com.logic.exception.ExpressionParseException;

import java.util.ArrayList;
import java.util.List;

import static com.logic.parser.ParserSyntax.*;

/**
 * Tokenizer for logic expressions.
 * Converts input string into a sequence of tokens terminated by an EOF token.
 *
 * @see TokenizerMode
 */
public final class ExpressionTokenizer {

    private final TokenizerMode mode;
    private final String input;
    private final int length;
    private int pos;

    public ExpressionTokenizer(String input) {
        this(input, TokenizerMode.LEGACY);
    }

    public ExpressionTokenizer(String input, TokenizerMode mode) {
        this.mode = mode;
        this.input = mode == TokenizerMode.LEGACY ? prepareLegacy(input) : input;
        this.length = this.input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, last one is EOF
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            switch (c) {
                case Operators.NOT -> tokens.add(symbol(TokenType.NOT));
                case Operators.AND -> tokens.add(symbol(TokenType.AND));
                case Operators.OR -> tokens.add(symbol(TokenType.OR));
                case Operators.LEFT_PAREN -> tokens.add(symbol(TokenType.LPAREN));
                case Operators.RIGHT_PAREN -> tokens.add(symbol(TokenType.RPAREN));
                default -> {
                    int codePoint = peekCodePoint();
                    if (Character.isLetter(codePoint)) {
                        tokens.add(mode == TokenizerMode.LEGACY ? readLegacyWord() : readWord());
                    } else if (mode == TokenizerMode.LEGACY) {
                        pos += Character.charCount(codePoint); // dropped
                    } else {
                        throw new ExpressionParseException(
                                "Unexpected character '" + new String(Character.toChars(codePoint)) + "'");
                    }
                }
            }
        }

        tokens.add(Token.EOF);
        return tokens;
    }

    /**
     * Strip whitespace and rewrite word operators into symbols.
     */
    private static String prepareLegacy(String input) {
        StringBuilder sb = new StringBuilder(input.length());
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (!Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        String stripped = sb.toString();
        for (String word : LEGACY_REPLACEMENT_ORDER) {
            stripped = stripped.replace(word, String.valueOf(WORD_OPERATORS.get(word)));
        }
        return stripped;
    }

    private Token readLegacyWord() {
        if (input.startsWith(TRUE_LITERAL, pos)) {
            pos += TRUE_LITERAL.length();
            return new Token(TokenType.TRUE, TRUE_LITERAL);
        }
        if (input.startsWith(FALSE_LITERAL, pos)) {
            pos += FALSE_LITERAL.length();
            return new Token(TokenType.FALSE, FALSE_LITERAL);
        }

        String text = readLetters();
        if (TRUE_LOWERCASE.equals(text)) {
            return new Token(TokenType.TRUE, text);
        }
        if (FALSE_LOWERCASE.equals(text)) {
            return new Token(TokenType.FALSE, text);
        }
        return new Token(TokenType.IDENT, text);
    }

    private Token readWord() {
        String text = readLetters();
        TokenType keywordType = KEYWORDS.get(text);
        if (keywordType != null) {
            return new Token(keywordType, text);
        }
        return new Token(TokenType.IDENT, text);
    }

    private String readLetters() {
        int start = pos;
        while (!isAtEnd() && Character.isLetter(peekCodePoint())) {
            pos += Character.charCount(peekCodePoint());
        }
        return input.substring(start, pos);
    }

    private Token symbol(TokenType type) {
        return new Token(type, String.valueOf(advance()));
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private char peek() {
        return input.charAt(pos);
    }

    private int peekCodePoint() {
        return input.codePointAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }
}
