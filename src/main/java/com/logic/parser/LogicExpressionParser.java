package com.logic.parser;

import com.logic.exception.ExpressionParseException;
import com.logic.expression.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Facade for parsing logic expression text into Expression trees.
 * <p>
 * Supports:
 * <ul>
 *   <li>Variables: alphabetic names</li>
 *   <li>Constants: True, False, true, false</li>
 *   <li>Operators: not / ~, and / &amp;, or / |</li>
 *   <li>Parentheses for grouping</li>
 * </ul>
 * <p>
 * Any tokenizer or parser failure is reported as a single
 * {@link ExpressionParseException} naming the input and the underlying problem.
 */
public final class LogicExpressionParser {

    private static final Logger log = LoggerFactory.getLogger(LogicExpressionParser.class);

    private LogicExpressionParser() {
    }

    /**
     * Parse expression text with the LEGACY tokenizer.
     *
     * @param text Expression text
     * @return Parsed expression
     * @throws ExpressionParseException if the text is not a valid expression
     */
    public static Expression parse(String text) {
        return parse(text, TokenizerMode.LEGACY);
    }

    /**
     * Parse expression text.
     *
     * @param text Expression text
     * @param mode Tokenizer mode
     * @return Parsed expression
     * @throws ExpressionParseException if the text is not a valid expression
     */
    public static Expression parse(String text, TokenizerMode mode) {
        if (text == null) {
            throw new ExpressionParseException("Failed to parse logic expression: input is null");
        }

        try {
            // Tokenize
            List<Token> tokens = new ExpressionTokenizer(text, mode).tokenize();

            // Parse
            Expression expression = new ExpressionParser(tokens).parse();
            log.debug("Parsed '{}' into {}", text, expression);
            return expression;
        } catch (ExpressionParseException e) {
            throw new ExpressionParseException(
                    "Failed to parse logic expression '" + text + "': " + e.getMessage(), e);
        }
    }

    /**
     * Parse expression text with the LEGACY tokenizer without throwing on malformed input.
     */
    public static ParseResult tryParse(String text) {
        return tryParse(text, TokenizerMode.LEGACY);
    }

    /**
     * Parse expression text without throwing on malformed input.
     *
     * @param text Expression text
     * @param mode Tokenizer mode
     * @return Success with the expression, or failure with the parse exception
     */
    public static ParseResult tryParse(String text, TokenizerMode mode) {
        try {
            return ParseResult.success(parse(text, mode));
        } catch (ExpressionParseException e) {
            return ParseResult.failure(e);
        }
    }
}
