package com.logic.simplifier;

import com.logic.expression.Expression;
import com.logic.expression.ExpressionType;
import com.logic.expression.Variable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.logic.expression.Expression.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RuleBasedSimplifier.
 */
class RuleBasedSimplifierTest {

    private static final Variable A = variable("A");
    private static final Variable B = variable("B");
    private static final Variable C = variable("C");
    private static final Expression TRUE = constant(true);
    private static final Expression FALSE = constant(false);

    private final Simplifier simplifier = new RuleBasedSimplifier();

    @Test
    @DisplayName("Leaves are returned unchanged")
    void leaves() {
        assertSame(A, simplifier.simplify(A));
        assertSame(TRUE, simplifier.simplify(TRUE));
    }

    @Nested
    @DisplayName("Not")
    class NotRules {

        @Test
        @DisplayName("Double negation is eliminated")
        void doubleNegation() {
            assertEquals(A, simplifier.simplify(not(not(A))));
            assertEquals(not(A), simplifier.simplify(not(not(not(A)))));
            assertEquals(A, simplifier.simplify(not(not(not(not(A))))));
        }

        @Test
        @DisplayName("Constants are negated")
        void constantNegation() {
            assertEquals(FALSE, simplifier.simplify(not(TRUE)));
            assertEquals(TRUE, simplifier.simplify(not(FALSE)));
            assertEquals(TRUE, simplifier.simplify(not(and(A, FALSE))));
        }

        @Test
        @DisplayName("Other operands stay negated after simplification")
        void otherOperands() {
            assertEquals(not(A), simplifier.simplify(not(and(A, A))));
            assertEquals(not(or(A, B)), simplifier.simplify(not(or(A, B))));
        }
    }

    @Nested
    @DisplayName("And")
    class AndRules {

        @Test
        @DisplayName("False annihilates")
        void annihilation() {
            assertEquals(FALSE, simplifier.simplify(and(A, FALSE)));
            assertEquals(FALSE, simplifier.simplify(and(FALSE, A)));
            assertEquals(FALSE, simplifier.simplify(and(TRUE, FALSE)));
        }

        @Test
        @DisplayName("True is the identity")
        void identity() {
            assertEquals(A, simplifier.simplify(and(A, TRUE)));
            assertEquals(A, simplifier.simplify(and(TRUE, A)));
        }

        @Test
        @DisplayName("Equal operands collapse")
        void idempotence() {
            assertEquals(A, simplifier.simplify(and(A, A)));
            assertEquals(or(A, B), simplifier.simplify(and(or(A, B), or(A, B))));
        }

        @Test
        @DisplayName("Excluded middle on either side is dropped")
        void excludedMiddle() {
            assertEquals(B, simplifier.simplify(and(or(A, not(A)), B)));
            assertEquals(B, simplifier.simplify(and(or(not(A), A), B)));
            assertEquals(B, simplifier.simplify(and(B, or(A, not(A)))));
        }

        @Test
        @DisplayName("Excluded middle needs the same variable")
        void excludedMiddleNeedsSameVariable() {
            Expression expression = and(or(A, not(B)), C);
            assertEquals(expression, simplifier.simplify(expression));
        }

        @Test
        @DisplayName("Contradiction is not simplified under And")
        void contradictionUnderAndIsKept() {
            assertEquals(and(A, not(A)), simplifier.simplify(and(not(not(A)), not(A))));
        }
    }

    @Nested
    @DisplayName("Or")
    class OrRules {

        @Test
        @DisplayName("True annihilates")
        void annihilation() {
            assertEquals(TRUE, simplifier.simplify(or(A, TRUE)));
            assertEquals(TRUE, simplifier.simplify(or(TRUE, A)));
            assertEquals(TRUE, simplifier.simplify(or(FALSE, TRUE)));
        }

        @Test
        @DisplayName("False is the identity")
        void identity() {
            assertEquals(A, simplifier.simplify(or(A, FALSE)));
            assertEquals(A, simplifier.simplify(or(FALSE, A)));
        }

        @Test
        @DisplayName("Equal operands collapse")
        void idempotence() {
            assertEquals(A, simplifier.simplify(or(A, A)));
            assertEquals(not(A), simplifier.simplify(or(not(A), not(not(not(A))))));
        }

        @Test
        @DisplayName("Contradiction on either side is dropped")
        void contradiction() {
            assertEquals(B, simplifier.simplify(or(and(A, not(A)), B)));
            assertEquals(B, simplifier.simplify(or(B, and(not(A), A))));
        }

        @Test
        @DisplayName("Excluded middle is not simplified under Or")
        void excludedMiddleUnderOrIsKept() {
            Expression expression = or(or(A, not(A)), B);
            assertEquals(expression, simplifier.simplify(expression));
        }

        @Test
        @DisplayName("Children are simplified before the node")
        void bottomUp() {
            assertEquals(B, simplifier.simplify(or(and(not(not(A)), not(A)), B)));
        }
    }

    @Test
    @DisplayName("Input tree is not modified")
    void inputUntouched() {
        Expression input = and(or(A, not(A)), not(not(B)));
        Expression copy = and(or(A, not(A)), not(not(B)));

        assertEquals(B, simplifier.simplify(input));
        assertEquals(copy, input);
    }

    @Test
    @DisplayName("Complementary pair detection")
    void complementaryPair() {
        assertTrue(RuleBasedSimplifier.isComplementaryPair(or(A, not(A)), ExpressionType.OR));
        assertTrue(RuleBasedSimplifier.isComplementaryPair(and(not(A), A), ExpressionType.AND));
        assertFalse(RuleBasedSimplifier.isComplementaryPair(or(A, not(A)), ExpressionType.AND));
        assertFalse(RuleBasedSimplifier.isComplementaryPair(or(A, not(B)), ExpressionType.OR));
        assertFalse(RuleBasedSimplifier.isComplementaryPair(or(A, not(not(A))), ExpressionType.OR));
        assertFalse(RuleBasedSimplifier.isComplementaryPair(A, ExpressionType.OR));
    }
}
