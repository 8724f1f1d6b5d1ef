package com.logic.simplifier;

import com.logic.expression.And;
import com.logic.expression.Constant;
import com.logic.expression.Expression;
import com.logic.expression.ExpressionType;
import com.logic.expression.Not;
import com.logic.expression.Or;
import com.logic.expression.Variable;

/**
 * Simplifies expressions with a fixed set of boolean algebra identities.
 * <p>
 * Children are simplified first, then the rules for the node are tried in order:
 * <ul>
 *   <li>Not: not (not x) → x, not True → False, not False → True</li>
 *   <li>And: x and False → False, x and True → x, x and x → x,
 *       (v or not v) and x → x</li>
 *   <li>Or: x or True → True, x or False → x, x or x → x,
 *       (v and not v) or x → x</li>
 * </ul>
 * Each rule is checked on the left operand before the right one.
 */
public class RuleBasedSimplifier implements Simplifier {

    public static final RuleBasedSimplifier INSTANCE = new RuleBasedSimplifier();

    @Override
    public Expression simplify(Expression expression) {
        return switch (expression.type()) {
            case VARIABLE, CONSTANT -> expression;
            case NOT -> simplifyNot((Not) expression);
            case AND -> simplifyAnd((And) expression);
            case OR -> simplifyOr((Or) expression);
        };
    }

    private Expression simplifyNot(Not not) {
        Expression operand = simplify(not.operand());

        if (operand instanceof Not inner) {
            return simplify(inner.operand());
        }
        if (operand instanceof Constant constant) {
            return constant.negate();
        }
        return new Not(operand);
    }

    private Expression simplifyAnd(And and) {
        Expression left = simplify(and.left());
        Expression right = simplify(and.right());

        // Annihilation
        if (left.isFalse() || right.isFalse()) {
            return Constant.FALSE;
        }

        // Identity
        if (left.isTrue()) {
            return right;
        }
        if (right.isTrue()) {
            return left;
        }

        // Idempotence
        if (left.equals(right)) {
            return left;
        }

        // Excluded middle
        if (isComplementaryPair(left, ExpressionType.OR)) {
            return right;
        }
        if (isComplementaryPair(right, ExpressionType.OR)) {
            return left;
        }

        return new And(left, right);
    }

    private Expression simplifyOr(Or or) {
        Expression left = simplify(or.left());
        Expression right = simplify(or.right());

        // Annihilation
        if (left.isTrue() || right.isTrue()) {
            return Constant.TRUE;
        }

        // Identity
        if (left.isFalse()) {
            return right;
        }
        if (right.isFalse()) {
            return left;
        }

        // Idempotence
        if (left.equals(right)) {
            return left;
        }

        // Contradiction
        if (isComplementaryPair(left, ExpressionType.AND)) {
            return right;
        }
        if (isComplementaryPair(right, ExpressionType.AND)) {
            return left;
        }

        return new Or(left, right);
    }

    /**
     * Whether the expression is {@code v op not v} or {@code not v op v} for a single
     * variable {@code v}. With OR this is the excluded middle, with AND a contradiction.
     */
    static boolean isComplementaryPair(Expression expression, ExpressionType operator) {
        if (expression.type() != operator) {
            return false;
        }

        Expression left;
        Expression right;
        if (expression instanceof Or or) {
            left = or.left();
            right = or.right();
        } else if (expression instanceof And and) {
            left = and.left();
            right = and.right();
        } else {
            return false;
        }

        return negatesVariable(left, right) || negatesVariable(right, left);
    }

    private static boolean negatesVariable(Expression candidate, Expression negation) {
        return candidate instanceof Variable variable
                && negation instanceof Not not
                && not.operand() instanceof Variable negated
                && variable.name().equals(negated.name());
    }
}
