package com.logic.expression;

/**
 * Renders expressions to their canonical text form.
 * <p>
 * Rules:
 * <ul>
 *   <li>Variable: its name</li>
 *   <li>Constant: {@code True} or {@code False}</li>
 *   <li>Not: {@code not x} for a variable or constant operand, {@code not (x)} otherwise</li>
 *   <li>And: {@code l and r}, each side in parentheses only when it is an Or</li>
 *   <li>Or: always {@code (l or r)}</li>
 * </ul>
 * The fixed-point simplifier compares renderings, so this output must stay stable.
 */
public final class ExpressionRenderer {

    private ExpressionRenderer() {
    }

    /**
     * Render an expression.
     *
     * @param expression Expression to render
     * @return Canonical text
     */
    public static String render(Expression expression) {
        return switch (expression.type()) {
            case VARIABLE -> ((Variable) expression).name();
            case CONSTANT -> ((Constant) expression).value() ? "True" : "False";
            case NOT -> renderNot((Not) expression);
            case AND -> conjunct(((And) expression).left()) + " and " + conjunct(((And) expression).right());
            case OR -> "(" + render(((Or) expression).left()) + " or " + render(((Or) expression).right()) + ")";
        };
    }

    private static String renderNot(Not not) {
        Expression operand = not.operand();
        if (operand.type() == ExpressionType.VARIABLE || operand.type() == ExpressionType.CONSTANT) {
            return "not " + render(operand);
        }
        return "not (" + render(operand) + ")";
    }

    private static String conjunct(Expression side) {
        return side.type() == ExpressionType.OR ? "(" + render(side) + ")" : render(side);
    }
}
