package com.logic.expression;

import java.util.Objects;

/**
 * A propositional variable. Distinct names denote distinct atoms.
 *
 * @param name Non-empty alphabetic name
 */
public record Variable(String name) implements Expression {

    public Variable {
        Objects.requireNonNull(name, "Variable name cannot be null");
        if (name.isEmpty() || !name.codePoints().allMatch(Character::isLetter)) {
            throw new IllegalArgumentException("Variable name must be non-empty and alphabetic: '" + name + "'");
        }
    }

    @Override
    public ExpressionType type() {
        return ExpressionType.VARIABLE;
    }

    @Override
    public String toString() {
        return ExpressionRenderer.render(this);
    }
}
