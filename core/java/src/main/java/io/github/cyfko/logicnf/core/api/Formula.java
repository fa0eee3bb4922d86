package io.github.cyfko.logicnf.core.api;

import java.util.Objects;

/**
 * Abstract syntax tree of a propositional formula.
 * <p>
 * A formula is one of three immutable shapes: a variable leaf, a negation, or a binary
 * connective applied to two sub-formulas. Trees are strict (no node is its own ancestor) and are
 * never modified after construction, so the same tree can be read by any number of passes.
 * Identical variable names may appear as distinct leaves.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * // (A & B) -> C
 * Formula f = Formula.implies(Formula.and(Formula.var("A"), Formula.var("B")), Formula.var("C"));
 *
 * boolean value = FormulaEvaluator.evaluate(f, Map.of("A", true, "B", true, "C", false));  // false
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface Formula permits Formula.Var, Formula.Not, Formula.Binary {

    /**
     * Dispatches to the visitor method matching this node's shape.
     *
     * @param visitor the pass to run
     * @param <R>     result type of the pass
     * @return the visitor's result for this node
     */
    <R> R accept(FormulaVisitor<R> visitor);

    /**
     * Leaf referencing a variable by name.
     */
    record Var(String name) implements Formula {
        public Var {
            Objects.requireNonNull(name, "Variable name cannot be null");
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Variable name cannot be empty");
            }
        }

        @Override
        public <R> R accept(FormulaVisitor<R> visitor) {
            return visitor.visitVariable(this);
        }
    }

    /**
     * Logical negation of a sub-formula.
     */
    record Not(Formula operand) implements Formula {
        public Not {
            Objects.requireNonNull(operand, "Negated operand cannot be null");
        }

        @Override
        public <R> R accept(FormulaVisitor<R> visitor) {
            return visitor.visitNegation(this);
        }
    }

    /**
     * Binary connective applied to two sub-formulas.
     */
    record Binary(Connective connective, Formula left, Formula right) implements Formula {
        public Binary {
            Objects.requireNonNull(connective, "Connective cannot be null");
            Objects.requireNonNull(left, "Left operand cannot be null");
            Objects.requireNonNull(right, "Right operand cannot be null");
        }

        @Override
        public <R> R accept(FormulaVisitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    static Formula var(String name) {
        return new Var(name);
    }

    static Formula not(Formula operand) {
        return new Not(operand);
    }

    static Formula and(Formula left, Formula right) {
        return new Binary(Connective.AND, left, right);
    }

    static Formula or(Formula left, Formula right) {
        return new Binary(Connective.OR, left, right);
    }

    static Formula implies(Formula left, Formula right) {
        return new Binary(Connective.IMPLIES, left, right);
    }

    static Formula equiv(Formula left, Formula right) {
        return new Binary(Connective.EQUIV, left, right);
    }
}
