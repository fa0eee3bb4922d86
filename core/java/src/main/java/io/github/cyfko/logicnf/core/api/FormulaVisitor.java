package io.github.cyfko.logicnf.core.api;

/**
 * Visitor over the three node shapes of a {@link Formula}.
 * <p>
 * Every pass over the tree (evaluation, variable collection, rendering) implements this
 * interface, so a new node shape is a compile error in each of them until it is handled.
 * </p>
 *
 * @param <R> result type of the pass
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface FormulaVisitor<R> {

    R visitVariable(Formula.Var variable);

    R visitNegation(Formula.Not negation);

    R visitBinary(Formula.Binary binary);
}
