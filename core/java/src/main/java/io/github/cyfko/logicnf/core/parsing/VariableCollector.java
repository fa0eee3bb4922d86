package io.github.cyfko.logicnf.core.parsing;

import io.github.cyfko.logicnf.core.api.Formula;
import io.github.cyfko.logicnf.core.api.FormulaVisitor;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Extracts the canonical variable list of a formula: its distinct variable names in ordinal
 * (code unit) order.
 * <p>
 * This order is the column order of the truth table and the literal order inside every clause
 * of the normal forms.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class VariableCollector implements FormulaVisitor<Void> {

    private final Set<String> names = new TreeSet<>();

    private VariableCollector() {}

    /**
     * @param formula the formula to scan
     * @return distinct variable names, sorted, unmodifiable
     */
    public static List<String> collect(Formula formula) {
        VariableCollector collector = new VariableCollector();
        formula.accept(collector);
        return List.copyOf(collector.names);
    }

    @Override
    public Void visitVariable(Formula.Var variable) {
        names.add(variable.name());
        return null;
    }

    @Override
    public Void visitNegation(Formula.Not negation) {
        return negation.operand().accept(this);
    }

    @Override
    public Void visitBinary(Formula.Binary binary) {
        binary.left().accept(this);
        return binary.right().accept(this);
    }
}
