package io.github.cyfko.logicnf.core.parsing;

import io.github.cyfko.logicnf.core.api.Formula;
import io.github.cyfko.logicnf.core.api.FormulaVisitor;
import io.github.cyfko.logicnf.core.exception.UnboundVariableException;
import io.github.cyfko.logicnf.core.model.Assignment;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Computes the truth value of a formula under an assignment of its variables.
 * <p>
 * Both operands of every connective are evaluated, so a missing variable is reported even where
 * short-circuiting would not need its value.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FormulaEvaluator implements FormulaVisitor<Boolean> {

    // returns null for an unbound name
    private final Function<String, Boolean> lookup;

    /**
     * @param values variable values; must cover every variable of the formulas evaluated with it
     */
    public FormulaEvaluator(Map<String, Boolean> values) {
        this.lookup = Objects.requireNonNull(values, "Assignment cannot be null")::get;
    }

    /**
     * @param assignment variable values; must cover every variable of the formulas evaluated with it
     */
    public FormulaEvaluator(Assignment assignment) {
        Objects.requireNonNull(assignment, "Assignment cannot be null");
        this.lookup = assignment::valueOf;
    }

    /**
     * @param formula    the formula to evaluate
     * @param assignment values of its variables
     * @return the formula's truth value
     * @throws UnboundVariableException if the assignment misses a variable of the formula
     */
    public static boolean evaluate(Formula formula, Assignment assignment) {
        return formula.accept(new FormulaEvaluator(assignment));
    }

    /**
     * @param formula the formula to evaluate
     * @param values  values of its variables
     * @return the formula's truth value
     * @throws UnboundVariableException if the map misses a variable of the formula
     */
    public static boolean evaluate(Formula formula, Map<String, Boolean> values) {
        return formula.accept(new FormulaEvaluator(values));
    }

    @Override
    public Boolean visitVariable(Formula.Var variable) {
        Boolean value = lookup.apply(variable.name());
        if (value == null) {
            throw new UnboundVariableException(variable.name());
        }
        return value;
    }

    @Override
    public Boolean visitNegation(Formula.Not negation) {
        return !negation.operand().accept(this);
    }

    @Override
    public Boolean visitBinary(Formula.Binary binary) {
        boolean left = binary.left().accept(this);
        boolean right = binary.right().accept(this);
        return binary.connective().apply(left, right);
    }
}
