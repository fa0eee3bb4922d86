package io.github.cyfko.logicnf.core.exception;

/**
 * Exception thrown when a formula is evaluated under an assignment that has no value for one
 * of the variables it references.
 * <p>
 * This cannot happen when assignments are built from the formula's own variable list, which is
 * how the truth-table enumerator drives the evaluator. It guards direct callers of the evaluator.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class UnboundVariableException extends FormulaException {

    private final String variable;

    /**
     * @param variable name of the variable missing from the assignment
     */
    public UnboundVariableException(String variable) {
        super("Variable '" + variable + "' has no value in the assignment");
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
