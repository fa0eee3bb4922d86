package io.github.cyfko.logicnf.core.model;

import io.github.cyfko.logicnf.core.api.Formula;
import io.github.cyfko.logicnf.core.exception.UnboundVariableException;

import java.util.Map;
import java.util.Objects;

/**
 * A variable or its negation.
 *
 * @param variable variable name
 * @param negated  whether the variable appears negated
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Literal(String variable, boolean negated) {

    public Literal {
        Objects.requireNonNull(variable, "Variable cannot be null");
    }

    public static Literal positive(String variable) {
        return new Literal(variable, false);
    }

    public static Literal negative(String variable) {
        return new Literal(variable, true);
    }

    /**
     * @param values variable values
     * @return the literal's value
     * @throws UnboundVariableException if the variable has no value
     */
    public boolean evaluate(Map<String, Boolean> values) {
        Boolean value = values.get(variable);
        if (value == null) {
            throw new UnboundVariableException(variable);
        }
        return value != negated;
    }

    public Formula toFormula() {
        Formula var = Formula.var(variable);
        return negated ? Formula.not(var) : var;
    }
}
