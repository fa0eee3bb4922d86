package io.github.cyfko.logicnf.core.exception;

import io.github.cyfko.logicnf.core.config.FormulaPolicy;

/**
 * Exception thrown before enumeration starts when a formula references more distinct variables
 * than the {@link FormulaPolicy#maxVariables()} bound allows.
 * <p>
 * Enumeration produces {@code 2^n} rows for {@code n} variables, and {@code n} comes straight
 * from untrusted input, so the bound is enforced up front rather than discovered through memory
 * exhaustion.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class TooManyVariablesException extends FormulaException {

    private final int variableCount;
    private final int maxVariables;

    /**
     * @param variableCount number of distinct variables in the formula
     * @param maxVariables  configured bound
     */
    public TooManyVariablesException(int variableCount, int maxVariables) {
        super(String.format("Formula has %d distinct variables, max: %d", variableCount, maxVariables));
        this.variableCount = variableCount;
        this.maxVariables = maxVariables;
    }

    public int getVariableCount() {
        return variableCount;
    }

    public int getMaxVariables() {
        return maxVariables;
    }
}
