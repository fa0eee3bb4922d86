package io.github.cyfko.logicnf.core.exception;

/**
 * Base type of every error raised while compiling or analyzing a propositional formula.
 * <p>
 * The analysis pipeline is fail-fast: it either returns a complete result or throws exactly
 * one {@code FormulaException}. Callers that only need to report the failure can catch this
 * type; callers that need to distinguish the kinds catch the concrete subtypes:
 * </p>
 * <ul>
 *   <li>{@link LexException} - unrecognized character in the source text</li>
 *   <li>{@link FormulaSyntaxException} - token sequence does not match the grammar</li>
 *   <li>{@link UnboundVariableException} - evaluation without a value for a referenced variable</li>
 *   <li>{@link TooManyVariablesException} - enumeration would exceed the configured variable bound</li>
 *   <li>{@link ExpressionTooLongException} - source text exceeds the configured length</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class FormulaException extends RuntimeException {

    /**
     * @param message the message describing the failure
     */
    protected FormulaException(String message) {
        super(message);
    }
}
