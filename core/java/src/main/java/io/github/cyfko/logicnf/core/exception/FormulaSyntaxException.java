package io.github.cyfko.logicnf.core.exception;

import io.github.cyfko.logicnf.core.parsing.Token;

import java.util.Optional;

/**
 * Exception thrown when a token sequence does not form a formula.
 * <p>
 * Every instance carries a {@link Reason}, the offending token (empty when the problem is the
 * end of input) and a short description of what the parser expected at that point.
 * </p>
 *
 * <p><strong>Examples:</strong></p>
 * <pre>{@code
 * parser.parse("A &");     // UNEXPECTED_END_OF_INPUT: "Unexpected end of input, expected operand after '&'"
 * parser.parse("& A");     // UNEXPECTED_TOKEN: "Unexpected '&' at position 0, expected variable or '('"
 * parser.parse("(A | B");  // MISSING_CLOSING_PARENTHESIS at end of input
 * parser.parse("A B");     // TRAILING_INPUT: "Unexpected 'B' at position 2, expected operator or end of input"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FormulaSyntaxException extends FormulaException {

    /**
     * Kind of syntax error.
     */
    public enum Reason {
        /** A token appeared where an operand was required. */
        UNEXPECTED_TOKEN,
        /** Input ended where an operand was required. */
        UNEXPECTED_END_OF_INPUT,
        /** A parenthesized sub-formula was not closed. */
        MISSING_CLOSING_PARENTHESIS,
        /** A complete formula was followed by more tokens. */
        TRAILING_INPUT,
        /** Nesting exceeded the configured depth. */
        NESTING_TOO_DEEP
    }

    private final Reason reason;
    private final Token token;
    private final String expected;

    private FormulaSyntaxException(Reason reason, Token token, String expected, String message) {
        super(message);
        this.reason = reason;
        this.token = token;
        this.expected = expected;
    }

    /**
     * Error at a token.
     *
     * @param reason   kind of error
     * @param token    the offending token
     * @param expected what the parser expected instead
     * @return the exception
     */
    public static FormulaSyntaxException at(Reason reason, Token token, String expected) {
        return new FormulaSyntaxException(reason, token, expected, String.format(
                "Unexpected '%s' at position %d, expected %s", token.text(), token.position(), expected));
    }

    /**
     * Error at the end of input.
     *
     * @param reason   kind of error
     * @param expected what the parser expected instead
     * @return the exception
     */
    public static FormulaSyntaxException atEnd(Reason reason, String expected) {
        return new FormulaSyntaxException(reason, null, expected,
                "Unexpected end of input, expected " + expected);
    }

    /**
     * Nesting depth exceeded.
     *
     * @param token    the token that opened the level beyond the limit
     * @param maxDepth configured limit
     * @return the exception
     */
    public static FormulaSyntaxException nestingTooDeep(Token token, int maxDepth) {
        return new FormulaSyntaxException(Reason.NESTING_TOO_DEEP, token, "nesting depth of at most " + maxDepth,
                String.format("Nesting too deep at position %d (max depth: %d)", token.position(), maxDepth));
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * @return the offending token, or empty when the error is at the end of input
     */
    public Optional<Token> getToken() {
        return Optional.ofNullable(token);
    }

    public boolean isAtEndOfInput() {
        return token == null;
    }

    public String getExpected() {
        return expected;
    }
}
