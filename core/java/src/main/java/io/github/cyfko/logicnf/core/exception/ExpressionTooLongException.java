package io.github.cyfko.logicnf.core.exception;

/**
 * Exception thrown when the source text of a formula is longer than the configured maximum,
 * before any scanning takes place.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ExpressionTooLongException extends FormulaException {

    private final int length;
    private final int maxLength;

    /**
     * @param length     length of the rejected source text
     * @param maxLength  configured maximum
     * @param policyName name of the policy that set the maximum
     */
    public ExpressionTooLongException(int length, int maxLength, String policyName) {
        super(String.format("Expression too long (%d characters, max: %d). Policy applied: %s",
                length, maxLength, policyName));
        this.length = length;
        this.maxLength = maxLength;
    }

    public int getLength() {
        return length;
    }

    public int getMaxLength() {
        return maxLength;
    }
}
