package io.github.cyfko.logicnf.core.exception;

/**
 * Exception thrown when the tokenizer meets a character that starts no valid token.
 * <p>
 * The exception identifies the offending character (as a Unicode code point, so characters
 * outside the Basic Multilingual Plane are reported whole) and its character offset in the
 * source text.
 * </p>
 *
 * <p><strong>Examples:</strong></p>
 * <pre>{@code
 * tokenizer.tokenize("A # B");   // → "Unexpected character '#' at position 2"
 * tokenizer.tokenize("A < B");   // → "Unexpected character '<' at position 2"
 * tokenizer.tokenize("1A");      // → "Unexpected character '1' at position 0"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class LexException extends FormulaException {

    private final int codePoint;
    private final int position;

    /**
     * @param codePoint the offending character
     * @param position  zero-based character offset of the offending character
     */
    public LexException(int codePoint, int position) {
        super(String.format("Unexpected character '%s' at position %d",
                new String(Character.toChars(codePoint)), position));
        this.codePoint = codePoint;
        this.position = position;
    }

    public int getCodePoint() {
        return codePoint;
    }

    /**
     * @return the offending character as a string
     */
    public String getCharacter() {
        return new String(Character.toChars(codePoint));
    }

    public int getPosition() {
        return position;
    }
}
