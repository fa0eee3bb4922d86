package io.github.cyfko.logicnf.core.parsing;

import io.github.cyfko.logicnf.core.exception.LexException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Single-pass scanner turning formula source text into a list of {@link Token}s.
 * <p>
 * At each position the rules are tried in this order:
 * </p>
 * <ol>
 *   <li>whitespace is skipped</li>
 *   <li>{@code (} and {@code )} become parentheses</li>
 *   <li>{@code ~ ! ¬}, {@code & ∧} and {@code | ∨} become NOT, AND and OR</li>
 *   <li>{@code <->} or {@code <=>} become EQUIV (a leading {@code <} is never anything else)</li>
 *   <li>{@code ->} or {@code =>} become IMPLIES</li>
 *   <li>an ASCII letter followed by letters, digits or underscores becomes a variable (maximal run)</li>
 *   <li>anything else is a {@link LexException}</li>
 * </ol>
 *
 * <pre>{@code
 * FormulaTokenizer.tokenize("(A & B) -> C");
 * // → [Paren((), Variable(A), Operator(AND), Variable(B), Paren()), Operator(IMPLIES), Variable(C)]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FormulaTokenizer {

    private final String input;
    private int pos;

    private FormulaTokenizer(String input) {
        this.input = input;
        this.pos = 0;
    }

    /**
     * Scans the whole input.
     *
     * @param input formula source text
     * @return the tokens in source order (unmodifiable, possibly empty)
     * @throws LexException on the first character that starts no token
     */
    public static List<Token> tokenize(String input) {
        return new FormulaTokenizer(input).tokenizeAll();
    }

    private List<Token> tokenizeAll() {
        List<Token> tokens = new ArrayList<>(input.length());
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c) || Character.isSpaceChar(c)) {
                pos++;
                continue;
            }
            tokens.add(nextToken(c));
        }
        return Collections.unmodifiableList(tokens);
    }

    private Token nextToken(char c) {
        return switch (c) {
            case '(', ')' -> paren(c == '(');
            case '~', '!', '¬' -> operator(LogicOperator.NOT, 1);
            case '&', '∧' -> operator(LogicOperator.AND, 1);
            case '|', '∨' -> operator(LogicOperator.OR, 1);
            case '<' -> {
                if (lookingAt("<->") || lookingAt("<=>")) {
                    yield operator(LogicOperator.EQUIV, 3);
                }
                throw unexpectedCharacter();
            }
            case '-', '=' -> {
                if (lookingAt("->") || lookingAt("=>")) {
                    yield operator(LogicOperator.IMPLIES, 2);
                }
                throw unexpectedCharacter();
            }
            default -> {
                if (isVariableStart(c)) {
                    yield scanVariable();
                }
                throw unexpectedCharacter();
            }
        };
    }

    private Token paren(boolean open) {
        return new Token.Paren(open, pos++);
    }

    private Token operator(LogicOperator operator, int length) {
        int start = pos;
        pos += length;
        return new Token.Operator(operator, input.substring(start, pos), start);
    }

    private Token scanVariable() {
        int start = pos;
        while (pos < input.length() && isVariablePart(input.charAt(pos))) {
            pos++;
        }
        return new Token.Variable(input.substring(start, pos), start);
    }

    private boolean lookingAt(String lexeme) {
        return input.startsWith(lexeme, pos);
    }

    private LexException unexpectedCharacter() {
        return new LexException(input.codePointAt(pos), pos);
    }

    private static boolean isVariableStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isVariablePart(char c) {
        return isVariableStart(c) || (c >= '0' && c <= '9') || c == '_';
    }
}
