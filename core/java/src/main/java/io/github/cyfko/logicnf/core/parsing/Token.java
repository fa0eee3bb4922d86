package io.github.cyfko.logicnf.core.parsing;

/**
 * Lexical token produced by the {@link FormulaTokenizer}.
 * <p>
 * Tokens are immutable and carry the zero-based character offset where they start, which is
 * used for diagnostics only.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface Token permits Token.Paren, Token.Operator, Token.Variable {

    /**
     * @return zero-based character offset of the token in the source text
     */
    int position();

    /**
     * @return the source text of the token
     */
    String text();

    /**
     * Opening or closing parenthesis.
     */
    record Paren(boolean open, int position) implements Token {
        @Override
        public String text() {
            return open ? "(" : ")";
        }
    }

    /**
     * Logical operator. {@code lexeme} keeps the spelling used in the source (a synonym such as
     * {@code !} or {@code =>} is still reported as written).
     */
    record Operator(LogicOperator operator, String lexeme, int position) implements Token {
        @Override
        public String text() {
            return lexeme;
        }
    }

    /**
     * Variable identifier.
     */
    record Variable(String name, int position) implements Token {
        @Override
        public String text() {
            return name;
        }
    }
}
