package io.github.cyfko.logicnf.core.parsing;

import io.github.cyfko.logicnf.core.api.Connective;

/**
 * Logical operators recognized by the {@link FormulaTokenizer}.
 * <p>
 * Each operator has a canonical ASCII spelling; synonyms are normalized at scan time, so the
 * parser only ever sees the operator itself.
 * </p>
 *
 * <table border="1">
 * <caption>Accepted spellings</caption>
 * <tr><th>Operator</th><th>Canonical</th><th>Synonyms</th></tr>
 * <tr><td>NOT</td><td>~</td><td>! ¬</td></tr>
 * <tr><td>AND</td><td>&amp;</td><td>∧</td></tr>
 * <tr><td>OR</td><td>|</td><td>∨</td></tr>
 * <tr><td>IMPLIES</td><td>-&gt;</td><td>=&gt;</td></tr>
 * <tr><td>EQUIV</td><td>&lt;-&gt;</td><td>&lt;=&gt;</td></tr>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum LogicOperator {
    NOT("~"),
    AND("&"),
    OR("|"),
    IMPLIES("->"),
    EQUIV("<->");

    private final String symbol;

    LogicOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Binary connective denoted by this operator.
     *
     * @return the connective
     * @throws IllegalStateException for {@link #NOT}, which is unary
     */
    public Connective connective() {
        return switch (this) {
            case AND -> Connective.AND;
            case OR -> Connective.OR;
            case IMPLIES -> Connective.IMPLIES;
            case EQUIV -> Connective.EQUIV;
            case NOT -> throw new IllegalStateException("NOT is not a binary connective");
        };
    }
}
