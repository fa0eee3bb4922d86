package io.github.cyfko.logicnf.core.api;

/**
 * Binary logical connectives of the formula language.
 * <p>
 * Binding strength follows the grammar: a higher value binds tighter. Negation is not listed
 * here; it is unary and binds tighter than every connective. All connectives are
 * left-associative.
 * </p>
 *
 * <table border="1">
 * <caption>Connective reference</caption>
 * <tr><th>Connective</th><th>Symbol</th><th>Binding strength</th><th>Truth function</th></tr>
 * <tr><td>AND</td><td>&amp;</td><td>4</td><td>l ∧ r</td></tr>
 * <tr><td>OR</td><td>|</td><td>3</td><td>l ∨ r</td></tr>
 * <tr><td>IMPLIES</td><td>-&gt;</td><td>2</td><td>¬l ∨ r</td></tr>
 * <tr><td>EQUIV</td><td>&lt;-&gt;</td><td>1</td><td>l = r</td></tr>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Connective {
    AND(4),
    OR(3),
    IMPLIES(2),
    EQUIV(1);

    private final int bindingStrength;

    Connective(int bindingStrength) {
        this.bindingStrength = bindingStrength;
    }

    public int bindingStrength() {
        return bindingStrength;
    }

    /**
     * Applies the truth function of this connective.
     *
     * @param left  value of the left operand
     * @param right value of the right operand
     * @return the connective's result
     */
    public boolean apply(boolean left, boolean right) {
        return switch (this) {
            case AND -> left && right;
            case OR -> left || right;
            case IMPLIES -> !left || right;
            case EQUIV -> left == right;
        };
    }
}
