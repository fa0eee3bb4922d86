package io.github.cyfko.logicnf.core.config;

import io.github.cyfko.logicnf.core.api.Connective;

/**
 * Glyph set used when printing formulas and normal forms as text.
 * <p>
 * Both styles only use spellings the tokenizer accepts, so rendered text can be parsed back.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum RenderStyle {
    /** {@code ~ & | -> <->} */
    ASCII("~", "&", "|"),
    /** {@code ¬ ∧ ∨ -> <->} */
    UNICODE("¬", "∧", "∨");

    /** Text of the sentinel for a formula true in every row. */
    public static final String TRUE = "True";

    /** Text of the sentinel for a formula false in every row. */
    public static final String FALSE = "False";

    private final String not;
    private final String and;
    private final String or;

    RenderStyle(String not, String and, String or) {
        this.not = not;
        this.and = and;
        this.or = or;
    }

    public String not() {
        return not;
    }

    /**
     * @param connective the connective to print
     * @return its symbol in this style, without surrounding spaces
     */
    public String symbol(Connective connective) {
        return switch (connective) {
            case AND -> and;
            case OR -> or;
            case IMPLIES -> "->";
            case EQUIV -> "<->";
        };
    }
}
