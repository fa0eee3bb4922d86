package io.github.cyfko.logicnf.core.rendering;

import io.github.cyfko.logicnf.core.api.Formula;
import io.github.cyfko.logicnf.core.api.FormulaVisitor;
import io.github.cyfko.logicnf.core.config.RenderStyle;

/**
 * Prints a formula tree as text with the fewest parentheses that keep its structure.
 * <p>
 * A binary operand is parenthesized when it binds looser than its parent, or when it binds
 * equally and sits on the right (all connectives associate to the left). A negated binary
 * formula is always parenthesized. Parsing the output yields an equal tree.
 * </p>
 *
 * <pre>{@code
 * FormulaRenderer.render(parser.parse("((A | B)) & ~(C)"), RenderStyle.ASCII);    // "(A | B) & ~C"
 * FormulaRenderer.render(parser.parse("A | (B | C)"), RenderStyle.UNICODE);       // "A ∨ (B ∨ C)"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FormulaRenderer implements FormulaVisitor<String> {

    private final RenderStyle style;

    private FormulaRenderer(RenderStyle style) {
        this.style = style;
    }

    public static String render(Formula formula, RenderStyle style) {
        return formula.accept(new FormulaRenderer(style));
    }

    @Override
    public String visitVariable(Formula.Var variable) {
        return variable.name();
    }

    @Override
    public String visitNegation(Formula.Not negation) {
        Formula operand = negation.operand();
        String inner = operand.accept(this);
        return style.not() + (operand instanceof Formula.Binary ? "(" + inner + ")" : inner);
    }

    @Override
    public String visitBinary(Formula.Binary binary) {
        int strength = binary.connective().bindingStrength();
        String left = operand(binary.left(), strength, false);
        String right = operand(binary.right(), strength, true);
        return left + " " + style.symbol(binary.connective()) + " " + right;
    }

    private String operand(Formula operand, int parentStrength, boolean rightSide) {
        String text = operand.accept(this);
        if (operand instanceof Formula.Binary child) {
            int strength = child.connective().bindingStrength();
            if (strength < parentStrength || (rightSide && strength == parentStrength)) {
                return "(" + text + ")";
            }
        }
        return text;
    }
}
