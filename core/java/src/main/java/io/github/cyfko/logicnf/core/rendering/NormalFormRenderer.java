package io.github.cyfko.logicnf.core.rendering;

import io.github.cyfko.logicnf.core.config.RenderStyle;
import io.github.cyfko.logicnf.core.model.Clause;
import io.github.cyfko.logicnf.core.model.Literal;
import io.github.cyfko.logicnf.core.model.NormalForm;

import java.util.stream.Collectors;

/**
 * Prints a {@link NormalForm} as text.
 * <p>
 * Multi-literal clauses are wrapped in parentheses, single-literal clauses are not, and clauses
 * are joined by the form's outer connective. Sentinels print as {@link RenderStyle#TRUE} and
 * {@link RenderStyle#FALSE}.
 * </p>
 *
 * <pre>{@code
 * // A -> B
 * NormalFormRenderer.render(analysis.dnf(), RenderStyle.UNICODE);  // "(A ∧ B) ∨ (¬A ∧ B) ∨ (¬A ∧ ¬B)"
 * NormalFormRenderer.render(analysis.cnf(), RenderStyle.ASCII);    // "(~A | B)"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class NormalFormRenderer {

    private NormalFormRenderer() {}

    public static String render(NormalForm form, RenderStyle style) {
        if (form.isSentinel()) {
            return form.type().sentinel() ? RenderStyle.TRUE : RenderStyle.FALSE;
        }
        String separator = " " + style.symbol(form.type().outer()) + " ";
        return form.clauses().stream()
            .map(clause -> render(clause, style))
            .collect(Collectors.joining(separator));
    }

    public static String render(Clause clause, RenderStyle style) {
        String separator = " " + style.symbol(clause.kind().connective()) + " ";
        String body = clause.literals().stream()
            .map(literal -> render(literal, style))
            .collect(Collectors.joining(separator));
        return clause.isSingleLiteral() ? body : "(" + body + ")";
    }

    public static String render(Literal literal, RenderStyle style) {
        return literal.negated() ? style.not() + literal.variable() : literal.variable();
    }
}
