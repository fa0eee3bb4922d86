package io.github.cyfko.logicnf.core.rendering;

import io.github.cyfko.logicnf.core.FormulaAnalyzer;
import io.github.cyfko.logicnf.core.config.RenderStyle;
import io.github.cyfko.logicnf.core.model.FormulaAnalysis;
import io.github.cyfko.logicnf.core.model.Literal;
import io.github.cyfko.logicnf.core.model.NormalForm;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link NormalFormRenderer}: clause grouping, outer connectives and sentinels.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("NormalFormRenderer Tests")
class NormalFormRendererTest {

    private final FormulaAnalyzer analyzer = FormulaAnalyzer.of();

    @Test
    @DisplayName("Should group multi-literal minterms and join them with OR")
    void testImplicationDnf() {
        FormulaAnalysis analysis = analyzer.analyze("A -> B");

        assertEquals("(A ∧ B) ∨ (¬A ∧ B) ∨ (¬A ∧ ¬B)", NormalFormRenderer.render(analysis.dnf(), RenderStyle.UNICODE));
        assertEquals("(A & B) | (~A & B) | (~A & ~B)", NormalFormRenderer.render(analysis.dnf(), RenderStyle.ASCII));
    }

    @Test
    @DisplayName("Should keep the parentheses of a lone multi-literal clause")
    void testSingleClause() {
        FormulaAnalysis analysis = analyzer.analyze("A -> B");

        assertEquals("(~A | B)", NormalFormRenderer.render(analysis.cnf(), RenderStyle.ASCII));
        assertEquals("(A ∧ B)", NormalFormRenderer.render(analyzer.analyze("A & B").dnf(), RenderStyle.UNICODE));
    }

    @Test
    @DisplayName("Should join maxterms with AND")
    void testConjunctionCnf() {
        FormulaAnalysis analysis = analyzer.analyze("A & B");

        assertEquals("(¬A ∨ B) ∧ (A ∨ ¬B) ∧ (A ∨ B)", NormalFormRenderer.render(analysis.cnf(), RenderStyle.UNICODE));
    }

    @Test
    @DisplayName("Should print single-literal clauses without parentheses")
    void testSingleLiteralClauses() {
        FormulaAnalysis analysis = analyzer.analyze("~A");

        assertEquals("~A", NormalFormRenderer.render(analysis.dnf(), RenderStyle.ASCII));
        assertEquals("~A", NormalFormRenderer.render(analysis.cnf(), RenderStyle.ASCII));
        assertEquals("A | ~A", NormalFormRenderer.render(analyzer.analyze("A | ~A").dnf(), RenderStyle.ASCII));
    }

    @Test
    @DisplayName("Should print sentinels as True and False")
    void testSentinels() {
        assertEquals("True", NormalFormRenderer.render(analyzer.analyze("A | ~A").cnf(), RenderStyle.ASCII));
        assertEquals("False", NormalFormRenderer.render(analyzer.analyze("A & ~A").dnf(), RenderStyle.UNICODE));
        assertEquals("True", NormalFormRenderer.render(new NormalForm(NormalForm.Type.CNF, List.of()), RenderStyle.UNICODE));
    }

    @Test
    @DisplayName("Should print literals in both styles")
    void testLiterals() {
        assertEquals("¬p", NormalFormRenderer.render(Literal.negative("p"), RenderStyle.UNICODE));
        assertEquals("~p", NormalFormRenderer.render(Literal.negative("p"), RenderStyle.ASCII));
        assertEquals("p", NormalFormRenderer.render(Literal.positive("p"), RenderStyle.ASCII));
    }
}
