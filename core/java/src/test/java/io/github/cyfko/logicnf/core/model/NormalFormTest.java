package io.github.cyfko.logicnf.core.model;

import io.github.cyfko.logicnf.core.api.Formula;
import io.github.cyfko.logicnf.core.exception.UnboundVariableException;
import io.github.cyfko.logicnf.core.parsing.FormulaEvaluator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.github.cyfko.logicnf.core.model.Literal.negative;
import static io.github.cyfko.logicnf.core.model.Literal.positive;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the value types behind truth tables and normal forms.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("Normal form model Tests")
class NormalFormTest {

    @Nested
    @DisplayName("Assignment")
    class AssignmentTests {

        @Test
        @DisplayName("Should keep values aligned with variables")
        void testAlignment() {
            Assignment assignment = Assignment.of(List.of("A", "B"), List.of(true, false));

            assertTrue(assignment.valueOf("A"));
            assertFalse(assignment.valueOf("B"));
            assertEquals(List.of("A", "B"), List.copyOf(assignment.asMap().keySet()));
            assertEquals(2, assignment.size());
        }

        @Test
        @DisplayName("Should reject mismatched sizes and duplicate names")
        void testInvalid() {
            assertThrows(IllegalArgumentException.class, () -> Assignment.of(List.of("A"), List.of(true, false)));
            assertThrows(IllegalArgumentException.class, () -> Assignment.of(List.of("A", "A"), List.of(true, false)));
        }

        @Test
        @DisplayName("Should report an unknown variable")
        void testUnknownVariable() {
            Assignment assignment = Assignment.of(List.of("A"), List.of(true));

            UnboundVariableException exception = assertThrows(UnboundVariableException.class, () -> assignment.valueOf("B"));
            assertEquals("B", exception.getVariable());
        }

        @Test
        @DisplayName("Should derive rows from bits while sharing the variable list")
        void testWithBits() {
            Assignment template = Assignment.of(List.of("A", "B", "C"), List.of(false, false, false));

            Assignment row = template.withBits(6);

            assertEquals(List.of(true, true, false), row.values());
            assertTrue(row.valueOf("B"));
            assertSame(template.variables(), row.variables());
            assertEquals(Assignment.of(List.of("A", "B", "C"), List.of(true, true, false)), row);
            assertThrows(IllegalArgumentException.class, () -> template.withBits(8));
            assertThrows(IllegalArgumentException.class, () -> template.withBits(-1));
        }

        @Test
        @DisplayName("Should compare by content")
        void testEquality() {
            assertEquals(Assignment.of(List.of("A"), List.of(true)), Assignment.of(List.of("A"), List.of(true)));
            assertNotEquals(Assignment.of(List.of("A"), List.of(true)), Assignment.of(List.of("A"), List.of(false)));
        }
    }

    @Nested
    @DisplayName("Clause")
    class ClauseTests {

        @Test
        @DisplayName("Should reject an empty clause")
        void testEmpty() {
            assertThrows(IllegalArgumentException.class, () -> new Clause(Clause.Kind.CONJUNCTION, List.of()));
        }

        @Test
        @DisplayName("Should evaluate a minterm as a conjunction and a maxterm as a disjunction")
        void testEvaluate() {
            Map<String, Boolean> values = Map.of("A", true, "B", false);
            List<Literal> literals = List.of(positive("A"), positive("B"));

            assertFalse(new Clause(Clause.Kind.CONJUNCTION, literals).evaluate(values));
            assertTrue(new Clause(Clause.Kind.DISJUNCTION, literals).evaluate(values));
        }

        @Test
        @DisplayName("Should rebuild a left-nested formula")
        void testToFormula() {
            Clause clause = new Clause(Clause.Kind.DISJUNCTION, List.of(negative("A"), positive("B"), positive("C")));

            Formula expected = Formula.or(Formula.or(Formula.not(Formula.var("A")), Formula.var("B")), Formula.var("C"));
            assertEquals(expected, clause.toFormula());
        }
    }

    @Nested
    @DisplayName("NormalForm")
    class FormTests {

        @Test
        @DisplayName("Should reject clauses of the wrong kind")
        void testWrongClauseKind() {
            Clause maxterm = new Clause(Clause.Kind.DISJUNCTION, List.of(positive("A")));

            assertThrows(IllegalArgumentException.class, () -> new NormalForm(NormalForm.Type.DNF, List.of(maxterm)));
        }

        @Test
        @DisplayName("Should evaluate empty forms to their sentinel")
        void testSentinels() {
            NormalForm dnf = new NormalForm(NormalForm.Type.DNF, List.of());
            NormalForm cnf = new NormalForm(NormalForm.Type.CNF, List.of());

            assertFalse(dnf.evaluate(Map.of()));
            assertTrue(cnf.evaluate(Map.of()));
            assertTrue(dnf.toFormula().isEmpty());
            assertTrue(cnf.toFormula().isEmpty());
        }

        @Test
        @DisplayName("Should rebuild a large form as a shallow tree")
        void testLargeFormToFormula() {
            List<Clause> clauses = new ArrayList<>();
            for (int i = 0; i < 100_000; i++) {
                clauses.add(new Clause(Clause.Kind.DISJUNCTION, List.of(positive("A"))));
            }
            clauses.add(new Clause(Clause.Kind.DISJUNCTION, List.of(positive("B"))));
            NormalForm cnf = new NormalForm(NormalForm.Type.CNF, clauses);

            Formula formula = cnf.toFormula().orElseThrow();

            assertTrue(FormulaEvaluator.evaluate(formula, Map.of("A", true, "B", true)));
            assertFalse(FormulaEvaluator.evaluate(formula, Map.of("A", true, "B", false)));
        }

        @Test
        @DisplayName("Should rebuild a DNF as an OR of conjunctions")
        void testToFormula() {
            NormalForm dnf = new NormalForm(NormalForm.Type.DNF, List.of(
                new Clause(Clause.Kind.CONJUNCTION, List.of(positive("A"), positive("B"))),
                new Clause(Clause.Kind.CONJUNCTION, List.of(negative("A"), negative("B")))
            ));

            Formula expected = Formula.or(
                Formula.and(Formula.var("A"), Formula.var("B")),
                Formula.and(Formula.not(Formula.var("A")), Formula.not(Formula.var("B"))));
            assertEquals(expected, dnf.toFormula().orElseThrow());
        }
    }
}
