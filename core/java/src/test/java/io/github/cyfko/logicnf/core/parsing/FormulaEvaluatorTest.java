package io.github.cyfko.logicnf.core.parsing;

import io.github.cyfko.logicnf.core.api.Formula;
import io.github.cyfko.logicnf.core.exception.UnboundVariableException;
import io.github.cyfko.logicnf.core.model.Assignment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static io.github.cyfko.logicnf.core.api.Formula.and;
import static io.github.cyfko.logicnf.core.api.Formula.equiv;
import static io.github.cyfko.logicnf.core.api.Formula.implies;
import static io.github.cyfko.logicnf.core.api.Formula.not;
import static io.github.cyfko.logicnf.core.api.Formula.or;
import static io.github.cyfko.logicnf.core.api.Formula.var;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FormulaEvaluator}: truth functions of each node shape and unbound variables.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("FormulaEvaluator Tests")
class FormulaEvaluatorTest {

    private static final Formula A = var("A");
    private static final Formula B = var("B");

    private static boolean eval(Formula formula, boolean a, boolean b) {
        return FormulaEvaluator.evaluate(formula, Map.of("A", a, "B", b));
    }

    @ParameterizedTest(name = "A={0}, B={1}")
    @CsvSource({
        // A,     B,     and,   or,    implies, equiv
        "true,  true,  true,  true,  true,  true",
        "true,  false, false, true,  false, false",
        "false, true,  false, true,  true,  false",
        "false, false, false, false, true,  true"
    })
    @DisplayName("Should apply the truth function of each connective")
    void testConnectives(boolean a, boolean b, boolean and, boolean or, boolean implies, boolean equiv) {
        assertEquals(and, eval(and(A, B), a, b));
        assertEquals(or, eval(or(A, B), a, b));
        assertEquals(implies, eval(implies(A, B), a, b));
        assertEquals(equiv, eval(equiv(A, B), a, b));
    }

    @Test
    @DisplayName("Should negate and cancel double negation")
    void testNegation() {
        assertFalse(eval(not(A), true, false));
        assertTrue(eval(not(A), false, false));
        assertTrue(eval(not(not(A)), true, false));
        assertFalse(eval(not(not(A)), false, false));
    }

    @Test
    @DisplayName("Should evaluate under an Assignment")
    void testAssignment() {
        Assignment assignment = Assignment.of(List.of("A", "B"), List.of(true, false));

        assertFalse(FormulaEvaluator.evaluate(implies(A, B), assignment));
        assertTrue(FormulaEvaluator.evaluate(implies(B, A), assignment));
    }

    @Test
    @DisplayName("Should reject an assignment missing a referenced variable")
    void testUnboundVariable() {
        UnboundVariableException exception = assertThrows(UnboundVariableException.class,
            () -> FormulaEvaluator.evaluate(and(A, var("C")), Map.of("A", true, "B", true)));

        assertEquals("C", exception.getVariable());
    }

    @Test
    @DisplayName("Should report a missing variable even when the other operand decides the result")
    void testUnboundVariableNotShortCircuited() {
        assertThrows(UnboundVariableException.class,
            () -> FormulaEvaluator.evaluate(or(A, var("C")), Map.of("A", true)));
    }

    @Test
    @DisplayName("Should ignore extra variables in the assignment")
    void testExtraVariables() {
        assertTrue(FormulaEvaluator.evaluate(A, Map.of("A", true, "Z", false)));
    }
}
