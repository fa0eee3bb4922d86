package io.github.cyfko.logicnf.core.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Formula Tests")
class FormulaTest {

    @Test
    @DisplayName("Should reject empty or null variable names and null children")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> Formula.var(""));
        assertThrows(NullPointerException.class, () -> Formula.var(null));
        assertThrows(NullPointerException.class, () -> Formula.not(null));
        assertThrows(NullPointerException.class, () -> Formula.and(Formula.var("A"), null));
    }

    @Test
    @DisplayName("Should compare trees structurally")
    void testStructuralEquality() {
        assertEquals(Formula.and(Formula.var("A"), Formula.var("B")), Formula.and(Formula.var("A"), Formula.var("B")));
        assertNotEquals(Formula.and(Formula.var("A"), Formula.var("B")), Formula.and(Formula.var("B"), Formula.var("A")));
    }

    @ParameterizedTest(name = "{0}({1}, {2}) = {3}")
    @CsvSource({
        "AND,     true,  false, false",
        "AND,     true,  true,  true",
        "OR,      false, false, false",
        "OR,      false, true,  true",
        "IMPLIES, true,  false, false",
        "IMPLIES, false, false, true",
        "EQUIV,   false, false, true",
        "EQUIV,   true,  false, false"
    })
    @DisplayName("Connectives should follow their truth tables")
    void testConnectives(Connective connective, boolean left, boolean right, boolean expected) {
        assertEquals(expected, connective.apply(left, right));
    }

    @Test
    @DisplayName("Binding strength should decrease from AND to EQUIV")
    void testBindingStrength() {
        assertTrue(Connective.AND.bindingStrength() > Connective.OR.bindingStrength());
        assertTrue(Connective.OR.bindingStrength() > Connective.IMPLIES.bindingStrength());
        assertTrue(Connective.IMPLIES.bindingStrength() > Connective.EQUIV.bindingStrength());
    }
}
