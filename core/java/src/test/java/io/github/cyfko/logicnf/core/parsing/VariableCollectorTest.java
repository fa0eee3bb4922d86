package io.github.cyfko.logicnf.core.parsing;

import io.github.cyfko.logicnf.core.api.Formula;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("VariableCollector Tests")
class VariableCollectorTest {

    private static List<String> collect(String input) {
        return VariableCollector.collect(PrecedenceClimbingParser.parse(FormulaTokenizer.tokenize(input), 100));
    }

    @Test
    @DisplayName("Should list each variable once")
    void testDeduplication() {
        assertEquals(List.of("A", "B"), collect("(A & B) | (~A & B) | A"));
    }

    @Test
    @DisplayName("Should sort names by code unit, upper case before lower case")
    void testOrdinalOrder() {
        assertEquals(List.of("A_", "B", "a", "a1", "b"), collect("b & a1 | B -> a <-> A_"));
    }

    @Test
    @DisplayName("Should sort numeric suffixes as text")
    void testNumericSuffixes() {
        assertEquals(List.of("V1", "V10", "V2"), collect("V2 & V10 & V1"));
    }

    @Test
    @DisplayName("Should not depend on where variables appear in the tree")
    void testTraversalIndependence() {
        assertEquals(collect("C -> (B & A)"), collect("(A | B) <-> ~C"));
    }

    @Test
    @DisplayName("Should return an unmodifiable list")
    void testUnmodifiable() {
        List<String> variables = VariableCollector.collect(Formula.var("A"));

        assertThrows(UnsupportedOperationException.class, () -> variables.add("B"));
    }
}
