package io.github.cyfko.logicnf.core.model;

import io.github.cyfko.logicnf.core.api.Formula;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Complete result of analyzing one formula.
 *
 * @param formula    the parsed formula
 * @param variables  canonical variable list
 * @param truthTable all {@code 2^n} rows
 * @param dnf        disjunctive normal form (one minterm per true row)
 * @param cnf        conjunctive normal form (one maxterm per false row)
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FormulaAnalysis(
    Formula formula,
    List<String> variables,
    TruthTable truthTable,
    NormalForm dnf,
    NormalForm cnf
) {

    public FormulaAnalysis {
        Objects.requireNonNull(formula, "Formula cannot be null");
        Objects.requireNonNull(truthTable, "Truth table cannot be null");
        Objects.requireNonNull(dnf, "DNF cannot be null");
        Objects.requireNonNull(cnf, "CNF cannot be null");
        variables = List.copyOf(variables);
    }

    /**
     * @return true if every row is true
     */
    public boolean isTautology() {
        return cnf.isSentinel();
    }

    /**
     * @return true if every row is false
     */
    public boolean isContradiction() {
        return dnf.isSentinel();
    }

    /**
     * @return true if at least one row is true
     */
    public boolean isSatisfiable() {
        return !dnf.isSentinel();
    }

    /**
     * @return assignments of the true rows, in row order
     */
    public List<Assignment> satisfyingAssignments() {
        return truthTable.trueRows().stream()
            .map(TruthTableRow::assignment)
            .collect(Collectors.toUnmodifiableList());
    }
}
