package io.github.cyfko.logicnf.core.analysis;

import io.github.cyfko.logicnf.core.model.Assignment;
import io.github.cyfko.logicnf.core.model.Clause;
import io.github.cyfko.logicnf.core.model.Literal;
import io.github.cyfko.logicnf.core.model.NormalForm;
import io.github.cyfko.logicnf.core.model.TruthTable;
import io.github.cyfko.logicnf.core.model.TruthTableRow;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds the canonical DNF and CNF of a formula from its truth table.
 *
 * <h2>DNF</h2>
 * <p>
 * One minterm per true row: each variable appears as-is if true in the row, negated if false.
 * The minterm is true for that row only. No true row gives the sentinel {@code False}.
 * </p>
 *
 * <h2>CNF</h2>
 * <p>
 * One maxterm per false row: each variable appears negated if true in the row, as-is if false.
 * The row's own assignment makes every literal false, and any other assignment flips at least
 * one of them, so the maxterm is false for that row only. No false row gives the sentinel
 * {@code True}.
 * </p>
 *
 * <pre>{@code
 * // A & B
 * NormalFormDeriver.deriveDnf(table);  // (A ∧ B)
 * NormalFormDeriver.deriveCnf(table);  // (¬A ∨ B) ∧ (A ∨ ¬B) ∧ (A ∨ B)
 * }</pre>
 *
 * <p>
 * Clauses follow row order and literals follow the variable list. The forms are not minimized.
 * Each form holds one {@link Literal} instance per variable and polarity, shared by its clauses.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class NormalFormDeriver {

    private NormalFormDeriver() {}

    /**
     * @param table the truth table
     * @return the DNF, one minterm per true row
     */
    public static NormalForm deriveDnf(TruthTable table) {
        return derive(NormalForm.Type.DNF, table);
    }

    /**
     * @param table the truth table
     * @return the CNF, one maxterm per false row
     */
    public static NormalForm deriveCnf(TruthTable table) {
        return derive(NormalForm.Type.CNF, table);
    }

    // a form keeps the rows whose result differs from its sentinel
    private static NormalForm derive(NormalForm.Type type, TruthTable table) {
        boolean keep = !type.sentinel();
        List<String> variables = table.variables();
        Literal[] positives = new Literal[variables.size()];
        Literal[] negatives = new Literal[variables.size()];
        for (int j = 0; j < variables.size(); j++) {
            positives[j] = Literal.positive(variables.get(j));
            negatives[j] = Literal.negative(variables.get(j));
        }

        List<Clause> clauses = new ArrayList<>();
        for (TruthTableRow row : table.rows()) {
            if (row.result() == keep) {
                clauses.add(clause(type.clauseKind(), row.assignment(), positives, negatives));
            }
        }
        return new NormalForm(type, clauses);
    }

    // a minterm repeats the row's values; a maxterm negates them
    private static Clause clause(Clause.Kind kind, Assignment assignment, Literal[] positives, Literal[] negatives) {
        boolean negateTrue = kind == Clause.Kind.DISJUNCTION;
        Literal[] literals = new Literal[positives.length];
        for (int j = 0; j < literals.length; j++) {
            boolean value = assignment.valueOf(positives[j].variable());
            literals[j] = value == negateTrue ? negatives[j] : positives[j];
        }
        return new Clause(kind, Arrays.asList(literals));
    }
}
