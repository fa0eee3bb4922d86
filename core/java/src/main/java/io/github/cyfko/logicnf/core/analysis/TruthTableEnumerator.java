package io.github.cyfko.logicnf.core.analysis;

import io.github.cyfko.logicnf.core.api.Formula;
import io.github.cyfko.logicnf.core.config.FormulaPolicy;
import io.github.cyfko.logicnf.core.exception.TooManyVariablesException;
import io.github.cyfko.logicnf.core.model.Assignment;
import io.github.cyfko.logicnf.core.model.TruthTable;
import io.github.cyfko.logicnf.core.model.TruthTableRow;
import io.github.cyfko.logicnf.core.parsing.FormulaEvaluator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates a formula under every assignment of its variables.
 *
 * <h2>Row order</h2>
 * <p>
 * For {@code n} variables the rows are indexed by {@code i} from {@code 2^n - 1} down to
 * {@code 0}. In row {@code i}, the variable at list position {@code j} takes bit
 * {@code n - j - 1} of {@code i}: the first variable is the most significant bit. The first
 * column therefore reads all-true then all-false, and the last column alternates.
 * </p>
 * <pre>
 *   i   A B C
 *   7   T T T
 *   6   T T F
 *   5   T F T
 *   ...
 *   0   F F F
 * </pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TruthTableEnumerator {

    private TruthTableEnumerator() {}

    /**
     * @param formula      the formula
     * @param variables    its canonical variable list
     * @param maxVariables largest accepted list size
     * @return the table with exactly {@code 2^variables.size()} rows
     * @throws TooManyVariablesException if the list is larger than {@code maxVariables}, checked
     *                                   before any row is built
     */
    public static TruthTable enumerate(Formula formula, List<String> variables, int maxVariables) {
        Objects.requireNonNull(formula, "Formula cannot be null");
        Objects.requireNonNull(variables, "Variables cannot be null");

        int n = variables.size();
        if (n > Math.min(maxVariables, FormulaPolicy.VARIABLE_CEILING)) {
            throw new TooManyVariablesException(n, Math.min(maxVariables, FormulaPolicy.VARIABLE_CEILING));
        }

        Assignment template = allFalse(variables);
        int rowCount = 1 << n;
        List<TruthTableRow> rows = new ArrayList<>(rowCount);
        for (int i = rowCount - 1; i >= 0; i--) {
            Assignment assignment = template.withBits(i);
            rows.add(new TruthTableRow(assignment, FormulaEvaluator.evaluate(formula, assignment)));
        }
        return new TruthTable(variables, rows);
    }

    static Assignment assignmentFor(int index, List<String> variables) {
        return allFalse(variables).withBits(index);
    }

    private static Assignment allFalse(List<String> variables) {
        return Assignment.of(variables, Collections.nCopies(variables.size(), false));
    }
}
