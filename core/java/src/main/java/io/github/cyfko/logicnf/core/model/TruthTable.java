package io.github.cyfko.logicnf.core.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Complete truth table of a formula.
 * <p>
 * The table has exactly {@code 2^n} rows for {@code n} variables, ordered from the all-true row
 * down to the all-false row: row {@code k} holds the bits of {@code 2^n - 1 - k}, the first
 * variable being the most significant bit.
 * </p>
 *
 * <pre>
 *   A B | A -> B
 *   T T |   T
 *   T F |   F
 *   F T |   T
 *   F F |   T
 * </pre>
 *
 * @param variables canonical variable list (column order)
 * @param rows      rows in enumeration order
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TruthTable(List<String> variables, List<TruthTableRow> rows) {

    public TruthTable {
        Objects.requireNonNull(variables, "Variables cannot be null");
        Objects.requireNonNull(rows, "Rows cannot be null");
        variables = List.copyOf(variables);
        rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }

    /**
     * @return the formula's value for each row, in row order
     */
    public List<Boolean> results() {
        return rows.stream().map(TruthTableRow::result).collect(Collectors.toUnmodifiableList());
    }

    public List<TruthTableRow> trueRows() {
        return rows.stream().filter(TruthTableRow::result).collect(Collectors.toUnmodifiableList());
    }

    public List<TruthTableRow> falseRows() {
        return rows.stream().filter(row -> !row.result()).collect(Collectors.toUnmodifiableList());
    }
}
