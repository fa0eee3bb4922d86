package io.github.cyfko.logicnf.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One row of a truth table: an assignment and the formula's value under it.
 *
 * @param assignment values of every variable for this row
 * @param result     the formula's value
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TruthTableRow(Assignment assignment, boolean result) {

    public TruthTableRow {
        Objects.requireNonNull(assignment, "Assignment cannot be null");
    }

    /**
     * @return variable values in column order
     */
    public List<Boolean> values() {
        return assignment.values();
    }
}
