package io.github.cyfko.logicnf.core.model;

import io.github.cyfko.logicnf.core.exception.UnboundVariableException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Total mapping from an ordered list of variables to truth values.
 * <p>
 * Iteration order of {@link #asMap()} follows the variable list, so an assignment built from a
 * canonical variable list reads in truth-table column order.
 * </p>
 * <p>
 * Values are held in a {@code boolean[]}. Assignments derived with {@link #withBits(int)} share
 * the variable list and the column index of the assignment they come from, so a table of
 * {@code 2^n} rows stores one variable list, not {@code 2^n}. {@link #values()} and
 * {@link #asMap()} build their views on each call.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Assignment {

    private final List<String> variables;
    private final Map<String, Integer> columns;
    private final boolean[] values;

    private Assignment(List<String> variables, Map<String, Integer> columns, boolean[] values) {
        this.variables = variables;
        this.columns = columns;
        this.values = values;
    }

    /**
     * @param variables variable names, distinct
     * @param values    truth values aligned with {@code variables}
     * @return the assignment
     * @throws IllegalArgumentException if the lists differ in size or a name repeats
     * @throws NullPointerException     if a list or one of its elements is null
     */
    public static Assignment of(List<String> variables, List<Boolean> values) {
        Objects.requireNonNull(variables, "Variables cannot be null");
        Objects.requireNonNull(values, "Values cannot be null");
        if (variables.size() != values.size()) {
            throw new IllegalArgumentException(String.format(
                "Got %d values for %d variables", values.size(), variables.size()));
        }

        List<String> names = List.copyOf(variables);
        Map<String, Integer> columns = new HashMap<>();
        boolean[] array = new boolean[names.size()];
        for (int i = 0; i < names.size(); i++) {
            if (columns.put(names.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate variable: " + names.get(i));
            }
            array[i] = values.get(i);
        }
        return new Assignment(names, Collections.unmodifiableMap(columns), array);
    }

    /**
     * Assignment over the same variables whose values are the bits of {@code bits}: the variable
     * at position {@code j} takes bit {@code n - j - 1}, so the first variable is the most
     * significant bit.
     *
     * @param bits row index, in {@code [0, 2^n)}
     * @return the assignment
     * @throws IllegalArgumentException if {@code bits} is out of range
     */
    public Assignment withBits(int bits) {
        int n = values.length;
        if (bits < 0 || (n < Integer.SIZE - 1 && bits >= 1 << n)) {
            throw new IllegalArgumentException("Row index " + bits + " out of range for " + n + " variables");
        }
        boolean[] row = new boolean[n];
        for (int j = 0; j < n; j++) {
            row[j] = ((bits >> (n - j - 1)) & 1) == 1;
        }
        return new Assignment(variables, columns, row);
    }

    /**
     * @param variable variable name
     * @return its value
     * @throws UnboundVariableException if the variable is not part of this assignment
     */
    public boolean valueOf(String variable) {
        Integer column = columns.get(variable);
        if (column == null) {
            throw new UnboundVariableException(variable);
        }
        return values[column];
    }

    public List<String> variables() {
        return variables;
    }

    /**
     * @return values in variable order
     */
    public List<Boolean> values() {
        List<Boolean> list = new ArrayList<>(values.length);
        for (boolean value : values) {
            list.add(value);
        }
        return Collections.unmodifiableList(list);
    }

    public Map<String, Boolean> asMap() {
        Map<String, Boolean> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(variables.get(i), values[i]);
        }
        return Collections.unmodifiableMap(map);
    }

    public int size() {
        return values.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Assignment other)) return false;
        return variables.equals(other.variables) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * variables.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
