package io.github.cyfko.logicnf.core.model;

import io.github.cyfko.logicnf.core.api.Connective;
import io.github.cyfko.logicnf.core.api.Formula;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Disjunctive or conjunctive normal form of a formula, as an ordered list of clauses.
 * <p>
 * An empty clause list is the sentinel constant of the form: {@code False} for a DNF (no row is
 * true) and {@code True} for a CNF (no row is false).
 * </p>
 *
 * @param type    DNF or CNF
 * @param clauses clauses in truth-table row order
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record NormalForm(Type type, List<Clause> clauses) {

    public enum Type {
        /** OR of minterms; {@code False} when empty. */
        DNF(Connective.OR, Clause.Kind.CONJUNCTION, false),
        /** AND of maxterms; {@code True} when empty. */
        CNF(Connective.AND, Clause.Kind.DISJUNCTION, true);

        private final Connective outer;
        private final Clause.Kind clauseKind;
        private final boolean sentinel;

        Type(Connective outer, Clause.Kind clauseKind, boolean sentinel) {
            this.outer = outer;
            this.clauseKind = clauseKind;
            this.sentinel = sentinel;
        }

        /**
         * @return the connective joining clauses
         */
        public Connective outer() {
            return outer;
        }

        public Clause.Kind clauseKind() {
            return clauseKind;
        }

        /**
         * @return the constant an empty form of this type stands for
         */
        public boolean sentinel() {
            return sentinel;
        }
    }

    public NormalForm {
        Objects.requireNonNull(type, "Normal form type cannot be null");
        Objects.requireNonNull(clauses, "Clauses cannot be null");
        clauses = List.copyOf(clauses);
        for (Clause clause : clauses) {
            if (clause.kind() != type.clauseKind()) {
                throw new IllegalArgumentException(type + " clauses must be " + type.clauseKind() + ", got " + clause.kind());
            }
        }
    }

    /**
     * @return true if this form has no clause and stands for a constant
     */
    public boolean isSentinel() {
        return clauses.isEmpty();
    }

    /**
     * @param values variable values
     * @return the form's value
     */
    public boolean evaluate(Map<String, Boolean> values) {
        if (isSentinel()) {
            return type.sentinel();
        }
        if (type == Type.DNF) {
            return clauses.stream().anyMatch(clause -> clause.evaluate(values));
        }
        return clauses.stream().allMatch(clause -> clause.evaluate(values));
    }

    public boolean evaluate(Assignment assignment) {
        return evaluate(assignment.asMap());
    }

    /**
     * Rebuilds the form as a formula tree. Clauses are joined as a balanced tree, so the result
     * is about {@code log2(clauses)} levels deeper than its deepest clause.
     *
     * @return the tree, or empty for a sentinel (the formula language has no constants)
     */
    public Optional<Formula> toFormula() {
        if (isSentinel()) {
            return Optional.empty();
        }
        return Optional.of(join(0, clauses.size()));
    }

    private Formula join(int from, int to) {
        if (to - from == 1) {
            return clauses.get(from).toFormula();
        }
        int mid = (from + to) >>> 1;
        return new Formula.Binary(type.outer(), join(from, mid), join(mid, to));
    }
}
