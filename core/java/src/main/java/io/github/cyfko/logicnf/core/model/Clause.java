package io.github.cyfko.logicnf.core.model;

import io.github.cyfko.logicnf.core.api.Connective;
import io.github.cyfko.logicnf.core.api.Formula;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Literals joined by a single connective: a conjunction (minterm of a DNF) or a disjunction
 * (maxterm of a CNF). Literal order follows the canonical variable list.
 *
 * @param kind     how the literals are joined
 * @param literals the literals, never empty
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Clause(Kind kind, List<Literal> literals) {

    public enum Kind {
        /** Literals joined by AND. */
        CONJUNCTION(Connective.AND),
        /** Literals joined by OR. */
        DISJUNCTION(Connective.OR);

        private final Connective connective;

        Kind(Connective connective) {
            this.connective = connective;
        }

        public Connective connective() {
            return connective;
        }
    }

    public Clause {
        Objects.requireNonNull(kind, "Clause kind cannot be null");
        Objects.requireNonNull(literals, "Literals cannot be null");
        if (literals.isEmpty()) {
            throw new IllegalArgumentException("A clause needs at least one literal");
        }
        literals = List.copyOf(literals);
    }

    /**
     * A single-literal clause needs no grouping when printed inside a larger form.
     *
     * @return true if the clause has exactly one literal
     */
    public boolean isSingleLiteral() {
        return literals.size() == 1;
    }

    /**
     * @param values variable values
     * @return the clause's value
     */
    public boolean evaluate(Map<String, Boolean> values) {
        if (kind == Kind.CONJUNCTION) {
            return literals.stream().allMatch(literal -> literal.evaluate(values));
        }
        return literals.stream().anyMatch(literal -> literal.evaluate(values));
    }

    /**
     * @return the clause as a left-nested formula tree
     */
    public Formula toFormula() {
        Formula result = literals.get(0).toFormula();
        for (int i = 1; i < literals.size(); i++) {
            result = new Formula.Binary(kind.connective(), result, literals.get(i).toFormula());
        }
        return result;
    }
}
