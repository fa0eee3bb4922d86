package io.github.cyfko.logicnf.core;

import io.github.cyfko.logicnf.core.analysis.NormalFormDeriver;
import io.github.cyfko.logicnf.core.analysis.TruthTableEnumerator;
import io.github.cyfko.logicnf.core.api.Formula;
import io.github.cyfko.logicnf.core.api.FormulaParser;
import io.github.cyfko.logicnf.core.config.FormulaPolicy;
import io.github.cyfko.logicnf.core.exception.FormulaException;
import io.github.cyfko.logicnf.core.exception.TooManyVariablesException;
import io.github.cyfko.logicnf.core.impl.BasicFormulaParser;
import io.github.cyfko.logicnf.core.model.FormulaAnalysis;
import io.github.cyfko.logicnf.core.model.NormalForm;
import io.github.cyfko.logicnf.core.model.TruthTable;
import io.github.cyfko.logicnf.core.parsing.VariableCollector;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * High-level facade running the whole compilation pipeline on a formula.
 *
 * <p><strong>Pipeline:</strong></p>
 * <ol>
 *   <li><strong>Parse:</strong> source text to {@link Formula} with a {@link FormulaParser}</li>
 *   <li><strong>Collect:</strong> canonical variable list with {@link VariableCollector}</li>
 *   <li><strong>Bound:</strong> reject more than {@link FormulaPolicy#maxVariables()} variables</li>
 *   <li><strong>Enumerate:</strong> all {@code 2^n} rows with {@link TruthTableEnumerator}</li>
 *   <li><strong>Derive:</strong> DNF and CNF with {@link NormalFormDeriver}</li>
 * </ol>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * FormulaAnalyzer analyzer = FormulaAnalyzer.of();
 *
 * FormulaAnalysis analysis = analyzer.analyze("(A & B) -> C");
 * analysis.variables();               // [A, B, C]
 * analysis.truthTable().size();       // 8
 * analysis.cnf().clauses().size();    // 1: (~A | ~B | C)
 *
 * String dnf = NormalFormRenderer.render(analysis.dnf(), RenderStyle.UNICODE);
 * }</pre>
 *
 * <p><strong>Error Handling:</strong></p>
 * <p>
 * Every call either returns a complete {@link FormulaAnalysis} or throws a single
 * {@link FormulaException}; no partial table or form is ever returned. See the subtypes of
 * {@link FormulaException} for the kinds.
 * </p>
 *
 * <p>Instances hold no mutable state and can be shared between threads.</p>
 *
 * @see FormulaParser
 * @see FormulaAnalysis
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FormulaAnalyzer {

    private static final Logger log = Logger.getLogger(FormulaAnalyzer.class.getName());

    private final FormulaParser parser;
    private final FormulaPolicy policy;

    private FormulaAnalyzer(FormulaParser parser, FormulaPolicy policy) {
        this.parser = Objects.requireNonNull(parser, "Formula parser cannot be null");
        this.policy = Objects.requireNonNull(policy, "Formula policy cannot be null");
    }

    /**
     * @return an analyzer using {@link BasicFormulaParser} and {@link FormulaPolicy#defaults()}
     */
    public static FormulaAnalyzer of() {
        return of(FormulaPolicy.defaults());
    }

    /**
     * @param policy limits applied to parsing and enumeration
     * @return an analyzer using {@link BasicFormulaParser} with the given policy
     */
    public static FormulaAnalyzer of(FormulaPolicy policy) {
        return new FormulaAnalyzer(new BasicFormulaParser(policy), policy);
    }

    /**
     * @param parser custom parser
     * @param policy limits applied to enumeration
     * @return an analyzer using the given parser
     */
    public static FormulaAnalyzer of(FormulaParser parser, FormulaPolicy policy) {
        return new FormulaAnalyzer(parser, policy);
    }

    public FormulaPolicy getPolicy() {
        return policy;
    }

    /**
     * Parses without analyzing.
     *
     * @param text formula source text
     * @return the formula tree
     * @throws FormulaException if the text is not a formula
     */
    public Formula parse(String text) {
        return parser.parse(text);
    }

    /**
     * Runs the full pipeline on source text.
     *
     * @param text formula source text
     * @return variables, truth table and normal forms
     * @throws FormulaException on the first failure of any phase
     */
    public FormulaAnalysis analyze(String text) {
        return analyze(parser.parse(text));
    }

    /**
     * Runs the pipeline on an already-built formula.
     *
     * @param formula the formula
     * @return variables, truth table and normal forms
     * @throws TooManyVariablesException if the formula has more variables than the policy allows
     */
    public FormulaAnalysis analyze(Formula formula) {
        Objects.requireNonNull(formula, "Formula cannot be null");
        long start = System.nanoTime();

        List<String> variables = VariableCollector.collect(formula);
        TruthTable table = enumerate(formula, variables);
        NormalForm dnf = NormalFormDeriver.deriveDnf(table);
        NormalForm cnf = NormalFormDeriver.deriveCnf(table);

        long durationMicros = (System.nanoTime() - start) / 1_000;
        log.fine(() -> String.format(
                "Analyzed formula: variables=%s, rows=%d, minterms=%d, maxterms=%d in %d µs",
                variables, table.size(), dnf.clauses().size(), cnf.clauses().size(), durationMicros
        ));

        return new FormulaAnalysis(formula, variables, table, dnf, cnf);
    }

    private TruthTable enumerate(Formula formula, List<String> variables) {
        try {
            return TruthTableEnumerator.enumerate(formula, variables, policy.maxVariables());
        } catch (TooManyVariablesException e) {
            log.warning(() -> String.format(
                    "Rejected formula with %d variables (max: %d, policy: %s)",
                    e.getVariableCount(), e.getMaxVariables(), policy.policyName()
            ));
            throw e;
        }
    }
}
