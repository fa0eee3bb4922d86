package io.github.cyfko.logicnf.core.impl;

import io.github.cyfko.logicnf.core.api.Formula;
import io.github.cyfko.logicnf.core.api.FormulaParser;
import io.github.cyfko.logicnf.core.config.FormulaPolicy;
import io.github.cyfko.logicnf.core.exception.ExpressionTooLongException;
import io.github.cyfko.logicnf.core.parsing.FormulaTokenizer;
import io.github.cyfko.logicnf.core.parsing.PrecedenceClimbingParser;
import io.github.cyfko.logicnf.core.parsing.Token;

import java.util.List;
import java.util.Objects;

/**
 * Default {@link FormulaParser}: a tokenizer pass followed by a precedence-climbing parse,
 * both bounded by a {@link FormulaPolicy}.
 *
 * <h2>Phases</h2>
 * <ol>
 *   <li>Length check against {@link FormulaPolicy#maxExpressionLength()}</li>
 *   <li>{@link FormulaTokenizer#tokenize(String)} - source text to tokens</li>
 *   <li>{@link PrecedenceClimbingParser#parse(List, int)} - tokens to tree, nesting bounded by
 *       {@link FormulaPolicy#maxNestingDepth()}</li>
 * </ol>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * // Default configuration
 * FormulaParser parser = new BasicFormulaParser();
 * Formula f = parser.parse("(A & B) -> C");
 *
 * // Strict configuration (for public endpoints)
 * FormulaParser strictParser = new BasicFormulaParser(FormulaPolicy.strict());
 * }</pre>
 *
 * <p>Instances hold no mutable state and can be shared between threads.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicFormulaParser implements FormulaParser {

    private final FormulaPolicy policy;

    /**
     * Parser using {@link FormulaPolicy#defaults()}.
     */
    public BasicFormulaParser() {
        this(FormulaPolicy.defaults());
    }

    /**
     * @param policy the limits to enforce
     * @throws IllegalArgumentException if policy is null
     */
    public BasicFormulaParser(FormulaPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Formula policy is required");
        }
        this.policy = policy;
    }

    public FormulaPolicy getPolicy() {
        return policy;
    }

    @Override
    public Formula parse(String text) {
        Objects.requireNonNull(text, "Formula text cannot be null");

        String trimmed = text.trim();
        if (trimmed.length() > policy.maxExpressionLength()) {
            throw new ExpressionTooLongException(trimmed.length(), policy.maxExpressionLength(), policy.policyName());
        }

        List<Token> tokens = FormulaTokenizer.tokenize(text);
        return PrecedenceClimbingParser.parse(tokens, policy.maxNestingDepth());
    }
}
