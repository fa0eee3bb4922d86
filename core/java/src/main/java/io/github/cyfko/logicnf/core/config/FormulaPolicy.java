package io.github.cyfko.logicnf.core.config;

/**
 * Resource limits applied to untrusted formula input.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: maximum character length of the source text</li>
 *   <li><strong>maxVariables</strong>: maximum number of distinct variables; enumeration builds
 *       {@code 2^maxVariables} rows at most. Bounded to {@value #VARIABLE_CEILING}.</li>
 *   <li><strong>maxNestingDepth</strong>: maximum nesting of parentheses and negations in the
 *       text, and maximum depth of the resulting formula tree. A flat chain such as
 *       {@code A & B & C} is a tree as deep as its operator count.</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * FormulaPolicy policy = FormulaPolicy.defaults();
 *
 * // Strict (for public endpoints with untrusted input)
 * FormulaPolicy policy = FormulaPolicy.strict();
 *
 * // Relaxed (for internal trusted callers)
 * FormulaPolicy policy = FormulaPolicy.relaxed();
 *
 * // Custom
 * FormulaPolicy policy = FormulaPolicy.builder()
 *     .maxVariables(8)
 *     .build();
 * }</pre>
 *
 * @param policyName          name reported in error messages
 * @param maxExpressionLength maximum character length of the source text
 * @param maxVariables        maximum number of distinct variables
 * @param maxNestingDepth     maximum nesting depth
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FormulaPolicy(
    String policyName,
    int maxExpressionLength,
    int maxVariables,
    int maxNestingDepth
) {

    /**
     * Hard upper bound for {@link #maxVariables()}. A table at this bound has about a million rows
     * and its normal forms hold a million clauses between them.
     */
    public static final int VARIABLE_CEILING = 20;

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public FormulaPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
        if (maxVariables <= 0 || maxVariables > VARIABLE_CEILING) {
            throw new IllegalArgumentException(
                "maxVariables must be between 1 and " + VARIABLE_CEILING + ", got: " + maxVariables);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Max Expression Length: 5000 characters</li>
     *   <li>Max Variables: 16 (65 536 rows)</li>
     *   <li>Max Nesting Depth: 100</li>
     * </ul>
     *
     * @return default configuration
     */
    public static FormulaPolicy defaults() {
        return new FormulaPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, 16, 100);
    }

    /**
     * Strict configuration for untrusted input.
     * <ul>
     *   <li>Max Expression Length: 1000 characters</li>
     *   <li>Max Variables: 10 (1024 rows)</li>
     *   <li>Max Nesting Depth: 32</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static FormulaPolicy strict() {
        return new FormulaPolicy(PolicyName.STRICT_POLICY.name(), 1000, 10, 32);
    }

    /**
     * Relaxed configuration for trusted callers.
     * <ul>
     *   <li>Max Expression Length: 10000 characters</li>
     *   <li>Max Variables: 18 (262 144 rows)</li>
     *   <li>Max Nesting Depth: 500</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static FormulaPolicy relaxed() {
        return new FormulaPolicy(PolicyName.RELAXED_POLICY.name(), 10000, 18, 500);
    }

    /**
     * Creates a builder initialized with the {@link #defaults()} limits.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = 5000;
        private int _maxVariables = 16;
        private int _maxNestingDepth = 100;

        private Builder() {}

        public FormulaPolicy build() {
            return new FormulaPolicy(_policyName, _maxExpressionLength, _maxVariables, _maxNestingDepth);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder maxVariables(int maxVariables) { this._maxVariables = maxVariables; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
