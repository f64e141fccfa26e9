package io.github.cyfko.metricql.core.config;

/**
 * Configuration of the filter-expression front end: input size limit and lexer strictness.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: Maximum character length of the expression (default: 5000)</li>
 *   <li><strong>rejectUnknownCharacters</strong>: Fail on characters no token rule matches
 *       instead of skipping them with a warning (default: false)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (lenient lexer, moderate length)
 * DslPolicy policy = DslPolicy.defaults();
 *
 * // Strict (for expressions typed by untrusted clients)
 * DslPolicy policy = DslPolicy.strict();
 *
 * // Relaxed (for generated expressions)
 * DslPolicy policy = DslPolicy.relaxed();
 *
 * // Custom
 * DslPolicy policy = DslPolicy.builder()
 *     .maxExpressionLength(2000)
 *     .rejectUnknownCharacters(true)
 *     .build();
 * }</pre>
 *
 * @param policyName              name of the preset, or {@code CUSTOM_POLICY}
 * @param maxExpressionLength     maximum character length of an expression string
 * @param rejectUnknownCharacters whether an unrecognized character aborts tokenization
 * @since 1.0.0
 */
public record DslPolicy(
        String policyName,
        int maxExpressionLength,
        boolean rejectUnknownCharacters
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the name is blank or the length is not positive
     */
    public DslPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Max Expression Length: 5000 characters</li>
     *   <li>Unknown characters: skipped and logged</li>
     * </ul>
     *
     * @return default configuration
     */
    public static DslPolicy defaults() {
        return new DslPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, false);
    }

    /**
     * Strict configuration for expressions from untrusted sources.
     * <ul>
     *   <li>Max Expression Length: 1000 characters</li>
     *   <li>Unknown characters: rejected</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static DslPolicy strict() {
        return new DslPolicy(PolicyName.STRICT_POLICY.name(), 1000, true);
    }

    /**
     * Relaxed configuration for machine-generated expressions.
     * <ul>
     *   <li>Max Expression Length: 10000 characters</li>
     *   <li>Unknown characters: skipped and logged</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static DslPolicy relaxed() {
        return new DslPolicy(PolicyName.RELAXED_POLICY.name(), 10000, false);
    }

    /**
     * Returns the preset matching {@code name}.
     *
     * @param name one of {@link PolicyName#DEFAULT_POLICY}, {@link PolicyName#STRICT_POLICY},
     *             {@link PolicyName#RELAXED_POLICY}
     * @return the preset
     * @throws IllegalArgumentException for {@link PolicyName#CUSTOM_POLICY}, which has no preset
     */
    public static DslPolicy preset(PolicyName name) {
        return switch (name) {
            case DEFAULT_POLICY -> defaults();
            case STRICT_POLICY -> strict();
            case RELAXED_POLICY -> relaxed();
            case CUSTOM_POLICY -> throw new IllegalArgumentException("Custom policies must be built with DslPolicy.builder()");
        };
    }

    /**
     * Creates a custom configuration.
     * <p>
     * Builder parameters are initialized exactly as in {@link #defaults()}.
     * </p>
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = 5000;
        private boolean _rejectUnknownCharacters = false;

        private Builder() {}

        public DslPolicy build() {
            return new DslPolicy(_policyName, _maxExpressionLength, _rejectUnknownCharacters);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder rejectUnknownCharacters(boolean reject) { this._rejectUnknownCharacters = reject; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
