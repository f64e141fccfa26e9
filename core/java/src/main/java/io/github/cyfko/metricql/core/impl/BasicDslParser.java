package io.github.cyfko.metricql.core.impl;

import io.github.cyfko.metricql.core.alias.AliasRegistry;
import io.github.cyfko.metricql.core.api.DslParser;
import io.github.cyfko.metricql.core.api.FilterNode;
import io.github.cyfko.metricql.core.config.DslPolicy;
import io.github.cyfko.metricql.core.exception.DSLSyntaxException;
import io.github.cyfko.metricql.core.parsing.FilterLexer;
import io.github.cyfko.metricql.core.parsing.FilterParser;

/**
 * Default {@link DslParser}: enforces the {@link DslPolicy} limits, then tokenizes with a
 * {@link FilterLexer} and parses with a {@link FilterParser}.
 *
 * <h2>Input Limits</h2>
 * <p>
 * The expression is trimmed before any check. Blank expressions and expressions longer than
 * {@link DslPolicy#maxExpressionLength()} are rejected with a {@link DSLSyntaxException}
 * before tokenization.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * // Default configuration (lenient lexer)
 * DslParser parser = new BasicDslParser();
 * FilterNode filter = parser.parse("AND(AGE>=50, SEX==MALE)");
 *
 * // Strict configuration: "AND(AGE>=50; SEX==MALE)" fails on ';'
 * DslParser strictParser = new BasicDslParser(DslPolicy.strict());
 *
 * // Custom aliases
 * DslParser custom = new BasicDslParser(DslPolicy.defaults(), myRegistry);
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe.</p>
 *
 * @since 1.0.0
 */
public class BasicDslParser implements DslParser {

    private final DslPolicy dslPolicy;
    private final FilterParser parser;

    /**
     * Default constructor using {@link DslPolicy#defaults()} and the bundled aliases.
     */
    public BasicDslParser() {
        this(DslPolicy.defaults());
    }

    /**
     * @param dslPolicy the parser configuration
     * @throws IllegalArgumentException if dslPolicy is null
     */
    public BasicDslParser(DslPolicy dslPolicy) {
        this(dslPolicy, AliasRegistry.defaults());
    }

    /**
     * @param dslPolicy the parser configuration
     * @param registry  the aliases used to resolve operators and condition values
     * @throws IllegalArgumentException if an argument is null
     */
    public BasicDslParser(DslPolicy dslPolicy, AliasRegistry registry) {
        if (dslPolicy == null) {
            throw new IllegalArgumentException("DSL policy is required");
        }
        if (registry == null) {
            throw new IllegalArgumentException("Alias registry is required");
        }
        this.dslPolicy = dslPolicy;
        this.parser = new FilterParser(new FilterLexer(dslPolicy), registry);
    }

    /**
     * Parses the given expression.
     *
     * @param dslExpression the expression to parse
     * @return the root logical node of the filter tree
     * @throws DSLSyntaxException if the expression is {@code null}, blank, too long or malformed
     */
    @Override
    public FilterNode parse(String dslExpression) throws DSLSyntaxException {
        if (dslExpression == null || dslExpression.isBlank()) {
            throw new DSLSyntaxException("Filter expression cannot be null or empty");
        }

        String trimmed = dslExpression.trim();
        if (trimmed.length() > dslPolicy.maxExpressionLength()) {
            throw new DSLSyntaxException(String.format(
                    "Expression too long (%d characters, max: %d). Policy applied: %s",
                    trimmed.length(), dslPolicy.maxExpressionLength(), dslPolicy.policyName()));
        }

        return parser.parseFilterString(trimmed);
    }

    public DslPolicy getDslPolicy() {
        return dslPolicy;
    }
}
