package io.github.cyfko.metricql.core.api;

import io.github.cyfko.metricql.core.exception.DSLSyntaxException;
import io.github.cyfko.metricql.core.exception.UnknownAliasException;

/**
 * Parser transforming a textual filter expression into a {@link FilterNode} tree.
 *
 * <h2>Grammar Specification (EBNF)</h2>
 * <pre>
 * filter     := OPERATOR '(' expr_list ')'
 * expr_list  := expr (',' expr)*
 * expr       := filter | condition
 * condition  := IDENT COMPARISON value
 * OPERATOR   := 'AND' | 'OR' | 'NOT'
 * COMPARISON := '==' | '!=' | '&gt;=' | '&lt;=' | '&gt;' | '&lt;'
 * IDENT      := [A-Z_]+
 * value      := IDENT | [0-9]+ | [0-9]{4}-[0-9]{2}-[0-9]{2}
 * </pre>
 *
 * <h2>Condition Dispatch</h2>
 * <p>
 * A condition is turned into a leaf by checking, in order:
 * </p>
 * <ol>
 *   <li>identifier {@code AGE}: age comparison with an integer value</li>
 *   <li>identifier {@code NIHSS}: admission NIHSS comparison with an integer value</li>
 *   <li>identifier {@code DISCHARGEDATE}: discharge date comparison with an ISO date value</li>
 *   <li>the <em>value</em> as a sex, then as a stroke subtype (identifier and operator ignored)</li>
 *   <li>the <em>identifier</em> as a boolean clinical property, true only for the value {@code TRUE}</li>
 * </ol>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * parser.parse("AND(AGE>=50, SEX==MALE)");
 * parser.parse("OR(STROKE==ICH, STROKE==SAH)");
 * parser.parse("AND(NOT(THROMBECTOMY==TRUE), DISCHARGEDATE>=2023-01-01)");
 * }</pre>
 *
 * <h3>Invalid Expression Examples</h3>
 * <pre>{@code
 * parser.parse("AND()");          // DSLSyntaxException: expected IDENT
 * parser.parse("AGE>=50");        // DSLSyntaxException: expected OPERATOR
 * parser.parse("AND(AGE>=50");    // DSLSyntaxException: expected RPAREN
 * parser.parse("AND(FOO==BAR)");  // UnknownIdentifierException
 * }</pre>
 *
 * @see FilterNode
 * @since 1.0.0
 */
public interface DslParser {

    /**
     * Parses a filter expression.
     *
     * @param dslExpression the expression to parse, must not be null
     * @return the root of the filter tree, always a logical node
     * @throws DSLSyntaxException   if the expression does not conform to the grammar
     * @throws UnknownAliasException if a condition or an operator cannot be resolved
     * @throws NullPointerException if dslExpression is null
     */
    FilterNode parse(String dslExpression) throws DSLSyntaxException;
}
