package io.github.cyfko.metricql.core.exception;

import io.github.cyfko.metricql.core.alias.AliasFamily;

/**
 * Thrown by the filter parser when a condition matches none of the dispatch rules:
 * its identifier is not a numeric or date field, its value is neither a sex nor a stroke
 * subtype, and its identifier is not a boolean clinical property either.
 *
 * <pre>{@code
 * parser.parseFilterString("AND(FOO==BAR)");
 * // → "Unknown identifier or unsupported filter: FOO"
 * }</pre>
 *
 * @since 1.0.0
 */
public class UnknownIdentifierException extends UnknownAliasException {

    public UnknownIdentifierException(String identifier) {
        super(AliasFamily.BOOLEAN_PROPERTY, identifier, "Unknown identifier or unsupported filter: " + identifier);
    }
}
