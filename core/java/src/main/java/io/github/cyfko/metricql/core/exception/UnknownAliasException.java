package io.github.cyfko.metricql.core.exception;

import io.github.cyfko.metricql.core.alias.AliasFamily;
import io.github.cyfko.metricql.core.alias.AliasRegistry;

/**
 * Exception thrown when free-form text matches neither the canonical name nor any alias
 * of an enumeration family.
 * <p>
 * Resolution is exact (after trimming and lowercasing), never fuzzy. The exception carries
 * the family that was searched and the offending text so that callers can render the
 * valid choices with {@link AliasRegistry#describe(AliasFamily)}.
 * </p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * try {
 *     SexType sex = registry.resolve(SexType.class, "martian");
 * } catch (UnknownAliasException e) {
 *     // e.getFamily() == AliasFamily.SEX, e.getText() == "martian"
 *     String hint = registry.describe(e.getFamily());
 * }
 * }</pre>
 *
 * @see UnknownIdentifierException
 * @see UnknownKpiException
 * @see UnknownGroupByException
 * @since 1.0.0
 */
public class UnknownAliasException extends RuntimeException {

    private final AliasFamily family;
    private final String text;

    /**
     * @param family the family that was searched
     * @param text   the text that failed to resolve
     */
    public UnknownAliasException(AliasFamily family, String text) {
        this(family, text, String.format("Invalid value '%s' for %s", text, family.displayName()));
    }

    /**
     * @param family  the family that was searched
     * @param text    the text that failed to resolve
     * @param message a custom message
     */
    protected UnknownAliasException(AliasFamily family, String text, String message) {
        super(message);
        this.family = family;
        this.text = text;
    }

    public AliasFamily getFamily() {
        return family;
    }

    public String getText() {
        return text;
    }
}
