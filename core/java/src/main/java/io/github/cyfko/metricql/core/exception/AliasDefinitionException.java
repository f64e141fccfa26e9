package io.github.cyfko.metricql.core.exception;

/**
 * Thrown while building an alias registry from a declarative source that is unreadable,
 * names a member its family does not have, or gives one alias to two members of the
 * same family.
 *
 * @since 1.0.0
 */
public class AliasDefinitionException extends RuntimeException {

    public AliasDefinitionException(String message) {
        super(message);
    }

    public AliasDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
