package io.github.cyfko.metricql.core.exception;

/**
 * Exception thrown when a filter node is constructed in violation of its structural invariants.
 * <p>
 * The text parser never produces such nodes; this exception guards hand-built trees so that
 * the query compiler only ever sees well-formed input.
 * </p>
 *
 * <p><strong>Usage Examples:</strong></p>
 * <pre>{@code
 * new LogicalNode(LogicalOp.AND, List.of());
 * // → "AND requires at least one child"
 *
 * new LogicalNode(LogicalOp.NOT, List.of(a, b));
 * // → "NOT requires exactly one child, got 2"
 * }</pre>
 *
 * @since 1.0.0
 */
public class FilterDefinitionException extends RuntimeException {

    /**
     * Creates a new FilterDefinitionException with detailed message.
     *
     * @param message explanation of the violated invariant
     */
    public FilterDefinitionException(String message) {
        super(message);
    }

    /**
     * Creates a new FilterDefinitionException with detailed message and cause.
     *
     * @param message explanation of the failure
     * @param cause underlying exception causing this failure
     */
    public FilterDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
