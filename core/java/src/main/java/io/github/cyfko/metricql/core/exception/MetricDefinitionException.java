package io.github.cyfko.metricql.core.exception;

/**
 * Exception thrown when a metric request violates one of its construction invariants.
 * <p>
 * Metric model values validate themselves in their canonical constructors. An invalid
 * value is never clamped or corrected: construction fails with a message naming the
 * violated constraint.
 * </p>
 *
 * <p><strong>Common Scenarios:</strong></p>
 * <pre>{@code
 * new DistributionSpec(10, 50, 10);
 * // → "Lower bound must be less than upper bound (lower=50, upper=10)"
 *
 * new DistributionSpec(0, 0, 10);
 * // → "Bin count must be greater than 0, got 0"
 * }</pre>
 *
 * @see InvalidDistributionSpecException
 * @since 1.0.0
 */
public class MetricDefinitionException extends RuntimeException {

    /**
     * @param message explanation of the violated invariant
     */
    public MetricDefinitionException(String message) {
        super(message);
    }

    /**
     * @param message explanation of the failure
     * @param cause   underlying exception causing this failure
     */
    public MetricDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
