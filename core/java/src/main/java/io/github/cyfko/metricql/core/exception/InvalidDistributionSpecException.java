package io.github.cyfko.metricql.core.exception;

/**
 * Thrown when a {@code KPI:bins:lower:upper} distribution spec cannot be turned into a
 * distribution request: wrong field count, non-integer numbers, or numbers that violate
 * the distribution invariants.
 *
 * @since 1.0.0
 */
public class InvalidDistributionSpecException extends MetricDefinitionException {

    private final String spec;

    public InvalidDistributionSpecException(String spec, String reason) {
        super("Invalid distribution spec '" + spec + "': " + reason);
        this.spec = spec;
    }

    public InvalidDistributionSpecException(String spec, String reason, Throwable cause) {
        super("Invalid distribution spec '" + spec + "': " + reason, cause);
        this.spec = spec;
    }

    public InvalidDistributionSpecException(String spec, Throwable cause) {
        super("Invalid distribution spec '" + spec + "': " + cause.getMessage(), cause);
        this.spec = spec;
    }

    /**
     * @return the offending spec text, as supplied by the caller
     */
    public String getSpec() {
        return spec;
    }
}
