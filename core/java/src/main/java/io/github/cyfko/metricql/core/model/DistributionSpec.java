package io.github.cyfko.metricql.core.model;

import io.github.cyfko.metricql.core.exception.MetricDefinitionException;

/**
 * Histogram request over a numeric metric.
 * <p>
 * The bounds also become the {@code kpiOptions} boundaries of the metric they belong to.
 * </p>
 *
 * <pre>{@code
 * new DistributionSpec(12, 0, 120);  // 12 bins between 0 and 120 minutes
 * new DistributionSpec(10, 50, 10);  // MetricDefinitionException
 * new DistributionSpec(0, 0, 10);    // MetricDefinitionException
 * }</pre>
 *
 * @param binCount number of bins, strictly positive
 * @param lower    lower boundary, strictly below {@code upper}
 * @param upper    upper boundary
 * @since 1.0.0
 */
public record DistributionSpec(int binCount, int lower, int upper) {

    /**
     * @throws MetricDefinitionException if {@code binCount <= 0} or {@code lower >= upper}
     */
    public DistributionSpec {
        if (binCount <= 0) {
            throw new MetricDefinitionException("Bin count must be greater than 0, got " + binCount);
        }
        if (lower >= upper) {
            throw new MetricDefinitionException(String.format(
                    "Lower bound must be less than upper bound (lower=%d, upper=%d)", lower, upper));
        }
    }
}
