package io.github.cyfko.metricql.core.model;

import io.github.cyfko.metricql.core.exception.MetricDefinitionException;

import java.util.Optional;

/**
 * One requested metric.
 *
 * @param kpi          the metric identifier
 * @param stats        whether summary statistics are selected besides the case count
 * @param distribution optional histogram; a {@code null} argument is normalized to empty
 * @since 1.0.0
 */
public record MetricSpec(Kpi kpi, boolean stats, Optional<DistributionSpec> distribution) {

    public MetricSpec {
        if (kpi == null) {
            throw new MetricDefinitionException("KPI cannot be null");
        }
        if (distribution == null) {
            distribution = Optional.empty();
        }
    }

    /**
     * A metric with the case count only.
     */
    public MetricSpec(Kpi kpi) {
        this(kpi, false, Optional.empty());
    }

    /**
     * @param distribution the histogram, or {@code null} for none
     */
    public MetricSpec(Kpi kpi, boolean stats, DistributionSpec distribution) {
        this(kpi, stats, Optional.ofNullable(distribution));
    }
}
