package io.github.cyfko.metricql.core.model;

import io.github.cyfko.metricql.core.exception.MetricDefinitionException;

import java.util.List;
import java.util.Optional;

/**
 * The metrics of a query together with its optional grouping dimension.
 * <p>
 * The list keeps the requested order, which is also the field order of the compiled
 * document. It may be empty.
 * </p>
 *
 * @param metrics the requested metrics, copied into an unmodifiable list
 * @param groupBy the grouping dimension; a {@code null} argument is normalized to empty
 * @since 1.0.0
 */
public record MetricsCollection(List<MetricSpec> metrics, Optional<GroupBy> groupBy) {

    public MetricsCollection {
        if (metrics == null) {
            throw new MetricDefinitionException("Metric list cannot be null");
        }
        metrics = List.copyOf(metrics);
        if (groupBy == null) {
            groupBy = Optional.empty();
        }
    }

    /**
     * An ungrouped collection.
     */
    public MetricsCollection(List<MetricSpec> metrics) {
        this(metrics, Optional.empty());
    }

    /**
     * @param groupBy the grouping dimension, or {@code null} for none
     */
    public MetricsCollection(List<MetricSpec> metrics, GroupBy groupBy) {
        this(metrics, Optional.ofNullable(groupBy));
    }

    public static MetricsCollection empty() {
        return new MetricsCollection(List.of());
    }

    public boolean isEmpty() {
        return metrics.isEmpty();
    }
}
