package io.github.cyfko.metricql.core.entity;

import io.github.cyfko.metricql.core.api.FilterNode;
import io.github.cyfko.metricql.core.model.MetricsCollection;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of translating an entity list: the case filter, if any condition survived, and the
 * requested metrics.
 *
 * @param filter  the top-level AND of all conditions, or empty
 * @param metrics the metrics and optional grouping, possibly without metrics
 * @since 1.0.0
 */
public record EntityTranslation(Optional<FilterNode> filter, MetricsCollection metrics) {

    public EntityTranslation {
        Objects.requireNonNull(filter, "filter");
        Objects.requireNonNull(metrics, "metrics");
    }
}
