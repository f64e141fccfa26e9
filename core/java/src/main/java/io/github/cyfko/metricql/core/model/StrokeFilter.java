package io.github.cyfko.metricql.core.model;

import io.github.cyfko.metricql.core.api.FilterNode;
import io.github.cyfko.metricql.core.api.FilterVisitor;
import io.github.cyfko.metricql.core.exception.FilterDefinitionException;

/**
 * Restricts cases to one stroke subtype.
 *
 * @param value the subtype to keep
 * @since 1.0.0
 */
public record StrokeFilter(StrokeType value) implements FilterNode {

    public StrokeFilter {
        if (value == null)
            throw new FilterDefinitionException("stroke type cannot be null");
    }

    @Override
    public <R> R accept(FilterVisitor<R> visitor) {
        return visitor.visitStroke(this);
    }
}
