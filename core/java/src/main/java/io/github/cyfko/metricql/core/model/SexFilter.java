package io.github.cyfko.metricql.core.model;

import io.github.cyfko.metricql.core.api.FilterNode;
import io.github.cyfko.metricql.core.api.FilterVisitor;
import io.github.cyfko.metricql.core.exception.FilterDefinitionException;

/**
 * Restricts cases to one patient sex.
 *
 * @param value the sex to keep
 * @since 1.0.0
 */
public record SexFilter(SexType value) implements FilterNode {

    public SexFilter {
        if (value == null)
            throw new FilterDefinitionException("sex cannot be null");
    }

    @Override
    public <R> R accept(FilterVisitor<R> visitor) {
        return visitor.visitSex(this);
    }
}
