package io.github.cyfko.metricql.core.model;

import io.github.cyfko.metricql.core.api.FilterNode;
import io.github.cyfko.metricql.core.api.FilterVisitor;
import io.github.cyfko.metricql.core.exception.FilterDefinitionException;

/**
 * Tests a yes/no clinical property such as a treatment or a pre-stroke medication.
 *
 * @param property the property
 * @param value    the expected value
 * @since 1.0.0
 */
public record BooleanFilter(BooleanProperty property, boolean value) implements FilterNode {

    public BooleanFilter {
        if (property == null)
            throw new FilterDefinitionException("boolean property cannot be null");
    }

    @Override
    public <R> R accept(FilterVisitor<R> visitor) {
        return visitor.visitBoolean(this);
    }
}
