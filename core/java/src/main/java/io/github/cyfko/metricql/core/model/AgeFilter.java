package io.github.cyfko.metricql.core.model;

import io.github.cyfko.metricql.core.api.Comparison;
import io.github.cyfko.metricql.core.api.FilterNode;
import io.github.cyfko.metricql.core.api.FilterVisitor;
import io.github.cyfko.metricql.core.exception.FilterDefinitionException;

/**
 * Patient age comparison, in years.
 *
 * @param operator the comparison
 * @param value    the age to compare with
 * @since 1.0.0
 */
public record AgeFilter(Comparison operator, int value) implements FilterNode {

    public AgeFilter {
        if (operator == null)
            throw new FilterDefinitionException("age comparison operator cannot be null");
    }

    @Override
    public <R> R accept(FilterVisitor<R> visitor) {
        return visitor.visitAge(this);
    }
}
