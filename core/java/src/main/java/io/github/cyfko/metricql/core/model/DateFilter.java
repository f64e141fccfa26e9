package io.github.cyfko.metricql.core.model;

import io.github.cyfko.metricql.core.api.Comparison;
import io.github.cyfko.metricql.core.api.FilterNode;
import io.github.cyfko.metricql.core.api.FilterVisitor;
import io.github.cyfko.metricql.core.exception.FilterDefinitionException;

import java.time.LocalDate;

/**
 * Discharge date comparison. Discharge is the only date field the backend filters on.
 *
 * @param operator the comparison
 * @param value    the calendar date to compare with
 * @since 1.0.0
 */
public record DateFilter(Comparison operator, LocalDate value) implements FilterNode {

    public DateFilter {
        if (operator == null)
            throw new FilterDefinitionException("date comparison operator cannot be null");
        if (value == null)
            throw new FilterDefinitionException("date value cannot be null");
    }

    @Override
    public <R> R accept(FilterVisitor<R> visitor) {
        return visitor.visitDate(this);
    }
}
