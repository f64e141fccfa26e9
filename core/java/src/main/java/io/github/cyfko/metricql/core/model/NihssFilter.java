package io.github.cyfko.metricql.core.model;

import io.github.cyfko.metricql.core.api.Comparison;
import io.github.cyfko.metricql.core.api.FilterNode;
import io.github.cyfko.metricql.core.api.FilterVisitor;
import io.github.cyfko.metricql.core.exception.FilterDefinitionException;

/**
 * Admission NIHSS score comparison.
 * <p>
 * The scale conventionally ranges from 0 to 42; the range is not enforced.
 * </p>
 *
 * @param operator the comparison
 * @param value    the score to compare with
 * @since 1.0.0
 */
public record NihssFilter(Comparison operator, int value) implements FilterNode {

    public NihssFilter {
        if (operator == null)
            throw new FilterDefinitionException("NIHSS comparison operator cannot be null");
    }

    @Override
    public <R> R accept(FilterVisitor<R> visitor) {
        return visitor.visitNihss(this);
    }
}
