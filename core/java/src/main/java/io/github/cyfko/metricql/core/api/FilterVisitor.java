package io.github.cyfko.metricql.core.api;

import io.github.cyfko.metricql.core.model.AgeFilter;
import io.github.cyfko.metricql.core.model.BooleanFilter;
import io.github.cyfko.metricql.core.model.DateFilter;
import io.github.cyfko.metricql.core.model.LogicalNode;
import io.github.cyfko.metricql.core.model.NihssFilter;
import io.github.cyfko.metricql.core.model.SexFilter;
import io.github.cyfko.metricql.core.model.StrokeFilter;

/**
 * Visitor over the closed {@link FilterNode} hierarchy.
 *
 * @param <R> the result type
 * @since 1.0.0
 */
public interface FilterVisitor<R> {

    R visitLogical(LogicalNode node);

    R visitAge(AgeFilter filter);

    R visitNihss(NihssFilter filter);

    R visitDate(DateFilter filter);

    R visitSex(SexFilter filter);

    R visitStroke(StrokeFilter filter);

    R visitBoolean(BooleanFilter filter);
}
