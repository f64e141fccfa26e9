package io.github.cyfko.metricql.core.api;

import io.github.cyfko.metricql.core.model.AgeFilter;
import io.github.cyfko.metricql.core.model.BooleanFilter;
import io.github.cyfko.metricql.core.model.DateFilter;
import io.github.cyfko.metricql.core.model.LogicalNode;
import io.github.cyfko.metricql.core.model.NihssFilter;
import io.github.cyfko.metricql.core.model.SexFilter;
import io.github.cyfko.metricql.core.model.StrokeFilter;

/**
 * A node of the canonical case-filter tree.
 * <p>
 * The hierarchy is closed: a node is either a {@link LogicalNode} combining child nodes, or
 * one of the leaf conditions {@link AgeFilter}, {@link NihssFilter}, {@link DateFilter},
 * {@link SexFilter}, {@link StrokeFilter} and {@link BooleanFilter}. Every implementation is
 * an immutable record validated at construction, so any tree reachable through this type is
 * well formed and can always be compiled.
 * </p>
 *
 * <p>Both front ends produce this type: the text parser and the entity-list adapter.</p>
 *
 * <pre>{@code
 * FilterNode filter = LogicalNode.and(
 *     new AgeFilter(Comparison.GE, 50),
 *     new SexFilter(SexType.MALE));
 *
 * filter.nodeCount(); // 3
 * filter.leafCount(); // 2
 * }</pre>
 *
 * @see FilterVisitor
 * @since 1.0.0
 */
public interface FilterNode {

    /**
     * Dispatches to the visitor method matching the concrete node type.
     *
     * @param visitor the visitor
     * @param <R>     the result type
     * @return the visitor's result
     */
    <R> R accept(FilterVisitor<R> visitor);

    /**
     * @return the number of nodes in the subtree rooted here, this node included
     */
    default int nodeCount() {
        return 1;
    }

    /**
     * @return the number of leaf conditions in the subtree rooted here
     */
    default int leafCount() {
        return 1;
    }
}
