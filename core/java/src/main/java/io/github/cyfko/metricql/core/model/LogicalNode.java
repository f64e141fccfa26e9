package io.github.cyfko.metricql.core.model;

import io.github.cyfko.metricql.core.api.FilterNode;
import io.github.cyfko.metricql.core.api.FilterVisitor;
import io.github.cyfko.metricql.core.api.LogicalOp;
import io.github.cyfko.metricql.core.exception.FilterDefinitionException;

import java.util.Arrays;
import java.util.List;

/**
 * Logical combination of child filter nodes.
 *
 * <h2>Validation Rules</h2>
 * <p>
 * The canonical constructor rejects structurally invalid combinations with a
 * {@link FilterDefinitionException}:
 * </p>
 * <ul>
 *   <li>{@code operator} or {@code children} is null, or a child is null</li>
 *   <li>{@link LogicalOp#AND} or {@link LogicalOp#OR} with no child</li>
 *   <li>{@link LogicalOp#NOT} with anything but exactly one child</li>
 * </ul>
 * <p>
 * A single-child AND or OR is legal: the entity adapter emits one when a request holds a
 * single condition.
 * </p>
 *
 * <pre>{@code
 * LogicalNode filter = LogicalNode.and(
 *     new AgeFilter(Comparison.GE, 50),
 *     LogicalNode.not(new StrokeFilter(StrokeType.ISCHEMIC)));
 * }</pre>
 *
 * @param operator the combinator
 * @param children the operands in source order, copied into an unmodifiable list
 * @since 1.0.0
 */
public record LogicalNode(LogicalOp operator, List<FilterNode> children) implements FilterNode {

    public LogicalNode {
        if (operator == null)
            throw new FilterDefinitionException("logical operator cannot be null");
        if (children == null)
            throw new FilterDefinitionException("children cannot be null");
        if (children.stream().anyMatch(child -> child == null))
            throw new FilterDefinitionException(operator + " cannot have a null child");

        if (operator.isUnary() && children.size() != 1)
            throw new FilterDefinitionException(operator + " requires exactly one child, got " + children.size());
        if (!operator.isUnary() && children.isEmpty())
            throw new FilterDefinitionException(operator + " requires at least one child");

        children = List.copyOf(children);
    }

    public static LogicalNode and(FilterNode... children) {
        return new LogicalNode(LogicalOp.AND, Arrays.asList(children));
    }

    public static LogicalNode or(FilterNode... children) {
        return new LogicalNode(LogicalOp.OR, Arrays.asList(children));
    }

    public static LogicalNode not(FilterNode child) {
        return new LogicalNode(LogicalOp.NOT, Arrays.asList(child));
    }

    @Override
    public <R> R accept(FilterVisitor<R> visitor) {
        return visitor.visitLogical(this);
    }

    @Override
    public int nodeCount() {
        return 1 + children.stream().mapToInt(FilterNode::nodeCount).sum();
    }

    @Override
    public int leafCount() {
        return children.stream().mapToInt(FilterNode::leafCount).sum();
    }
}
