package io.github.cyfko.metricql.core.api;

/**
 * Logical combinators of a filter tree.
 * <p>
 * {@link #AND} and {@link #OR} combine one or more children (two or more is the intended
 * case), {@link #NOT} negates exactly one child. Symbolic spellings such as {@code &},
 * {@code |} and {@code !} are resolved through the alias registry.
 * </p>
 *
 * @since 1.0.0
 */
public enum LogicalOp {
    AND,
    OR,
    NOT;

    /**
     * @return {@code true} if this operator takes exactly one operand
     */
    public boolean isUnary() {
        return this == NOT;
    }
}
