package io.github.cyfko.exprfilter.core.config;

/**
 * Strategy for {@code null} values met while evaluating a filter in memory.
 * <p>
 * Affects member navigation through {@code null}, ordering comparisons and scalar method
 * calls whose receiver is {@code null}. Equality comparisons are always null-safe.
 * </p>
 */
public enum NullNavigationPolicy {
    /**
     * Behave like a relational store: navigation through {@code null} yields {@code null},
     * and comparisons or method calls on {@code null} do not match.
     */
    NO_MATCH,
    /** Throw an {@code ExpressionEvaluationException}. */
    STRICT_EXCEPTION
}
