package io.github.cyfko.exprfilter.core.composition;

import io.github.cyfko.exprfilter.core.config.ExprFilterConfig;
import io.github.cyfko.exprfilter.core.expr.BinaryExpr;
import io.github.cyfko.exprfilter.core.expr.BinaryOperator;
import io.github.cyfko.exprfilter.core.expr.Constant;
import io.github.cyfko.exprfilter.core.expr.Expr;
import io.github.cyfko.exprfilter.core.expr.FieldAccessor;
import io.github.cyfko.exprfilter.core.expr.Placeholder;
import io.github.cyfko.exprfilter.core.expr.PredicateFragment;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Builds inclusive range predicates over an accessed value.
 * <p>
 * The accessor body is spliced into the predicate rather than evaluated, so navigation
 * inside the accessor (e.g. {@code x.customer.birthDate}) stays part of the filter the
 * backend translates. The produced body is
 * {@code (accessor >= lower) && (accessor <= upper)}.
 * </p>
 *
 * <p>
 * {@code lower <= upper} is not checked: an inverted range is a valid, empty interval
 * and yields a predicate that matches nothing.
 * </p>
 *
 * <pre>{@code
 * PredicateFragment<Order> lastWeek = RangeFilterBuilder.defaults().between(
 *     FieldAccessor.path(LocalDateTime.class, "dateTime"),
 *     LocalDateTime.now().minusDays(7),
 *     LocalDateTime.now());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class RangeFilterBuilder {

    private static final Logger logger = Logger.getLogger(RangeFilterBuilder.class.getName());

    private static final RangeFilterBuilder DEFAULTS = new RangeFilterBuilder(ExprFilterConfig.defaults());

    private final ExprFilterConfig config;

    public RangeFilterBuilder(ExprFilterConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public static RangeFilterBuilder defaults() {
        return DEFAULTS;
    }

    /**
     * Builds {@code lower <= accessor(x) <= upper}.
     *
     * @param accessor locates the compared value
     * @param lower inclusive lower bound
     * @param upper inclusive upper bound
     * @param <T> the entity type
     * @param <V> the compared type
     * @return the range predicate
     * @throws NullPointerException if an argument is {@code null}
     */
    public <T, V extends Comparable<? super V>> PredicateFragment<T> between(FieldAccessor<T, V> accessor,
                                                                             V lower, V upper) {
        Objects.requireNonNull(accessor, "accessor must not be null");
        Objects.requireNonNull(lower, "lower bound must not be null");
        Objects.requireNonNull(upper, "upper bound must not be null");

        Placeholder target = config.selectPlaceholder(List.of(accessor));
        Expr access = ParameterUnifier.unify(accessor.body(), accessor.placeholder(), target);

        Expr body = new BinaryExpr(BinaryOperator.AND,
                new BinaryExpr(BinaryOperator.GE, access, Constant.of(lower)),
                new BinaryExpr(BinaryOperator.LE, access, Constant.of(upper)));

        PredicateFragment<T> range = new PredicateFragment<>(target, body);
        logger.fine(() -> "Built range filter: " + range);
        return range;
    }
}
