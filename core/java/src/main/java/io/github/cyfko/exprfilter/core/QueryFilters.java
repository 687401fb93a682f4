package io.github.cyfko.exprfilter.core;

import io.github.cyfko.exprfilter.core.composition.ConditionCombinator;
import io.github.cyfko.exprfilter.core.composition.LogicalOperator;
import io.github.cyfko.exprfilter.core.composition.RangeFilterBuilder;
import io.github.cyfko.exprfilter.core.composition.SubstringFilterBuilder;
import io.github.cyfko.exprfilter.core.exception.CapabilityMissingException;
import io.github.cyfko.exprfilter.core.expr.FieldAccessor;
import io.github.cyfko.exprfilter.core.expr.PredicateFragment;
import io.github.cyfko.exprfilter.core.spi.Queryable;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Entry points attaching composed filters to a {@link Queryable} data source.
 * <p>
 * Each method builds one predicate with the default builders
 * ({@link ConditionCombinator}, {@link RangeFilterBuilder}, {@link SubstringFilterBuilder})
 * and returns {@code source.where(predicate)}: a new, still unevaluated handle. The
 * source handle is never modified.
 * </p>
 *
 * <p><strong>Architecture Overview:</strong></p>
 * <ol>
 *   <li><strong>Unify:</strong> every fragment or accessor is re-expressed over one placeholder</li>
 *   <li><strong>Assemble:</strong> the bodies are folded into one boolean tree</li>
 *   <li><strong>Attach:</strong> the tree is added as a filter stage of the data source</li>
 *   <li><strong>Execute:</strong> later, when the caller materializes the data source</li>
 * </ol>
 *
 * <p><strong>Complete Usage Example:</strong></p>
 * <pre>{@code
 * Queryable<Order> orders = JpaQueryable.from(entityManager, Order.class).include("customer");
 *
 * List<Order> johnOrOnion = QueryFilters.whereOrConditions(orders,
 *         PredicateFragment.of("o", o -> o.get("customer").get("firstName").eq("John")),
 *         PredicateFragment.of("o", o -> o.get("productName").eq("Onion")))
 *     .toList();
 *
 * List<Order> recent = QueryFilters.whereDateTimeBetween(orders,
 *         FieldAccessor.path(LocalDateTime.class, "dateTime"),
 *         LocalDateTime.now().minusDays(2), LocalDateTime.now())
 *     .toList();
 *
 * List<Order> mentioningE = QueryFilters.whereAnyPropertyContainsText(orders, "e",
 *         FieldAccessor.path(String.class, "customer.firstName"),
 *         FieldAccessor.path(String.class, "productName"))
 *     .toList();
 * }</pre>
 *
 * <p>
 * For non-default behaviour (placeholder strategy, ...) build the predicate with a
 * configured builder and call {@link Queryable#where(PredicateFragment)} directly.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class QueryFilters {

    private static final Logger logger = Logger.getLogger(QueryFilters.class.getName());

    private QueryFilters() {
        throw new UnsupportedOperationException("QueryFilters is a utility class and cannot be instantiated");
    }

    /**
     * Keeps the entities matching at least one of the fragments.
     * Without fragments, the source is returned unrestricted.
     */
    @SafeVarargs
    public static <T> Queryable<T> whereOrConditions(Queryable<T> source, PredicateFragment<T>... predicates) {
        return whereConditions(source, LogicalOperator.OR, Arrays.asList(predicates));
    }

    /**
     * Keeps the entities matching every fragment.
     * Without fragments, the source is returned unrestricted.
     */
    @SafeVarargs
    public static <T> Queryable<T> whereAndConditions(Queryable<T> source, PredicateFragment<T>... predicates) {
        return whereConditions(source, LogicalOperator.AND, Arrays.asList(predicates));
    }

    /**
     * Keeps the entities matching the fragments combined with {@code operator}.
     *
     * @param source the data source to narrow
     * @param operator AND or OR
     * @param predicates the fragments; may be empty
     * @return the narrowed data source, or {@code source} itself when {@code predicates} is empty
     */
    public static <T> Queryable<T> whereConditions(Queryable<T> source, LogicalOperator operator,
                                                   List<PredicateFragment<T>> predicates) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(predicates, "predicates must not be null");
        if (predicates.isEmpty()) {
            logger.fine("No condition supplied, data source left unrestricted");
            return source;
        }
        return source.where(ConditionCombinator.defaults().combine(operator, predicates));
    }

    /**
     * Keeps the entities whose accessed value lies in {@code [startDate, endDate]}.
     * <p>
     * Works for any {@link Comparable} value ({@code LocalDateTime}, {@code LocalDate},
     * {@code Instant}, numbers, ...). An inverted range keeps nothing.
     * </p>
     */
    public static <T, V extends Comparable<? super V>> Queryable<T> whereDateTimeBetween(
            Queryable<T> source, FieldAccessor<T, V> dateSelector, V startDate, V endDate) {
        Objects.requireNonNull(source, "source must not be null");
        return source.where(RangeFilterBuilder.defaults().between(dateSelector, startDate, endDate));
    }

    /**
     * Keeps the entities where {@code searchText} occurs in at least one accessed field.
     * Without accessors, nothing is kept.
     *
     * @throws CapabilityMissingException if an accessor is not textual
     */
    @SafeVarargs
    public static <T> Queryable<T> whereAnyPropertyContainsText(Queryable<T> source, String searchText,
                                                                FieldAccessor<T, String>... properties) {
        return whereAnyPropertyContainsText(source, searchText, Arrays.asList(properties));
    }

    /**
     * List form of {@link #whereAnyPropertyContainsText(Queryable, String, FieldAccessor[])}
     * accepting accessors of any declared value type; non-textual ones are rejected.
     *
     * @throws CapabilityMissingException if an accessor is not textual
     */
    public static <T> Queryable<T> whereAnyPropertyContainsText(Queryable<T> source, String searchText,
                                                                List<? extends FieldAccessor<T, ?>> properties) {
        Objects.requireNonNull(source, "source must not be null");
        return source.where(SubstringFilterBuilder.defaults().anyContains(searchText, properties));
    }
}
