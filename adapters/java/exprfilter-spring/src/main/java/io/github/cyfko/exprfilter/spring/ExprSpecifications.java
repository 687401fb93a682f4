package io.github.cyfko.exprfilter.spring;

import io.github.cyfko.exprfilter.core.composition.ConditionCombinator;
import io.github.cyfko.exprfilter.core.composition.LogicalOperator;
import io.github.cyfko.exprfilter.core.composition.RangeFilterBuilder;
import io.github.cyfko.exprfilter.core.composition.SubstringFilterBuilder;
import io.github.cyfko.exprfilter.core.exception.CapabilityMissingException;
import io.github.cyfko.exprfilter.core.expr.FieldAccessor;
import io.github.cyfko.exprfilter.core.expr.PredicateFragment;
import org.springframework.data.jpa.domain.Specification;

import java.util.Arrays;
import java.util.List;

/**
 * Static factories producing Spring Data {@link Specification}s from composed filters.
 * <p>
 * These mirror {@code QueryFilters} for code that queries through a
 * {@code JpaSpecificationExecutor} rather than a {@code Queryable}:
 * </p>
 *
 * <pre>{@code
 * public interface OrderRepository extends JpaRepository<Order, Long>, JpaSpecificationExecutor<Order> {}
 *
 * List<Order> recentWithE = orderRepository.findAll(
 *     ExprSpecifications.<Order, LocalDateTime>whereDateTimeBetween(
 *             FieldAccessor.path(LocalDateTime.class, "dateTime"), lastWeek, now)
 *         .and(ExprSpecifications.whereAnyPropertyContainsText("e",
 *             FieldAccessor.path(String.class, "customer.firstName"),
 *             FieldAccessor.path(String.class, "productName"))));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class ExprSpecifications {

    private ExprSpecifications() {
        throw new UnsupportedOperationException("ExprSpecifications is a utility class and cannot be instantiated");
    }

    public static <T> Specification<T> of(PredicateFragment<T> fragment) {
        return new ExprSpecification<>(fragment);
    }

    /**
     * Matches entities satisfying at least one fragment; everything when there is none.
     */
    @SafeVarargs
    public static <T> Specification<T> whereOrConditions(PredicateFragment<T>... predicates) {
        return of(ConditionCombinator.defaults().combine(LogicalOperator.OR, Arrays.asList(predicates)));
    }

    /**
     * Matches entities satisfying every fragment; everything when there is none.
     */
    @SafeVarargs
    public static <T> Specification<T> whereAndConditions(PredicateFragment<T>... predicates) {
        return of(ConditionCombinator.defaults().combine(LogicalOperator.AND, Arrays.asList(predicates)));
    }

    /**
     * Matches entities whose accessed value lies in {@code [startDate, endDate]}.
     */
    public static <T, V extends Comparable<? super V>> Specification<T> whereDateTimeBetween(
            FieldAccessor<T, V> dateSelector, V startDate, V endDate) {
        return of(RangeFilterBuilder.defaults().between(dateSelector, startDate, endDate));
    }

    /**
     * Matches entities where {@code searchText} occurs in at least one accessed field; nothing without fields.
     *
     * @throws CapabilityMissingException if an accessor is not textual
     */
    @SafeVarargs
    public static <T> Specification<T> whereAnyPropertyContainsText(String searchText,
                                                                   FieldAccessor<T, String>... properties) {
        return whereAnyPropertyContainsText(searchText, Arrays.asList(properties));
    }

    /**
     * @throws CapabilityMissingException if an accessor is not textual
     */
    public static <T> Specification<T> whereAnyPropertyContainsText(String searchText,
                                                                   List<? extends FieldAccessor<T, ?>> properties) {
        return of(SubstringFilterBuilder.defaults().anyContains(searchText, properties));
    }
}
