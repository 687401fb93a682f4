package io.github.cyfko.exprfilter.core.spi;

import io.github.cyfko.exprfilter.core.expr.PredicateFragment;

import java.util.List;

/**
 * A lazily evaluated, composable query over a collection of entities.
 * <p>
 * {@code Queryable} is the data source abstraction the filter builders narrow. Each
 * staging method returns a <strong>new</strong> handle and leaves the receiver untouched,
 * so a handle can be shared and refined along several branches. Nothing is executed
 * until {@link #toList()} or {@link #count()} is called; the implementation then
 * translates the accumulated predicate stages into whatever its backing store needs.
 * </p>
 *
 * <h2>Implementation Guidelines</h2>
 * <ul>
 *   <li>All {@code where} stages apply together (logical AND)</li>
 *   <li>{@code where} and {@code include} must not execute anything</li>
 *   <li>Handles must be immutable</li>
 * </ul>
 *
 * <pre>{@code
 * Queryable<Order> orders = JpaQueryable.from(em, Order.class).include("customer");
 * List<Order> johns = QueryFilters
 *     .whereOrConditions(orders,
 *         PredicateFragment.of("o", o -> o.get("customer").get("firstName").eq("John")),
 *         PredicateFragment.of("o", o -> o.get("productName").eq("Onion")))
 *     .toList();
 * }</pre>
 *
 * @param <T> the entity type
 * @author Frank KOSSI
 * @since 1.0
 */
public interface Queryable<T> {

    /**
     * Adds a filter stage.
     *
     * @param predicate the predicate entities must satisfy
     * @return a new handle with the additional stage
     */
    Queryable<T> where(PredicateFragment<T> predicate);

    /**
     * Adds an eager-loading stage for a navigation (relation) of the entity.
     *
     * @param navigationPath dot-separated relation path, e.g. {@code "customer"}
     * @return a new handle with the additional stage
     */
    Queryable<T> include(String navigationPath);

    /**
     * Executes the query and materializes the matching entities.
     *
     * @return the matching entities
     */
    List<T> toList();

    /**
     * Executes the query and counts the matching entities.
     *
     * @return the number of matching entities
     */
    long count();
}
