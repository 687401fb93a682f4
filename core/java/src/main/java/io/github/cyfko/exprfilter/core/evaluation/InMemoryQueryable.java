package io.github.cyfko.exprfilter.core.evaluation;

import io.github.cyfko.exprfilter.core.config.ExprFilterConfig;
import io.github.cyfko.exprfilter.core.expr.PredicateFragment;
import io.github.cyfko.exprfilter.core.spi.Queryable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * {@link Queryable} over an in-memory collection.
 * <p>
 * Filter stages are kept as expression trees and interpreted by {@link ExprEvaluator}
 * only when the handle is materialized, so the backing collection is read at that
 * moment, not when stages are added. {@link #include(String)} has nothing to load for
 * objects that are already in memory; the path is only recorded.
 * </p>
 *
 * <pre>{@code
 * Queryable<Order> orders = InMemoryQueryable.of(List.of(tomato, onion, banana, chery));
 * List<Order> johns = QueryFilters.whereAndConditions(orders,
 *         PredicateFragment.of("o", o -> o.get("customer").get("firstName").eq("John")))
 *     .toList();
 * }</pre>
 *
 * @param <T> the element type
 * @author Frank KOSSI
 * @since 1.0
 */
public final class InMemoryQueryable<T> implements Queryable<T> {

    private static final Logger logger = Logger.getLogger(InMemoryQueryable.class.getName());

    private final Collection<T> elements;
    private final ExprEvaluator evaluator;
    private final List<PredicateFragment<T>> predicates;
    private final List<String> includes;

    private InMemoryQueryable(Collection<T> elements, ExprEvaluator evaluator,
                              List<PredicateFragment<T>> predicates, List<String> includes) {
        this.elements = elements;
        this.evaluator = evaluator;
        this.predicates = predicates;
        this.includes = includes;
    }

    public static <T> InMemoryQueryable<T> of(Collection<T> elements) {
        return of(elements, ExprFilterConfig.defaults());
    }

    public static <T> InMemoryQueryable<T> of(Collection<T> elements, ExprFilterConfig config) {
        Objects.requireNonNull(elements, "elements must not be null");
        return new InMemoryQueryable<>(elements, new ExprEvaluator(config), List.of(), List.of());
    }

    @Override
    public InMemoryQueryable<T> where(PredicateFragment<T> predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        return new InMemoryQueryable<>(elements, evaluator, append(predicates, predicate), includes);
    }

    @Override
    public InMemoryQueryable<T> include(String navigationPath) {
        Objects.requireNonNull(navigationPath, "navigationPath must not be null");
        return new InMemoryQueryable<>(elements, evaluator, predicates, append(includes, navigationPath));
    }

    @Override
    public List<T> toList() {
        Predicate<T> filter = combined();
        List<T> result = elements.stream().filter(filter).collect(Collectors.toList());
        logger.fine(() -> String.format("In-memory query kept %d of %d elements", result.size(), elements.size()));
        return result;
    }

    @Override
    public long count() {
        return elements.stream().filter(combined()).count();
    }

    /**
     * @return the filter stages, in the order they were added
     */
    public List<PredicateFragment<T>> getPredicates() {
        return predicates;
    }

    /**
     * @return the recorded navigation paths
     */
    public List<String> getIncludes() {
        return includes;
    }

    private Predicate<T> combined() {
        Predicate<T> filter = element -> true;
        for (PredicateFragment<T> predicate : predicates) {
            filter = filter.and(evaluator.compile(predicate));
        }
        return filter;
    }

    private static <E> List<E> append(List<E> list, E element) {
        List<E> copy = new ArrayList<>(list);
        copy.add(element);
        return Collections.unmodifiableList(copy);
    }
}
