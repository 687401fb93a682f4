package io.github.cyfko.exprfilter.jpa;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

/**
 * Functional interface for resolving filters into JPA Criteria API predicates.
 * <p>
 * {@code PredicateResolver} represents a <strong>deferred predicate generator</strong>:
 * it creates the JPA {@link Predicate} on demand, when given the query context
 * (root, query, criteria builder). The same resolver can therefore be applied to a
 * selection query and to a count query over the same entity.
 * </p>
 *
 * <pre>{@code
 * PredicateResolver<Order> resolver = JpaPredicateTranslator.toResolver(fragment);
 *
 * CriteriaBuilder cb = entityManager.getCriteriaBuilder();
 * CriteriaQuery<Order> query = cb.createQuery(Order.class);
 * Root<Order> root = query.from(Order.class);
 *
 * query.where(resolver.resolve(root, query, cb));
 * List<Order> results = entityManager.createQuery(query).getResultList();
 * }</pre>
 *
 * <p>Implementations should be stateless; a resolver may be called concurrently.</p>
 *
 * @param <E> the entity type this predicate resolver applies to
 * @author Frank KOSSI
 * @since 1.0
 */
@FunctionalInterface
public interface PredicateResolver<E> {

    /**
     * Resolves this filter into a query predicate.
     *
     * @param root The root entity in the criteria query
     * @param query The criteria query being constructed
     * @param cb The criteria builder for creating predicates and expressions
     * @return A predicate representing this filter
     */
    Predicate resolve(Root<E> root, CriteriaQuery<?> query, CriteriaBuilder cb);
}
