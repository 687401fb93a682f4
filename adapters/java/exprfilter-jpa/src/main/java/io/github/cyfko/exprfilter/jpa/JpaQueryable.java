package io.github.cyfko.exprfilter.jpa;

import io.github.cyfko.exprfilter.core.expr.PredicateFragment;
import io.github.cyfko.exprfilter.core.spi.Queryable;
import io.github.cyfko.exprfilter.jpa.utils.PathResolverUtils;
import jakarta.persistence.EntityManager;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link Queryable} backed by a JPA {@link EntityManager}.
 * <p>
 * Each handle records the entity type, its filter stages and the associations to load;
 * nothing reaches the database until {@link #toList()} or {@link #count()}. All stages
 * are translated with {@link JpaPredicateTranslator} and AND-ed in the {@code WHERE}
 * clause. {@link #include(String)} adds a {@code LEFT JOIN FETCH} per path segment.
 * </p>
 *
 * <pre>{@code
 * Queryable<Order> orders = JpaQueryable.from(entityManager, Order.class).include("customer");
 *
 * List<Order> recent = QueryFilters.whereDateTimeBetween(orders,
 *         FieldAccessor.path(LocalDateTime.class, "dateTime"), lastWeek, now)
 *     .toList();
 * }</pre>
 *
 * <p>
 * Handles are immutable and can be shared, but the {@link EntityManager} they run on is
 * not thread-safe: materialize a handle only where its entity manager may be used.
 * </p>
 *
 * @param <T> the entity type
 * @author Frank KOSSI
 * @since 1.0
 */
public final class JpaQueryable<T> implements Queryable<T> {

    private static final Logger logger = Logger.getLogger(JpaQueryable.class.getName());

    private final EntityManager entityManager;
    private final Class<T> entityClass;
    private final List<PredicateFragment<T>> predicates;
    private final List<String> includes;

    private JpaQueryable(EntityManager entityManager, Class<T> entityClass,
                         List<PredicateFragment<T>> predicates, List<String> includes) {
        this.entityManager = entityManager;
        this.entityClass = entityClass;
        this.predicates = predicates;
        this.includes = includes;
    }

    /**
     * Creates an unrestricted handle over all entities of {@code entityClass}.
     */
    public static <T> JpaQueryable<T> from(EntityManager entityManager, Class<T> entityClass) {
        Objects.requireNonNull(entityManager, "entityManager must not be null");
        Objects.requireNonNull(entityClass, "entityClass must not be null");
        return new JpaQueryable<>(entityManager, entityClass, List.of(), List.of());
    }

    @Override
    public JpaQueryable<T> where(PredicateFragment<T> predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        return new JpaQueryable<>(entityManager, entityClass, append(predicates, predicate), includes);
    }

    /**
     * @throws IllegalArgumentException if {@code navigationPath} is blank
     */
    @Override
    public JpaQueryable<T> include(String navigationPath) {
        Objects.requireNonNull(navigationPath, "navigationPath must not be null");
        if (navigationPath.isBlank()) {
            throw new IllegalArgumentException("navigationPath must not be blank");
        }
        return new JpaQueryable<>(entityManager, entityClass, predicates, append(includes, navigationPath));
    }

    @Override
    public List<T> toList() {
        long startTime = System.nanoTime();

        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<T> query = cb.createQuery(entityClass);
        Root<T> root = query.from(entityClass);
        for (String include : includes) {
            PathResolverUtils.fetch(root, include);
        }
        query.select(root).where(toResolver().resolve(root, query, cb));
        if (!includes.isEmpty()) {
            query.distinct(true);
        }

        List<T> result = entityManager.createQuery(query).getResultList();

        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        logger.info(() -> String.format("%s query completed in %dms: %d rows",
                entityClass.getSimpleName(), durationMs, result.size()));
        return result;
    }

    @Override
    public long count() {
        long startTime = System.nanoTime();

        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Long> countQuery = cb.createQuery(Long.class);
        Root<T> root = countQuery.from(entityClass);
        countQuery.select(cb.count(root)).where(toResolver().resolve(root, countQuery, cb));

        Long count = entityManager.createQuery(countQuery).getSingleResult();

        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        logger.info(() -> String.format("Count query completed in %dms: %d matches", durationMs, count));
        return count;
    }

    /**
     * @return the conjunction of all filter stages, {@code cb.conjunction()} when there is none
     */
    public PredicateResolver<T> toResolver() {
        List<PredicateResolver<T>> resolvers = new ArrayList<>(predicates.size());
        for (PredicateFragment<T> predicate : predicates) {
            resolvers.add(JpaPredicateTranslator.toResolver(predicate));
        }
        return (root, query, cb) -> {
            Predicate[] parts = new Predicate[resolvers.size()];
            for (int i = 0; i < parts.length; i++) {
                parts[i] = resolvers.get(i).resolve(root, query, cb);
            }
            return cb.and(parts);
        };
    }

    public Class<T> getEntityClass() {
        return entityClass;
    }

    public List<PredicateFragment<T>> getPredicates() {
        return predicates;
    }

    public List<String> getIncludes() {
        return includes;
    }

    private static <E> List<E> append(List<E> list, E element) {
        List<E> copy = new ArrayList<>(list);
        copy.add(element);
        return Collections.unmodifiableList(copy);
    }
}
