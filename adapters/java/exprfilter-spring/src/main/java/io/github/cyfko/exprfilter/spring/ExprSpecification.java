package io.github.cyfko.exprfilter.spring;

import io.github.cyfko.exprfilter.core.expr.PredicateFragment;
import io.github.cyfko.exprfilter.jpa.JpaPredicateTranslator;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.springframework.data.jpa.domain.Specification;

import java.util.Objects;

/**
 * Spring Data {@link Specification} backed by a {@link PredicateFragment}.
 * <p>
 * The fragment is translated by {@link JpaPredicateTranslator} each time Spring Data
 * asks for the predicate, so the same specification serves {@code findAll} and
 * {@code count} queries alike.
 * </p>
 *
 * <pre>{@code
 * Specification<Order> johns = new ExprSpecification<>(
 *     PredicateFragment.of("o", o -> o.get("customer").get("firstName").eq("John")));
 * orderRepository.findAll(johns.and(otherSpecification));
 * }</pre>
 *
 * @param fragment the filter
 * @param <T> the entity type
 * @author Frank KOSSI
 * @since 1.0
 */
public record ExprSpecification<T>(PredicateFragment<T> fragment) implements Specification<T> {

    public ExprSpecification {
        Objects.requireNonNull(fragment, "fragment must not be null");
    }

    @Override
    public Predicate toPredicate(Root<T> root, CriteriaQuery<?> query, CriteriaBuilder criteriaBuilder) {
        return JpaPredicateTranslator.toResolver(fragment).resolve(root, query, criteriaBuilder);
    }

    @Override
    public String toString() {
        return "ExprSpecification[" + fragment + "]";
    }
}
