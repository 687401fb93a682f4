package io.github.cyfko.exprfilter.sample;

import io.github.cyfko.exprfilter.core.QueryFilters;
import io.github.cyfko.exprfilter.core.expr.FieldAccessor;
import io.github.cyfko.exprfilter.core.expr.PredicateFragment;
import io.github.cyfko.exprfilter.core.spi.Queryable;
import io.github.cyfko.exprfilter.jpa.JpaQueryable;
import io.github.cyfko.exprfilter.spring.ExprSpecifications;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * The demo filters of the sample, run against the orders table.
 */
@Service
@Transactional(readOnly = true)
public class SampleQueries {

    private static final PredicateFragment<Order> ORDERED_BY_JOHN =
            PredicateFragment.of("o", o -> o.get("customer").get("firstName").eq("John"));
    private static final PredicateFragment<Order> ONION =
            PredicateFragment.of("o", o -> o.get("productName").eq("Onion"));

    @PersistenceContext
    private EntityManager em;

    private final OrderRepository orderRepository;

    public SampleQueries(OrderRepository orderRepository) {
        this.orderRepository = orderRepository;
    }

    /**
     * Orders placed by John or for onions.
     */
    public List<Order> johnOrOnion() {
        return QueryFilters.whereOrConditions(ordersWithCustomer(), ORDERED_BY_JOHN, ONION).toList();
    }

    /**
     * Onion orders placed by John.
     */
    public List<Order> johnAndOnion() {
        return QueryFilters.whereAndConditions(ordersWithCustomer(), ORDERED_BY_JOHN, ONION).toList();
    }

    /**
     * Orders placed between {@code from} and {@code to}, both included.
     */
    public List<Order> placedBetween(LocalDateTime from, LocalDateTime to) {
        return QueryFilters.whereDateTimeBetween(JpaQueryable.from(em, Order.class),
                FieldAccessor.path(LocalDateTime.class, "dateTime"), from, to).toList();
    }

    /**
     * Orders whose customer first name or product name contains {@code text}.
     */
    public List<Order> mentioning(String text) {
        Specification<Order> spec = ExprSpecifications.whereAnyPropertyContainsText(text,
                FieldAccessor.path(String.class, "customer.firstName"),
                FieldAccessor.path(String.class, "productName"));
        return orderRepository.findAll(spec);
    }

    private Queryable<Order> ordersWithCustomer() {
        return JpaQueryable.from(em, Order.class).include("customer");
    }
}
