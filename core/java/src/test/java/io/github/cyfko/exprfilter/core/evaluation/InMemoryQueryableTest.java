package io.github.cyfko.exprfilter.core.evaluation;

import io.github.cyfko.exprfilter.core.expr.PredicateFragment;
import io.github.cyfko.exprfilter.core.fixtures.Order;
import io.github.cyfko.exprfilter.core.fixtures.SampleOrders;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryQueryable Tests")
class InMemoryQueryableTest {

    private final LocalDateTime now = LocalDateTime.of(2025, 4, 28, 12, 0);
    private final PredicateFragment<Order> johns =
            PredicateFragment.of("o", o -> o.get("customer").get("firstName").eq("John"));
    private final PredicateFragment<Order> onions =
            PredicateFragment.of("o", o -> o.get("productName").eq("Onion"));

    record Reading(double value) {}

    @Test
    @DisplayName("where should return a new handle and leave the source untouched")
    void whereIsImmutable() {
        InMemoryQueryable<Order> source = InMemoryQueryable.of(SampleOrders.create(now));

        InMemoryQueryable<Order> filtered = source.where(johns);

        assertNotSame(source, filtered);
        assertTrue(source.getPredicates().isEmpty());
        assertEquals(List.of(johns), filtered.getPredicates());
        assertEquals(4, source.count());
        assertEquals(2, filtered.count());
    }

    @Test
    @DisplayName("Stacked where stages should be AND-ed")
    void stagesAreConjoined() {
        List<Order> result = InMemoryQueryable.of(SampleOrders.create(now)).where(johns).where(onions).toList();

        assertEquals(1, result.size());
        assertEquals("Onion", result.get(0).getProductName());
    }

    @Test
    @DisplayName("Evaluation should be deferred until materialization")
    void evaluationIsDeferred() {
        List<Order> backing = new ArrayList<>();
        InMemoryQueryable<Order> filtered = InMemoryQueryable.of(backing).where(johns);

        assertEquals(0, filtered.count());
        backing.addAll(SampleOrders.create(now));

        assertEquals(2, filtered.count());
        assertEquals(2, filtered.toList().size());
    }

    @Test
    @DisplayName("include should only record the navigation path")
    void includeRecordsPath() {
        InMemoryQueryable<Order> source = InMemoryQueryable.of(SampleOrders.create(now));

        InMemoryQueryable<Order> withCustomer = source.include("customer");

        assertEquals(List.of("customer"), withCustomer.getIncludes());
        assertTrue(source.getIncludes().isEmpty());
        assertEquals(4, withCustomer.toList().size());
        assertThrows(UnsupportedOperationException.class, () -> withCustomer.getIncludes().add("x"));
    }

    @Test
    @DisplayName("Should reject null arguments")
    void rejectsNulls() {
        InMemoryQueryable<Order> source = InMemoryQueryable.of(List.of());

        assertThrows(NullPointerException.class, () -> source.where(null));
        assertThrows(NullPointerException.class, () -> source.include(null));
        assertThrows(NullPointerException.class, () -> InMemoryQueryable.of(null));
    }

    @Test
    @DisplayName("Non-finite readings should be filtered, not abort the query")
    void nonFiniteReadings() {
        InMemoryQueryable<Reading> readings = InMemoryQueryable.of(List.of(
                new Reading(5.0), new Reading(Double.NaN), new Reading(Double.POSITIVE_INFINITY)));

        assertEquals(List.of(new Reading(5.0)),
                readings.where(PredicateFragment.of("r", r -> r.get("value").eq(5))).toList());
        assertEquals(List.of(new Reading(Double.POSITIVE_INFINITY)),
                readings.where(PredicateFragment.of("r", r -> r.get("value").gt(5))).toList());
    }
}
