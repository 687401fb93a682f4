package io.github.cyfko.exprfilter.core.composition;

import io.github.cyfko.exprfilter.core.config.ExprFilterConfig;
import io.github.cyfko.exprfilter.core.config.PlaceholderStrategy;
import io.github.cyfko.exprfilter.core.evaluation.ExprEvaluator;
import io.github.cyfko.exprfilter.core.expr.ExprPrinter;
import io.github.cyfko.exprfilter.core.expr.FieldAccessor;
import io.github.cyfko.exprfilter.core.expr.PredicateFragment;
import io.github.cyfko.exprfilter.core.fixtures.Order;
import io.github.cyfko.exprfilter.core.fixtures.SampleOrders;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RangeFilterBuilder Tests")
class RangeFilterBuilderTest {

    private final LocalDateTime now = LocalDateTime.of(2025, 4, 28, 12, 0);
    private final List<Order> orders = SampleOrders.create(now);
    private final FieldAccessor<Order, LocalDateTime> dateTime =
            FieldAccessor.of(LocalDateTime.class, "o", o -> o.get("dateTime"));

    private List<String> matching(PredicateFragment<Order> fragment) {
        ExprEvaluator evaluator = ExprEvaluator.defaults();
        return orders.stream()
                .filter(evaluator.compile(fragment))
                .map(Order::getProductName)
                .collect(Collectors.toList());
    }

    @Test
    @DisplayName("Should splice the accessor body into an inclusive range")
    void shouldBuildInclusiveRange() {
        PredicateFragment<Order> range = RangeFilterBuilder.defaults().between(dateTime, now.minusDays(2), now);

        assertEquals("((x.dateTime >= 2025-04-26T12:00) && (x.dateTime <= 2025-04-28T12:00))",
                ExprPrinter.print(range.body()));
    }

    @Test
    @DisplayName("Should include both bounds")
    void shouldIncludeBounds() {
        PredicateFragment<Order> range = RangeFilterBuilder.defaults().between(dateTime, now.minusDays(2), now.minusDays(1));

        assertEquals(List.of("Onion", "Banana"), matching(range));
    }

    @Test
    @DisplayName("Should keep orders from the cutoff up to now")
    void shouldKeepOrdersAfterCutoff() {
        LocalDateTime cutoff = now.minusDays(2).minusHours(12);

        assertEquals(List.of("Onion", "Banana", "Chery"),
                matching(RangeFilterBuilder.defaults().between(dateTime, cutoff, now)));
    }

    @Test
    @DisplayName("Inverted bounds should match nothing")
    void invertedBoundsMatchNothing() {
        PredicateFragment<Order> empty = RangeFilterBuilder.defaults().between(dateTime, now, now.minusDays(3));

        assertTrue(matching(empty).isEmpty());
    }

    @Test
    @DisplayName("Should navigate through related entities")
    void shouldNavigateNestedAccessor() {
        FieldAccessor<Order, Integer> age = FieldAccessor.path(Integer.class, "customer.age");

        assertEquals(List.of("Banana", "Chery"), matching(RangeFilterBuilder.defaults().between(age, 18, 65)));
    }

    @Test
    @DisplayName("REUSE_FIRST should keep the accessor's placeholder")
    void shouldReuseAccessorPlaceholder() {
        RangeFilterBuilder builder = new RangeFilterBuilder(ExprFilterConfig.builder()
                .placeholderStrategy(PlaceholderStrategy.REUSE_FIRST).build());

        assertEquals("o", builder.between(dateTime, now, now).placeholder().name());
    }

    @Test
    @DisplayName("Should reject null arguments")
    void shouldRejectNulls() {
        RangeFilterBuilder builder = RangeFilterBuilder.defaults();
        assertThrows(NullPointerException.class, () -> builder.between(null, now, now));
        assertThrows(NullPointerException.class, () -> builder.between(dateTime, null, now));
        assertThrows(NullPointerException.class, () -> builder.between(dateTime, now, null));
    }
}
