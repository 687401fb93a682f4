package io.github.cyfko.exprfilter.core.expr;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PredicateFragment and FieldAccessor Tests")
class PredicateFragmentTest {

    @Test
    @DisplayName("Should build a fragment from a function of its placeholder")
    void shouldBuildFragment() {
        PredicateFragment<Object> fragment = PredicateFragment.of("o", o -> o.get("customer").get("firstName").eq("John"));

        assertEquals(new Placeholder("o"), fragment.placeholder());
        assertEquals("o => (o.customer.firstName == \"John\")", fragment.toString());
    }

    @Test
    @DisplayName("Should reject a body referencing a foreign placeholder")
    void shouldRejectForeignPlaceholder() {
        Placeholder other = new Placeholder("y");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> PredicateFragment.of("x", x -> x.get("a").eq(other.get("b"))));
        assertTrue(e.getMessage().contains("'y'"));
    }

    @Test
    @DisplayName("Body need not mention its placeholder")
    void constantBodyIsClosed() {
        assertEquals(Constant.TRUE, PredicateFragment.acceptAll().body());
        assertEquals(Constant.FALSE, PredicateFragment.rejectAll().body());
        assertEquals("x", PredicateFragment.acceptAll().placeholder().name());
    }

    @Test
    @DisplayName("Placeholder names must not be blank")
    void blankPlaceholderFails() {
        assertThrows(IllegalArgumentException.class, () -> new Placeholder(" "));
        assertThrows(NullPointerException.class, () -> new Placeholder(null));
    }

    @Test
    @DisplayName("Path accessor should navigate each segment from x")
    void pathAccessor() {
        FieldAccessor<Object, String> accessor = FieldAccessor.path(String.class, "customer.address.city");

        assertEquals(new Placeholder("x").get("customer").get("address").get("city"), accessor.body());
        assertEquals("x => x.customer.address.city : String", accessor.toString());
    }

    @Test
    @DisplayName("Path accessor should reject empty segments")
    void pathAccessorRejectsEmptySegments() {
        assertThrows(IllegalArgumentException.class, () -> FieldAccessor.path(String.class, ""));
        assertThrows(IllegalArgumentException.class, () -> FieldAccessor.path(String.class, "customer..name"));
        assertThrows(IllegalArgumentException.class, () -> FieldAccessor.path(String.class, "customer."));
    }

    @Test
    @DisplayName("Fluent builders should wrap plain values as constants")
    void fluentBuildersWrapConstants() {
        Placeholder x = new Placeholder("x");

        assertEquals(new BinaryExpr(BinaryOperator.LT, x.get("age"), Constant.of(18)), x.get("age").lt(18));
        assertEquals(new MethodCall(ScalarMethod.CONTAINS, x.get("name"), List.of(Constant.of("a"))),
                x.get("name").contains("a"));
        assertEquals("(x.age != null)", ExprPrinter.print(x.get("age").ne(null)));
    }

    @Test
    @DisplayName("Collector should list placeholders in first-occurrence order")
    void collectorOrder() {
        Placeholder a = new Placeholder("a");
        Placeholder b = new Placeholder("b");

        assertEquals(List.of(b, a), List.copyOf(PlaceholderCollector.collect(b.get("n").eq(a.get("n")).or(a.get("m").eq(1)))));
    }
}
