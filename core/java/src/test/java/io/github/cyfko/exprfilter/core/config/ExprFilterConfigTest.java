package io.github.cyfko.exprfilter.core.config;

import io.github.cyfko.exprfilter.core.expr.PredicateFragment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExprFilterConfig Tests")
class ExprFilterConfigTest {

    @Test
    @DisplayName("Defaults should use a fresh 'x' placeholder and NO_MATCH")
    void defaults() {
        ExprFilterConfig config = ExprFilterConfig.defaults();

        assertEquals(PlaceholderStrategy.FRESH, config.getPlaceholderStrategy());
        assertEquals("x", config.getPlaceholderName());
        assertEquals(NullNavigationPolicy.NO_MATCH, config.getNullNavigationPolicy());
    }

    @Test
    @DisplayName("Builder should override every setting")
    void builderOverrides() {
        ExprFilterConfig config = ExprFilterConfig.builder()
                .placeholderStrategy(PlaceholderStrategy.REUSE_FIRST)
                .placeholderName("entity")
                .nullNavigationPolicy(NullNavigationPolicy.STRICT_EXCEPTION)
                .build();

        assertEquals(PlaceholderStrategy.REUSE_FIRST, config.getPlaceholderStrategy());
        assertEquals("entity", config.getPlaceholderName());
        assertEquals(NullNavigationPolicy.STRICT_EXCEPTION, config.getNullNavigationPolicy());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "1x", "a.b", "a b", "x-y"})
    @DisplayName("Should reject names that are not identifiers")
    void rejectsInvalidNames(String name) {
        assertThrows(IllegalArgumentException.class, () -> ExprFilterConfig.builder().placeholderName(name));
    }

    @Test
    @DisplayName("REUSE_FIRST should fall back to a fresh placeholder when there is nothing to reuse")
    void reuseFirstWithoutLambdas() {
        ExprFilterConfig config = ExprFilterConfig.builder()
                .placeholderStrategy(PlaceholderStrategy.REUSE_FIRST)
                .build();

        assertEquals("x", config.selectPlaceholder(List.of()).name());
        assertEquals("o", config.selectPlaceholder(List.of(
                PredicateFragment.of("o", o -> o.get("a").eq(1)),
                PredicateFragment.of("p", p -> p.get("b").eq(2)))).name());
    }
}
