package io.github.cyfko.exprfilter.core.expr;

import io.github.cyfko.exprfilter.core.exception.CapabilityMissingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ScalarMethod Tests")
class ScalarMethodTest {

    @Test
    @DisplayName("Should resolve contains on String")
    void shouldResolveContains() {
        ScalarMethod contains = ScalarMethod.resolve("contains", String.class);

        assertSame(ScalarMethod.CONTAINS, contains);
        assertEquals(String.class, contains.getDeclaringType());
        assertEquals(1, contains.getArity());
    }

    @Test
    @DisplayName("Should report missing capabilities")
    void shouldRejectUnsupportedTypes() {
        assertThrows(CapabilityMissingException.class, () -> ScalarMethod.resolve("contains", Integer.class));
        assertThrows(CapabilityMissingException.class, () -> ScalarMethod.resolve("contains", LocalDate.class));
        assertThrows(CapabilityMissingException.class, () -> ScalarMethod.resolve("startsWith", String.class));
        assertThrows(CapabilityMissingException.class, () -> ScalarMethod.resolve("contains", null));
    }

    @Test
    @DisplayName("Invoke should be exact and case-sensitive")
    void invokeIsCaseSensitive() {
        assertEquals(true, ScalarMethod.CONTAINS.invoke("Chery", "er"));
        assertEquals(false, ScalarMethod.CONTAINS.invoke("Chery", "ER"));
        assertEquals(true, ScalarMethod.CONTAINS.invoke("Chery", ""));
    }

    @Test
    @DisplayName("Invoke should check receiver type and arity")
    void invokeChecksArguments() {
        assertThrows(CapabilityMissingException.class, () -> ScalarMethod.CONTAINS.invoke(42, "4"));
        assertThrows(IllegalArgumentException.class, () -> ScalarMethod.CONTAINS.invoke("abc"));
        assertFalse(ScalarMethod.CONTAINS.supports(Object.class));
    }

    @Test
    @DisplayName("Invoke should check argument types")
    void invokeChecksArgumentTypes() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ScalarMethod.CONTAINS.invoke("abc", 5));
        assertTrue(e.getMessage().contains("CharSequence"));
        assertEquals(true, ScalarMethod.CONTAINS.invoke("abc", new StringBuilder("b")));
        assertFalse(ScalarMethod.CONTAINS.supports(null));
    }
}
