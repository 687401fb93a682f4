package io.github.cyfko.exprfilter.jpa;

import io.github.cyfko.exprfilter.core.expr.PredicateFragment;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("JpaPredicateTranslator - Unit")
class JpaPredicateTranslatorUnitTest {

    @Mock
    private Root<Object> root;

    @Mock
    private CriteriaQuery<Object> query;

    @Mock
    private CriteriaBuilder cb;

    @Mock
    private Predicate predicate;

    @Test
    @DisplayName("Accept-all fragment should lower to a conjunction without touching the root")
    void acceptAll() {
        when(cb.conjunction()).thenReturn(predicate);

        Predicate result = JpaPredicateTranslator.toResolver(PredicateFragment.acceptAll()).resolve(root, query, cb);

        assertSame(predicate, result);
        verifyNoInteractions(root, query);
    }

    @Test
    @DisplayName("Reject-all fragment should lower to a disjunction")
    void rejectAll() {
        when(cb.disjunction()).thenReturn(predicate);

        assertSame(predicate, JpaPredicateTranslator.toResolver(PredicateFragment.rejectAll()).resolve(root, query, cb));
        verify(cb, never()).conjunction();
    }

    @Test
    @DisplayName("Resolver should translate again on every call")
    void resolverIsReusable() {
        when(cb.conjunction()).thenReturn(predicate);
        PredicateResolver<Object> resolver = JpaPredicateTranslator.toResolver(PredicateFragment.acceptAll());

        resolver.resolve(root, query, cb);
        resolver.resolve(root, query, cb);

        verify(cb, times(2)).conjunction();
    }

    @Test
    @DisplayName("LIKE wildcards and the escape character should be escaped")
    void escapeLike() {
        assertEquals("abc", JpaPredicateTranslator.escapeLike("abc"));
        assertEquals("100\\%", JpaPredicateTranslator.escapeLike("100%"));
        assertEquals("a\\_b", JpaPredicateTranslator.escapeLike("a_b"));
        assertEquals("a\\\\b", JpaPredicateTranslator.escapeLike("a\\b"));
        assertEquals("", JpaPredicateTranslator.escapeLike(""));
    }

    @Test
    @DisplayName("Null fragment should be rejected")
    void nullFragment() {
        assertThrows(NullPointerException.class, () -> JpaPredicateTranslator.toResolver(null));
    }
}
