package io.github.cyfko.exprfilter.core.composition;

import io.github.cyfko.exprfilter.core.config.ExprFilterConfig;
import io.github.cyfko.exprfilter.core.exception.CapabilityMissingException;
import io.github.cyfko.exprfilter.core.expr.BinaryExpr;
import io.github.cyfko.exprfilter.core.expr.BinaryOperator;
import io.github.cyfko.exprfilter.core.expr.Constant;
import io.github.cyfko.exprfilter.core.expr.Expr;
import io.github.cyfko.exprfilter.core.expr.FieldAccessor;
import io.github.cyfko.exprfilter.core.expr.MethodCall;
import io.github.cyfko.exprfilter.core.expr.Placeholder;
import io.github.cyfko.exprfilter.core.expr.PredicateFragment;
import io.github.cyfko.exprfilter.core.expr.ScalarMethod;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Builds "search text occurs in at least one of these fields" predicates.
 * <p>
 * Every accessor is unified onto one placeholder and tested with
 * {@link ScalarMethod#CONTAINS}; the tests are OR-ed onto a constant {@code false}
 * seed: {@code false || a1.contains(t) || ... || aN.contains(t)}. With no accessor the
 * predicate therefore matches nothing, the identity of disjunction. This intentionally
 * differs from {@link ConditionCombinator}, where zero fragments mean no restriction.
 * </p>
 *
 * <p>
 * The containment capability is resolved once per call, before any node is built.
 * An accessor whose declared value type cannot receive it fails the whole call with a
 * {@link CapabilityMissingException}. Matching is exact and case-sensitive.
 * </p>
 *
 * <pre>{@code
 * PredicateFragment<Order> mentionsE = SubstringFilterBuilder.defaults().anyContains("e",
 *     FieldAccessor.path(String.class, "customer.firstName"),
 *     FieldAccessor.path(String.class, "productName"));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class SubstringFilterBuilder {

    private static final Logger logger = Logger.getLogger(SubstringFilterBuilder.class.getName());

    private static final String CONTAINS_METHOD = "contains";

    private static final SubstringFilterBuilder DEFAULTS = new SubstringFilterBuilder(ExprFilterConfig.defaults());

    private final ExprFilterConfig config;

    public SubstringFilterBuilder(ExprFilterConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public static SubstringFilterBuilder defaults() {
        return DEFAULTS;
    }

    @SafeVarargs
    public final <T> PredicateFragment<T> anyContains(String searchText, FieldAccessor<T, String>... accessors) {
        return anyContains(searchText, Arrays.asList(accessors));
    }

    /**
     * Builds the disjunction of containment tests.
     *
     * @param searchText text to look for, may be empty but not {@code null}
     * @param accessors accessors of the searched fields; may be empty
     * @param <T> the entity type
     * @return the predicate
     * @throws CapabilityMissingException if an accessor's value type has no containment operation
     * @throws NullPointerException if {@code searchText}, {@code accessors} or an element is {@code null}
     */
    public <T> PredicateFragment<T> anyContains(String searchText, List<? extends FieldAccessor<T, ?>> accessors) {
        Objects.requireNonNull(searchText, "searchText must not be null");
        Objects.requireNonNull(accessors, "accessors must not be null");

        ScalarMethod contains = ScalarMethod.resolve(CONTAINS_METHOD, String.class);
        for (FieldAccessor<T, ?> accessor : accessors) {
            Objects.requireNonNull(accessor, "accessor must not be null");
            if (!contains.supports(accessor.valueType())) {
                throw new CapabilityMissingException(String.format(
                        "Method '%s' is not available on %s (accessor %s)",
                        CONTAINS_METHOD, accessor.valueType().getName(), accessor));
            }
        }

        Placeholder target = config.selectPlaceholder(accessors);
        Expr body = Constant.FALSE;
        for (FieldAccessor<T, ?> accessor : accessors) {
            Expr access = ParameterUnifier.unify(accessor.body(), accessor.placeholder(), target);
            Expr test = new MethodCall(contains, access, List.of(Constant.of(searchText)));
            body = new BinaryExpr(BinaryOperator.OR, body, test);
        }

        PredicateFragment<T> search = new PredicateFragment<>(target, body);
        logger.fine(() -> String.format("Built substring filter over %d field(s): %s", accessors.size(), search));
        return search;
    }
}
