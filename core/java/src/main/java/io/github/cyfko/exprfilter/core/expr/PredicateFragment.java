package io.github.cyfko.exprfilter.core.expr;

import java.util.Objects;
import java.util.function.Function;

/**
 * A boolean expression over a single placeholder, written against entities of type {@code T}.
 * <p>
 * Fragments are authored independently, each with its own placeholder name, and later
 * merged by the composition builders. They are immutable and can be reused before and
 * after composition.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * PredicateFragment<Order> johnsOrders =
 *     PredicateFragment.of("o", o -> o.get("customer").get("firstName").eq("John"));
 * PredicateFragment<Order> onions =
 *     PredicateFragment.of("order", order -> order.get("productName").eq("Onion"));
 * }</pre>
 *
 * @param <T> the entity type the fragment filters (phantom, for compile-time checking)
 * @param placeholder the fragment's own variable
 * @param body the boolean expression
 * @author Frank KOSSI
 * @since 1.0
 */
public record PredicateFragment<T>(Placeholder placeholder, Expr body) implements LambdaExpr {

    private static final Placeholder DEFAULT_PLACEHOLDER = new Placeholder("x");

    /**
     * @throws NullPointerException if an argument is {@code null}
     * @throws IllegalArgumentException if {@code body} references another placeholder
     */
    public PredicateFragment {
        Objects.requireNonNull(placeholder, "placeholder must not be null");
        Objects.requireNonNull(body, "body must not be null");
        LambdaExpr.requireClosed(placeholder, body);
    }

    /**
     * Builds a fragment from a function of its placeholder.
     *
     * @param placeholderName name of the fragment's variable
     * @param definition builds the body from the placeholder node
     * @param <T> the entity type
     * @return the new fragment
     */
    public static <T> PredicateFragment<T> of(String placeholderName, Function<Placeholder, Expr> definition) {
        Placeholder placeholder = new Placeholder(placeholderName);
        return new PredicateFragment<>(placeholder, definition.apply(placeholder));
    }

    /**
     * @return a fragment whose body is {@link Constant#TRUE}
     */
    public static <T> PredicateFragment<T> acceptAll() {
        return new PredicateFragment<>(DEFAULT_PLACEHOLDER, Constant.TRUE);
    }

    /**
     * @return a fragment whose body is {@link Constant#FALSE}
     */
    public static <T> PredicateFragment<T> rejectAll() {
        return new PredicateFragment<>(DEFAULT_PLACEHOLDER, Constant.FALSE);
    }

    @Override
    public String toString() {
        return ExprPrinter.print(this);
    }
}
