package io.github.cyfko.exprfilter.core.composition;

import io.github.cyfko.exprfilter.core.config.ExprFilterConfig;
import io.github.cyfko.exprfilter.core.exception.InvalidOperatorException;
import io.github.cyfko.exprfilter.core.expr.BinaryExpr;
import io.github.cyfko.exprfilter.core.expr.BinaryOperator;
import io.github.cyfko.exprfilter.core.expr.Expr;
import io.github.cyfko.exprfilter.core.expr.Placeholder;
import io.github.cyfko.exprfilter.core.expr.PredicateFragment;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Merges several predicate fragments into one, using a single logical operator.
 * <p>
 * Each fragment may be written against its own placeholder. The combinator picks one
 * placeholder (see {@link io.github.cyfko.exprfilter.core.config.PlaceholderStrategy}),
 * unifies every fragment body onto it with {@link ParameterUnifier}, then folds the
 * bodies from left to right: {@code b1 OP b2 OP ... OP bN}.
 * </p>
 *
 * <h2>Cardinality policy</h2>
 * <ul>
 *   <li><strong>0 fragments:</strong> a predicate accepting everything (no restriction)</li>
 *   <li><strong>1 fragment:</strong> that fragment, returned verbatim</li>
 *   <li><strong>N fragments:</strong> the unified left fold</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ConditionCombinator combinator = ConditionCombinator.defaults();
 * PredicateFragment<Order> either = combinator.anyOf(
 *     PredicateFragment.of("o", o -> o.get("customer").get("firstName").eq("John")),
 *     PredicateFragment.of("p", p -> p.get("productName").eq("Onion")));
 * // x => ((x.customer.firstName == "John") || (x.productName == "Onion"))
 * }</pre>
 *
 * <p>Instances are immutable and may be shared between threads.</p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class ConditionCombinator {

    private static final Logger logger = Logger.getLogger(ConditionCombinator.class.getName());

    private static final ConditionCombinator DEFAULTS = new ConditionCombinator(ExprFilterConfig.defaults());

    private final ExprFilterConfig config;

    public ConditionCombinator(ExprFilterConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public static ConditionCombinator defaults() {
        return DEFAULTS;
    }

    /**
     * Combines fragments with the given operator.
     *
     * @param operator AND or OR
     * @param fragments the fragments, in fold order; may be empty
     * @param <T> the entity type
     * @return the combined fragment
     * @throws InvalidOperatorException if {@code operator} is {@code null}
     * @throws NullPointerException if {@code fragments} or one of its elements is {@code null}
     */
    public <T> PredicateFragment<T> combine(LogicalOperator operator, List<PredicateFragment<T>> fragments) {
        if (operator == null) {
            throw new InvalidOperatorException("Logical operator must not be null");
        }
        Objects.requireNonNull(fragments, "fragments must not be null");

        if (fragments.isEmpty()) {
            logger.fine(() -> String.format("No fragment to combine with %s, accepting everything", operator));
            return PredicateFragment.acceptAll();
        }

        if (fragments.size() == 1) {
            return Objects.requireNonNull(fragments.get(0), "fragment must not be null");
        }

        Placeholder target = config.selectPlaceholder(fragments);
        Expr body = null;
        for (PredicateFragment<T> fragment : fragments) {
            Objects.requireNonNull(fragment, "fragment must not be null");
            Expr unified = ParameterUnifier.unify(fragment.body(), fragment.placeholder(), target);
            body = body == null ? unified : fold(operator, body, unified);
        }

        PredicateFragment<T> combined = new PredicateFragment<>(target, body);
        logger.fine(() -> String.format("Combined %d fragments with %s: %s", fragments.size(), operator, combined));
        return combined;
    }

    @SafeVarargs
    public final <T> PredicateFragment<T> allOf(PredicateFragment<T>... fragments) {
        return combine(LogicalOperator.AND, Arrays.asList(fragments));
    }

    @SafeVarargs
    public final <T> PredicateFragment<T> anyOf(PredicateFragment<T>... fragments) {
        return combine(LogicalOperator.OR, Arrays.asList(fragments));
    }

    private static Expr fold(LogicalOperator operator, Expr accumulated, Expr next) {
        BinaryOperator connective;
        switch (operator) {
            case AND:
                connective = BinaryOperator.AND;
                break;
            case OR:
                connective = BinaryOperator.OR;
                break;
            default:
                throw new InvalidOperatorException("Unsupported logical operator: " + operator);
        }
        return new BinaryExpr(connective, accumulated, next);
    }
}
