package io.github.cyfko.exprfilter.core.composition;

import io.github.cyfko.exprfilter.core.expr.Expr;
import io.github.cyfko.exprfilter.core.expr.ExprRewriter;
import io.github.cyfko.exprfilter.core.expr.FieldAccessor;
import io.github.cyfko.exprfilter.core.expr.Placeholder;
import io.github.cyfko.exprfilter.core.expr.PredicateFragment;

import java.util.Objects;

/**
 * Rewrites the references to one placeholder of an expression tree into another placeholder.
 * <p>
 * Independently authored fragments each use their own variable ({@code o}, {@code order},
 * ...). Before they can be merged into one tree, every body must speak about the same
 * variable. The unifier walks the whole tree, so placeholders nested at any depth (deep
 * member chains, method call receivers and arguments) are rewritten; every other node is
 * copied structurally.
 * </p>
 *
 * <p><strong>Guarantees:</strong></p>
 * <ul>
 *   <li>The input tree is never modified; a new tree is returned</li>
 *   <li>A tree without occurrences of the old placeholder comes back structurally equal</li>
 *   <li>Unifying an already unified tree onto the same target is a structural no-op</li>
 * </ul>
 *
 * <pre>{@code
 * Placeholder o = new Placeholder("o");
 * Expr body = o.get("customer").get("firstName").eq("John");
 * Expr unified = ParameterUnifier.unify(body, o, new Placeholder("x"));
 * // (x.customer.firstName == "John")
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class ParameterUnifier extends ExprRewriter {

    private final Placeholder oldPlaceholder;
    private final Placeholder newPlaceholder;

    private ParameterUnifier(Placeholder oldPlaceholder, Placeholder newPlaceholder) {
        this.oldPlaceholder = oldPlaceholder;
        this.newPlaceholder = newPlaceholder;
    }

    /**
     * Replaces every occurrence of {@code oldPlaceholder} in {@code expression} with {@code newPlaceholder}.
     *
     * @param expression the tree to rewrite
     * @param oldPlaceholder the placeholder to replace
     * @param newPlaceholder the replacement
     * @return the rewritten tree
     * @throws NullPointerException if an argument is {@code null}
     */
    public static Expr unify(Expr expression, Placeholder oldPlaceholder, Placeholder newPlaceholder) {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(oldPlaceholder, "oldPlaceholder must not be null");
        Objects.requireNonNull(newPlaceholder, "newPlaceholder must not be null");
        return new ParameterUnifier(oldPlaceholder, newPlaceholder).rewrite(expression);
    }

    /**
     * Re-expresses a fragment over {@code target}.
     */
    public static <T> PredicateFragment<T> unify(PredicateFragment<T> fragment, Placeholder target) {
        Objects.requireNonNull(fragment, "fragment must not be null");
        return new PredicateFragment<>(target, unify(fragment.body(), fragment.placeholder(), target));
    }

    /**
     * Re-expresses an accessor over {@code target}.
     */
    public static <T, V> FieldAccessor<T, V> unify(FieldAccessor<T, V> accessor, Placeholder target) {
        Objects.requireNonNull(accessor, "accessor must not be null");
        return new FieldAccessor<>(accessor.valueType(), target,
                unify(accessor.body(), accessor.placeholder(), target));
    }

    @Override
    public Expr visitPlaceholder(Placeholder placeholder) {
        return placeholder.equals(oldPlaceholder) ? newPlaceholder : placeholder;
    }
}
