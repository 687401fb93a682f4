package io.github.cyfko.exprfilter.core.expr;

import java.util.Set;

/**
 * An expression body closed over exactly one {@link Placeholder}.
 * <p>
 * Implemented by {@link PredicateFragment} (boolean bodies) and {@link FieldAccessor}
 * (scalar bodies). The body may mention its own placeholder any number of times,
 * including zero, and no other placeholder.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public interface LambdaExpr {

    Placeholder placeholder();

    Expr body();

    /**
     * Verifies that {@code body} references no placeholder other than {@code placeholder}.
     *
     * @throws IllegalArgumentException if a foreign placeholder is found
     */
    static void requireClosed(Placeholder placeholder, Expr body) {
        Set<Placeholder> referenced = PlaceholderCollector.collect(body);
        for (Placeholder candidate : referenced) {
            if (!candidate.equals(placeholder)) {
                throw new IllegalArgumentException(String.format(
                        "Expression '%s' references placeholder '%s' but is declared over '%s'",
                        ExprPrinter.print(body), candidate.name(), placeholder.name()));
            }
        }
    }
}
