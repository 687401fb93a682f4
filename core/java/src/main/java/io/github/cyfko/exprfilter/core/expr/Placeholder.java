package io.github.cyfko.exprfilter.core.expr;

import java.util.Objects;

/**
 * The free variable of a fragment or accessor, standing for the entity being filtered.
 * <p>
 * Two placeholders are the same variable when their names are equal.
 * </p>
 *
 * @param name the variable name, never blank
 * @author Frank KOSSI
 * @since 1.0
 */
public record Placeholder(String name) implements Expr {

    public Placeholder {
        Objects.requireNonNull(name, "placeholder name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("placeholder name must not be blank");
        }
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitPlaceholder(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
