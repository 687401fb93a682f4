package io.github.cyfko.exprfilter.core.expr;

/**
 * A literal value. {@code null} is a legal value.
 *
 * @param value the literal
 * @author Frank KOSSI
 * @since 1.0
 */
public record Constant(Object value) implements Expr {

    /** Constant {@code true}; the body of a predicate accepting everything. */
    public static final Constant TRUE = new Constant(Boolean.TRUE);

    /** Constant {@code false}; the body of a predicate rejecting everything. */
    public static final Constant FALSE = new Constant(Boolean.FALSE);

    public static Constant of(Object value) {
        if (Boolean.TRUE.equals(value)) return TRUE;
        if (Boolean.FALSE.equals(value)) return FALSE;
        return new Constant(value);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    public String toString() {
        return ExprPrinter.print(this);
    }
}
