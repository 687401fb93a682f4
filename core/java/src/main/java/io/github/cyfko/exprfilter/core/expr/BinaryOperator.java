package io.github.cyfko.exprfilter.core.expr;

/**
 * Operators of {@link BinaryExpr} nodes.
 * <p>
 * {@link #AND} and {@link #OR} are logical connectives over boolean operands; the others
 * are comparisons between two scalar operands and use the native equality or ordering
 * of the compared type.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public enum BinaryOperator {

    /** Logical conjunction: "&amp;&amp;" */
    AND("&&"),

    /** Logical disjunction: "||" */
    OR("||"),

    /** Equality: "==" */
    EQ("=="),

    /** Inequality: "!=" */
    NE("!="),

    /** Greater than: "&gt;" */
    GT(">"),

    /** Greater than or equal: "&gt;=" */
    GE(">="),

    /** Less than: "&lt;" */
    LT("<"),

    /** Less than or equal: "&lt;=" */
    LE("<=");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * @return {@code true} for {@link #AND} and {@link #OR}
     */
    public boolean isLogical() {
        return this == AND || this == OR;
    }

    /**
     * @return {@code true} for the ordering comparisons GT, GE, LT and LE
     */
    public boolean isOrdering() {
        return this == GT || this == GE || this == LT || this == LE;
    }
}
