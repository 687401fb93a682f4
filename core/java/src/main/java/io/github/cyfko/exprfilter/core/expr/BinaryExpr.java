package io.github.cyfko.exprfilter.core.expr;

import java.util.Objects;

/**
 * A binary operation, logical or comparison.
 *
 * @param operator the operator
 * @param left left operand
 * @param right right operand
 * @author Frank KOSSI
 * @since 1.0
 */
public record BinaryExpr(BinaryOperator operator, Expr left, Expr right) implements Expr {

    public BinaryExpr {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(left, "left operand must not be null");
        Objects.requireNonNull(right, "right operand must not be null");
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public String toString() {
        return ExprPrinter.print(this);
    }
}
