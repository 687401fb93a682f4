package io.github.cyfko.exprfilter.core.expr;

import java.util.List;

/**
 * Node of a backend-agnostic expression tree.
 * <p>
 * An {@code Expr} is the explicit, inspectable form of a filter: placeholders, member
 * navigations, literals, binary operators and scalar method calls. Trees are immutable;
 * every operation, including the fluent builders declared here, returns a new node and
 * leaves its operands untouched.
 * </p>
 *
 * <h2>Node kinds</h2>
 * <ul>
 *   <li>{@link Placeholder} - the "current entity" variable of a fragment</li>
 *   <li>{@link MemberAccess} - navigation to a property, possibly nested</li>
 *   <li>{@link Constant} - a literal value</li>
 *   <li>{@link BinaryExpr} - logical connectives and comparisons</li>
 *   <li>{@link MethodCall} - scalar methods such as {@link ScalarMethod#CONTAINS}</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * // x.customer.firstName == "John" || x.productName == "Onion"
 * Placeholder x = new Placeholder("x");
 * Expr body = x.get("customer").get("firstName").eq("John")
 *     .or(x.get("productName").eq("Onion"));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 * @see ExprVisitor
 */
public interface Expr {

    /**
     * Dispatches to the visitor method matching this node kind.
     *
     * @param visitor the visitor to dispatch to
     * @param <R> result type of the visitor
     * @return the visitor's result for this node
     */
    <R> R accept(ExprVisitor<R> visitor);

    /**
     * Navigates to a member of the value produced by this expression.
     *
     * @param member property name, e.g. {@code "firstName"}
     * @return a new {@link MemberAccess} node
     */
    default Expr get(String member) {
        return new MemberAccess(this, member);
    }

    /**
     * Comparison of this expression with a value or another expression.
     * <p>
     * Plain values are wrapped into {@link Constant} nodes, {@link Expr} arguments are
     * used as operands directly. The same rule applies to {@code ne}, {@code gt},
     * {@code ge}, {@code lt} and {@code le}.
     * </p>
     *
     * @param value a literal or an expression
     * @return a new {@link BinaryExpr} node
     */
    default Expr eq(Object value) {
        return new BinaryExpr(BinaryOperator.EQ, this, operand(value));
    }

    default Expr ne(Object value) {
        return new BinaryExpr(BinaryOperator.NE, this, operand(value));
    }

    default Expr gt(Object value) {
        return new BinaryExpr(BinaryOperator.GT, this, operand(value));
    }

    default Expr ge(Object value) {
        return new BinaryExpr(BinaryOperator.GE, this, operand(value));
    }

    default Expr lt(Object value) {
        return new BinaryExpr(BinaryOperator.LT, this, operand(value));
    }

    default Expr le(Object value) {
        return new BinaryExpr(BinaryOperator.LE, this, operand(value));
    }

    /**
     * Case-sensitive substring test of {@code text} against the value of this expression.
     *
     * @param text the text to look for
     * @return a new {@link MethodCall} node bound to {@link ScalarMethod#CONTAINS}
     */
    default Expr contains(String text) {
        return new MethodCall(ScalarMethod.CONTAINS, this, List.of(Constant.of(text)));
    }

    default Expr and(Expr other) {
        return new BinaryExpr(BinaryOperator.AND, this, other);
    }

    default Expr or(Expr other) {
        return new BinaryExpr(BinaryOperator.OR, this, other);
    }

    /**
     * Wraps a plain value into a {@link Constant}; expressions are used as they are.
     */
    private static Expr operand(Object value) {
        return value instanceof Expr ? (Expr) value : Constant.of(value);
    }
}
