package io.github.cyfko.exprfilter.core.expr;

/**
 * Visitor over the node kinds of an {@link Expr} tree.
 * <p>
 * Tree transformations (placeholder unification), interpreters (in-memory evaluation)
 * and backend lowerings (JPA Criteria) are all written as visitors.
 * </p>
 *
 * @param <R> the result type
 * @author Frank KOSSI
 * @since 1.0
 * @see ExprRewriter
 */
public interface ExprVisitor<R> {

    R visitPlaceholder(Placeholder placeholder);

    R visitMemberAccess(MemberAccess memberAccess);

    R visitConstant(Constant constant);

    R visitBinary(BinaryExpr binary);

    R visitMethodCall(MethodCall methodCall);
}
