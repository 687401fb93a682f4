package io.github.cyfko.exprfilter.core.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Base visitor that rebuilds a tree node by node.
 * <p>
 * Every method returns a fresh copy of the visited node built from the rewritten
 * children, so a subclass only overrides the node kinds it wants to change. Leaves
 * ({@link Placeholder}, {@link Constant}) are immutable and returned as they are.
 * </p>
 *
 * <pre>{@code
 * // Replace every literal "John" by "Jane"
 * Expr renamed = body.accept(new ExprRewriter() {
 *     public Expr visitConstant(Constant c) {
 *         return "John".equals(c.value()) ? Constant.of("Jane") : c;
 *     }
 * });
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public abstract class ExprRewriter implements ExprVisitor<Expr> {

    public Expr rewrite(Expr expression) {
        return expression.accept(this);
    }

    @Override
    public Expr visitPlaceholder(Placeholder placeholder) {
        return placeholder;
    }

    @Override
    public Expr visitMemberAccess(MemberAccess memberAccess) {
        return new MemberAccess(memberAccess.target().accept(this), memberAccess.member());
    }

    @Override
    public Expr visitConstant(Constant constant) {
        return constant;
    }

    @Override
    public Expr visitBinary(BinaryExpr binary) {
        return new BinaryExpr(binary.operator(), binary.left().accept(this), binary.right().accept(this));
    }

    @Override
    public Expr visitMethodCall(MethodCall methodCall) {
        List<Expr> arguments = new ArrayList<>(methodCall.arguments().size());
        for (Expr argument : methodCall.arguments()) {
            arguments.add(argument.accept(this));
        }
        return new MethodCall(methodCall.method(), methodCall.target().accept(this), arguments);
    }
}
