package io.github.cyfko.exprfilter.core.expr;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the distinct placeholders referenced anywhere in a tree.
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class PlaceholderCollector implements ExprVisitor<Void> {

    private final Set<Placeholder> found = new LinkedHashSet<>();

    private PlaceholderCollector() {}

    /**
     * @param expression tree to scan
     * @return placeholders in order of first occurrence, unmodifiable
     */
    public static Set<Placeholder> collect(Expr expression) {
        PlaceholderCollector collector = new PlaceholderCollector();
        expression.accept(collector);
        return Collections.unmodifiableSet(collector.found);
    }

    @Override
    public Void visitPlaceholder(Placeholder placeholder) {
        found.add(placeholder);
        return null;
    }

    @Override
    public Void visitMemberAccess(MemberAccess memberAccess) {
        return memberAccess.target().accept(this);
    }

    @Override
    public Void visitConstant(Constant constant) {
        return null;
    }

    @Override
    public Void visitBinary(BinaryExpr binary) {
        binary.left().accept(this);
        return binary.right().accept(this);
    }

    @Override
    public Void visitMethodCall(MethodCall methodCall) {
        methodCall.target().accept(this);
        for (Expr argument : methodCall.arguments()) {
            argument.accept(this);
        }
        return null;
    }
}
