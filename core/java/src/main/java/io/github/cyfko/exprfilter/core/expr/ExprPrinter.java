package io.github.cyfko.exprfilter.core.expr;

import java.util.stream.Collectors;

/**
 * Renders expression trees in a compact, C-like notation for logs and diagnostics.
 * <p>
 * Binary nodes are always parenthesized so the rendered text shows the exact tree
 * shape, e.g. {@code ((x.customer.firstName == "John") || (x.productName == "Onion"))}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class ExprPrinter implements ExprVisitor<String> {

    private static final ExprPrinter INSTANCE = new ExprPrinter();

    private ExprPrinter() {}

    public static String print(Expr expression) {
        return expression.accept(INSTANCE);
    }

    /**
     * Renders a lambda as {@code placeholder => body}.
     */
    public static String print(LambdaExpr lambda) {
        return lambda.placeholder().name() + " => " + print(lambda.body());
    }

    @Override
    public String visitPlaceholder(Placeholder placeholder) {
        return placeholder.name();
    }

    @Override
    public String visitMemberAccess(MemberAccess memberAccess) {
        return memberAccess.target().accept(this) + "." + memberAccess.member();
    }

    @Override
    public String visitConstant(Constant constant) {
        Object value = constant.value();
        if (value instanceof CharSequence) {
            return "\"" + value + "\"";
        }
        return String.valueOf(value);
    }

    @Override
    public String visitBinary(BinaryExpr binary) {
        return "(" + binary.left().accept(this) + " " + binary.operator().getSymbol() + " "
                + binary.right().accept(this) + ")";
    }

    @Override
    public String visitMethodCall(MethodCall methodCall) {
        return methodCall.target().accept(this) + "." + methodCall.method().getMethodName()
                + methodCall.arguments().stream()
                        .map(argument -> argument.accept(this))
                        .collect(Collectors.joining(", ", "(", ")"));
    }
}
