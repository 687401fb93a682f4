package io.github.cyfko.exprfilter.core.expr;

import java.util.List;
import java.util.Objects;

/**
 * Invocation of a statically bound {@link ScalarMethod} on the value of {@code target}.
 *
 * @param method the bound method
 * @param target the receiver expression
 * @param arguments argument expressions, matching {@link ScalarMethod#getArity()}
 * @author Frank KOSSI
 * @since 1.0
 */
public record MethodCall(ScalarMethod method, Expr target, List<Expr> arguments) implements Expr {

    public MethodCall {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(target, "target must not be null");
        arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments must not be null"));
        if (arguments.size() != method.getArity()) {
            throw new IllegalArgumentException(String.format(
                    "Method '%s' expects %d argument(s), got %d",
                    method.getMethodName(), method.getArity(), arguments.size()));
        }
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitMethodCall(this);
    }

    @Override
    public String toString() {
        return ExprPrinter.print(this);
    }
}
