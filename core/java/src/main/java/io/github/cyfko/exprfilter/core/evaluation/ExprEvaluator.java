package io.github.cyfko.exprfilter.core.evaluation;

import io.github.cyfko.exprfilter.core.config.ExprFilterConfig;
import io.github.cyfko.exprfilter.core.config.NullNavigationPolicy;
import io.github.cyfko.exprfilter.core.exception.ExpressionEvaluationException;
import io.github.cyfko.exprfilter.core.expr.BinaryExpr;
import io.github.cyfko.exprfilter.core.expr.Constant;
import io.github.cyfko.exprfilter.core.expr.Expr;
import io.github.cyfko.exprfilter.core.expr.ExprPrinter;
import io.github.cyfko.exprfilter.core.expr.ExprVisitor;
import io.github.cyfko.exprfilter.core.expr.LambdaExpr;
import io.github.cyfko.exprfilter.core.expr.MemberAccess;
import io.github.cyfko.exprfilter.core.expr.MethodCall;
import io.github.cyfko.exprfilter.core.expr.Placeholder;
import io.github.cyfko.exprfilter.core.expr.PredicateFragment;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Interprets expression trees against plain Java objects.
 * <p>
 * This is the in-memory counterpart of a backend translation: the placeholder is bound
 * to the object under test, member accesses are read through {@link MemberResolver},
 * comparisons use {@link Object#equals(Object)} and {@link Comparable#compareTo(Object)}
 * (numbers of different classes are compared by value, as {@code double} when either
 * side is floating point), {@code &&} and {@code ||}
 * short-circuit, and scalar methods run their bound implementation.
 * </p>
 *
 * <p><strong>Null handling</strong> follows {@link ExprFilterConfig#getNullNavigationPolicy()}:</p>
 * <ul>
 *   <li>{@link NullNavigationPolicy#NO_MATCH}: {@code null.member} is {@code null}; ordering
 *       comparisons, method calls and conditions over {@code null} do not match</li>
 *   <li>{@link NullNavigationPolicy#STRICT_EXCEPTION}: each of these cases throws
 *       {@link ExpressionEvaluationException}</li>
 * </ul>
 *
 * <pre>{@code
 * Predicate<Order> test = ExprEvaluator.defaults().compile(fragment);
 * orders.stream().filter(test).collect(Collectors.toList());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class ExprEvaluator {

    private static final ExprEvaluator DEFAULTS = new ExprEvaluator(ExprFilterConfig.defaults());

    private final NullNavigationPolicy nullPolicy;

    public ExprEvaluator(ExprFilterConfig config) {
        this.nullPolicy = Objects.requireNonNull(config, "config must not be null").getNullNavigationPolicy();
    }

    public static ExprEvaluator defaults() {
        return DEFAULTS;
    }

    /**
     * Turns a fragment into a {@link Predicate} over entities.
     */
    public <T> Predicate<T> compile(PredicateFragment<T> fragment) {
        Objects.requireNonNull(fragment, "fragment must not be null");
        return entity -> test(fragment, entity);
    }

    /**
     * @return whether {@code entity} satisfies {@code fragment}
     * @throws ExpressionEvaluationException if the tree cannot be evaluated on {@code entity}
     */
    public <T> boolean test(PredicateFragment<T> fragment, T entity) {
        Interpreter interpreter = new Interpreter(fragment.placeholder(), entity);
        return interpreter.condition(fragment.body());
    }

    /**
     * Evaluates the body of any lambda (fragment or accessor) with its placeholder bound to {@code entity}.
     */
    public Object evaluate(LambdaExpr lambda, Object entity) {
        Objects.requireNonNull(lambda, "lambda must not be null");
        return lambda.body().accept(new Interpreter(lambda.placeholder(), entity));
    }

    private final class Interpreter implements ExprVisitor<Object> {

        private final Placeholder placeholder;
        private final Object entity;

        private Interpreter(Placeholder placeholder, Object entity) {
            this.placeholder = placeholder;
            this.entity = entity;
        }

        boolean condition(Expr expression) {
            Object value = expression.accept(this);
            if (value == null) {
                onNull("Condition " + ExprPrinter.print(expression) + " evaluated to null");
                return false;
            }
            if (!(value instanceof Boolean)) {
                throw new ExpressionEvaluationException(String.format(
                        "Condition %s evaluated to %s, not a boolean",
                        ExprPrinter.print(expression), value.getClass().getName()));
            }
            return (Boolean) value;
        }

        @Override
        public Object visitPlaceholder(Placeholder node) {
            if (!node.equals(placeholder)) {
                throw new ExpressionEvaluationException(String.format(
                        "Unbound placeholder '%s' (bound: '%s')", node.name(), placeholder.name()));
            }
            return entity;
        }

        @Override
        public Object visitMemberAccess(MemberAccess node) {
            Object target = node.target().accept(this);
            if (target == null) {
                onNull("Cannot read '" + node.member() + "' of null in " + ExprPrinter.print(node));
                return null;
            }
            return MemberResolver.read(target, node.member());
        }

        @Override
        public Object visitConstant(Constant node) {
            return node.value();
        }

        @Override
        public Object visitBinary(BinaryExpr node) {
            switch (node.operator()) {
                case AND:
                    return condition(node.left()) && condition(node.right());
                case OR:
                    return condition(node.left()) || condition(node.right());
                case EQ:
                    return valuesEqual(node.left().accept(this), node.right().accept(this));
                case NE:
                    return !valuesEqual(node.left().accept(this), node.right().accept(this));
                default:
                    return ordering(node);
            }
        }

        @Override
        public Object visitMethodCall(MethodCall node) {
            Object target = node.target().accept(this);
            Object[] arguments = new Object[node.arguments().size()];
            for (int i = 0; i < arguments.length; i++) {
                arguments[i] = node.arguments().get(i).accept(this);
            }
            if (target == null || hasNull(arguments)) {
                onNull("Null operand in " + ExprPrinter.print(node));
                return null;
            }
            try {
                return node.method().invoke(target, arguments);
            } catch (IllegalArgumentException e) {
                throw new ExpressionEvaluationException("Cannot evaluate " + ExprPrinter.print(node), e);
            }
        }

        private Object ordering(BinaryExpr node) {
            Object left = node.left().accept(this);
            Object right = node.right().accept(this);
            if (left == null || right == null) {
                onNull("Null operand in " + ExprPrinter.print(node));
                return false;
            }
            int comparison = compare(left, right, node);
            switch (node.operator()) {
                case GT:
                    return comparison > 0;
                case GE:
                    return comparison >= 0;
                case LT:
                    return comparison < 0;
                case LE:
                    return comparison <= 0;
                default:
                    throw new ExpressionEvaluationException("Unsupported operator " + node.operator());
            }
        }

        private void onNull(String message) {
            if (nullPolicy == NullNavigationPolicy.STRICT_EXCEPTION) {
                throw new ExpressionEvaluationException(message);
            }
        }
    }

    private static boolean hasNull(Object[] values) {
        for (Object value : values) {
            if (value == null) return true;
        }
        return false;
    }

    private static boolean valuesEqual(Object left, Object right) {
        if (left instanceof Number && right instanceof Number && left.getClass() != right.getClass()) {
            if (isFloatingPoint(left) || isFloatingPoint(right)) {
                double l = ((Number) left).doubleValue();
                double r = ((Number) right).doubleValue();
                // NaN equals nothing
                return !Double.isNaN(l) && !Double.isNaN(r) && Double.compare(l, r) == 0;
            }
            return toBigDecimal((Number) left).compareTo(toBigDecimal((Number) right)) == 0;
        }
        return Objects.equals(left, right);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compare(Object left, Object right, BinaryExpr node) {
        if (left instanceof Number && right instanceof Number && left.getClass() != right.getClass()) {
            if (isFloatingPoint(left) || isFloatingPoint(right)) {
                return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
            }
            return toBigDecimal((Number) left).compareTo(toBigDecimal((Number) right));
        }
        if (!(left instanceof Comparable)) {
            throw new ExpressionEvaluationException(String.format(
                    "Cannot order %s values in %s", left.getClass().getName(), ExprPrinter.print(node)));
        }
        try {
            return ((Comparable) left).compareTo(right);
        } catch (ClassCastException e) {
            throw new ExpressionEvaluationException(String.format(
                    "Cannot compare %s with %s in %s",
                    left.getClass().getName(), right.getClass().getName(), ExprPrinter.print(node)), e);
        }
    }

    private static boolean isFloatingPoint(Object value) {
        return value instanceof Double || value instanceof Float;
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        return new BigDecimal(number.toString());
    }
}
