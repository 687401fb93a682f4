package io.github.cyfko.exprfilter.jpa;

import io.github.cyfko.exprfilter.core.expr.BinaryExpr;
import io.github.cyfko.exprfilter.core.expr.BinaryOperator;
import io.github.cyfko.exprfilter.core.expr.Constant;
import io.github.cyfko.exprfilter.core.expr.Expr;
import io.github.cyfko.exprfilter.core.expr.ExprPrinter;
import io.github.cyfko.exprfilter.core.expr.ExprVisitor;
import io.github.cyfko.exprfilter.core.expr.MemberAccess;
import io.github.cyfko.exprfilter.core.expr.MethodCall;
import io.github.cyfko.exprfilter.core.expr.Placeholder;
import io.github.cyfko.exprfilter.core.expr.PredicateFragment;
import io.github.cyfko.exprfilter.jpa.exception.ExpressionTranslationException;
import io.github.cyfko.exprfilter.jpa.utils.PathResolverUtils;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Lowers expression trees to JPA Criteria API predicates.
 * <p>
 * The translation is deferred: {@link #toResolver(PredicateFragment)} returns a
 * {@link PredicateResolver} and the tree is walked each time the resolver is applied to
 * a query root.
 * </p>
 *
 * <h2>Lowering rules</h2>
 * <ul>
 *   <li>placeholder: the query root</li>
 *   <li>member access: {@code Path.get}; intermediate associations become LEFT joins
 *       (see {@link PathResolverUtils#navigate(Path, String)})</li>
 *   <li>{@code &&}, {@code ||}: {@code cb.and}, {@code cb.or}</li>
 *   <li>constant {@code true}/{@code false}: {@code cb.conjunction()}/{@code cb.disjunction()}</li>
 *   <li>comparison with a constant: the constant is bound as a parameter value; a
 *       {@code null} constant gives {@code IS NULL}/{@code IS NOT NULL}; {@code !=} also
 *       keeps rows where the compared value is {@code null}</li>
 *   <li>{@code contains} with constant text: {@code LIKE '%text%' ESCAPE '\'}</li>
 *   <li>{@code contains} with any other argument: {@code LOCATE(text, target) > 0}</li>
 *   <li>a bare boolean member as a condition: {@code cb.isTrue}</li>
 * </ul>
 * <p>Anything else raises {@link ExpressionTranslationException} when the resolver runs.</p>
 *
 * <pre>{@code
 * PredicateFragment<Order> recent = RangeFilterBuilder.defaults().between(dateTime, from, to);
 * PredicateResolver<Order> resolver = JpaPredicateTranslator.toResolver(recent);
 * query.where(resolver.resolve(root, query, cb));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class JpaPredicateTranslator {

    private static final Logger logger = Logger.getLogger(JpaPredicateTranslator.class.getName());

    private static final char LIKE_ESCAPE = '\\';

    private JpaPredicateTranslator() {
        throw new UnsupportedOperationException("JpaPredicateTranslator is a utility class and cannot be instantiated");
    }

    /**
     * Creates a resolver translating {@code fragment} against the root it is given.
     *
     * @param fragment the filter
     * @param <E> the entity type
     * @return the deferred predicate
     */
    public static <E> PredicateResolver<E> toResolver(PredicateFragment<E> fragment) {
        Objects.requireNonNull(fragment, "fragment must not be null");
        return (root, query, cb) -> {
            logger.fine(() -> "Translating filter " + fragment);
            return new Lowering(fragment.placeholder(), root, cb).condition(fragment.body());
        };
    }

    /**
     * Escapes the {@code LIKE} wildcards of {@code text} with {@code \}.
     */
    static String escapeLike(String text) {
        StringBuilder escaped = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    private static final class Lowering implements ExprVisitor<Expression<?>> {

        private final Placeholder placeholder;
        private final Root<?> root;
        private final CriteriaBuilder cb;

        private Lowering(Placeholder placeholder, Root<?> root, CriteriaBuilder cb) {
            this.placeholder = placeholder;
            this.root = root;
            this.cb = cb;
        }

        @SuppressWarnings("unchecked")
        Predicate condition(Expr expression) {
            Expression<?> lowered = expression.accept(this);
            if (lowered instanceof Predicate predicate) {
                return predicate;
            }
            Class<?> javaType = lowered.getJavaType();
            if (javaType == Boolean.class || javaType == boolean.class) {
                return cb.isTrue((Expression<Boolean>) lowered);
            }
            throw new ExpressionTranslationException(String.format(
                    "%s is not a boolean condition (type %s)",
                    ExprPrinter.print(expression), javaType == null ? "unknown" : javaType.getName()));
        }

        @Override
        public Expression<?> visitPlaceholder(Placeholder node) {
            if (!node.equals(placeholder)) {
                throw new ExpressionTranslationException(String.format(
                        "Unbound placeholder '%s' (bound: '%s')", node.name(), placeholder.name()));
            }
            return root;
        }

        @Override
        public Expression<?> visitMemberAccess(MemberAccess node) {
            return PathResolverUtils.get(owner(node.target()), node.member());
        }

        @Override
        public Expression<?> visitConstant(Constant node) {
            Object value = node.value();
            if (value instanceof Boolean flag) {
                return flag ? cb.conjunction() : cb.disjunction();
            }
            if (value == null) {
                return cb.nullLiteral(Object.class);
            }
            return cb.literal(value);
        }

        @Override
        public Expression<?> visitBinary(BinaryExpr node) {
            return switch (node.operator()) {
                case AND -> cb.and(condition(node.left()), condition(node.right()));
                case OR -> cb.or(condition(node.left()), condition(node.right()));
                default -> comparison(node);
            };
        }

        @Override
        @SuppressWarnings("unchecked")
        public Expression<?> visitMethodCall(MethodCall node) {
            switch (node.method()) {
                case CONTAINS: {
                    Expression<String> target = (Expression<String>) node.target().accept(this);
                    Expr argument = node.arguments().get(0);
                    if (argument instanceof Constant constant) {
                        if (constant.value() == null) {
                            return cb.disjunction();
                        }
                        String pattern = "%" + escapeLike(String.valueOf(constant.value())) + "%";
                        return cb.like(target, pattern, LIKE_ESCAPE);
                    }
                    Expression<String> text = (Expression<String>) argument.accept(this);
                    return cb.greaterThan(cb.locate(target, text), 0);
                }
                default:
                    throw new ExpressionTranslationException("Unsupported method " + node.method().getMethodName());
            }
        }

        private Path<?> owner(Expr target) {
            if (target instanceof MemberAccess access) {
                return PathResolverUtils.navigate(owner(access.target()), access.member());
            }
            Expression<?> lowered = target.accept(this);
            if (lowered instanceof Path<?> path) {
                return path;
            }
            throw new ExpressionTranslationException("Cannot read a member of " + ExprPrinter.print(target));
        }

        private Predicate comparison(BinaryExpr node) {
            BinaryOperator operator = node.operator();
            Expr subject = node.left();
            Expr other = node.right();
            if (subject instanceof Constant && !(other instanceof Constant)) {
                subject = node.right();
                other = node.left();
                operator = mirror(operator);
            }

            Expression<?> left = subject.accept(this);
            if (other instanceof Constant constant) {
                return compareWithValue(operator, left, constant.value());
            }
            return compareExpressions(operator, left, other.accept(this));
        }

        @SuppressWarnings({"unchecked", "rawtypes"})
        private Predicate compareWithValue(BinaryOperator operator, Expression<?> left, Object value) {
            if (value == null) {
                return switch (operator) {
                    case EQ -> cb.isNull(left);
                    case NE -> cb.isNotNull(left);
                    default -> cb.disjunction();
                };
            }
            Expression<Comparable> comparable = (Expression<Comparable>) left;
            return switch (operator) {
                case EQ -> cb.equal(left, value);
                case NE -> cb.or(cb.isNull(left), cb.notEqual(left, value));
                case GT -> cb.greaterThan(comparable, (Comparable) value);
                case GE -> cb.greaterThanOrEqualTo(comparable, (Comparable) value);
                case LT -> cb.lessThan(comparable, (Comparable) value);
                case LE -> cb.lessThanOrEqualTo(comparable, (Comparable) value);
                default -> throw new ExpressionTranslationException("Unsupported comparison " + operator);
            };
        }

        @SuppressWarnings({"unchecked", "rawtypes"})
        private Predicate compareExpressions(BinaryOperator operator, Expression<?> left, Expression<?> right) {
            Expression<Comparable> l = (Expression<Comparable>) left;
            Expression<Comparable> r = (Expression<Comparable>) right;
            return switch (operator) {
                case EQ -> cb.equal(left, right);
                case NE -> cb.notEqual(left, right);
                case GT -> cb.greaterThan(l, r);
                case GE -> cb.greaterThanOrEqualTo(l, r);
                case LT -> cb.lessThan(l, r);
                case LE -> cb.lessThanOrEqualTo(l, r);
                default -> throw new ExpressionTranslationException("Unsupported comparison " + operator);
            };
        }

        private static BinaryOperator mirror(BinaryOperator operator) {
            return switch (operator) {
                case GT -> BinaryOperator.LT;
                case GE -> BinaryOperator.LE;
                case LT -> BinaryOperator.GT;
                case LE -> BinaryOperator.GE;
                default -> operator;
            };
        }
    }
}
