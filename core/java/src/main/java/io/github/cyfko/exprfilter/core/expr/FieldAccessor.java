package io.github.cyfko.exprfilter.core.expr;

import java.util.Objects;
import java.util.function.Function;

/**
 * A scalar-valued expression over a single placeholder, locating the data a filter
 * compares or searches.
 * <p>
 * The accessor body is never evaluated by the builders: it is spliced into the filter
 * tree, so nested navigation (e.g. through a related entity) stays part of the
 * translated filter. {@code valueType} is the declared type of the accessed value and
 * drives capability checks such as {@link ScalarMethod#supports(Class)}.
 * </p>
 *
 * <pre>{@code
 * FieldAccessor<Order, LocalDateTime> placedAt =
 *     FieldAccessor.of(LocalDateTime.class, "o", o -> o.get("dateTime"));
 * FieldAccessor<Order, String> firstName =
 *     FieldAccessor.path(String.class, "customer.firstName");
 * }</pre>
 *
 * @param <T> the entity type
 * @param <V> the accessed value type
 * @param valueType runtime token for {@code V}
 * @param placeholder the accessor's own variable
 * @param body the scalar expression
 * @author Frank KOSSI
 * @since 1.0
 */
public record FieldAccessor<T, V>(Class<V> valueType, Placeholder placeholder, Expr body) implements LambdaExpr {

    private static final String DEFAULT_PLACEHOLDER = "x";

    public FieldAccessor {
        Objects.requireNonNull(valueType, "valueType must not be null");
        Objects.requireNonNull(placeholder, "placeholder must not be null");
        Objects.requireNonNull(body, "body must not be null");
        LambdaExpr.requireClosed(placeholder, body);
    }

    public static <T, V> FieldAccessor<T, V> of(Class<V> valueType, String placeholderName,
                                                Function<Placeholder, Expr> definition) {
        Placeholder placeholder = new Placeholder(placeholderName);
        return new FieldAccessor<>(valueType, placeholder, definition.apply(placeholder));
    }

    /**
     * Builds an accessor from a dot-separated property path.
     *
     * @param valueType type of the value at the end of the path
     * @param dottedPath e.g. {@code "customer.firstName"}
     * @return an accessor over placeholder {@code x}
     * @throws IllegalArgumentException if the path is blank or has an empty segment
     */
    public static <T, V> FieldAccessor<T, V> path(Class<V> valueType, String dottedPath) {
        Objects.requireNonNull(dottedPath, "dottedPath must not be null");
        if (dottedPath.isBlank()) {
            throw new IllegalArgumentException("Property path must not be blank");
        }
        Placeholder placeholder = new Placeholder(DEFAULT_PLACEHOLDER);
        Expr body = placeholder;
        for (String segment : dottedPath.split("\\.", -1)) {
            if (segment.isBlank()) {
                throw new IllegalArgumentException("Empty segment in property path '" + dottedPath + "'");
            }
            body = body.get(segment.trim());
        }
        return new FieldAccessor<>(valueType, placeholder, body);
    }

    @Override
    public String toString() {
        return ExprPrinter.print(this) + " : " + valueType.getSimpleName();
    }
}
