package io.github.cyfko.exprfilter.jpa.utils;

import io.github.cyfko.exprfilter.jpa.exception.ExpressionTranslationException;
import jakarta.persistence.criteria.Fetch;
import jakarta.persistence.criteria.FetchParent;
import jakarta.persistence.criteria.From;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.JoinType;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.metamodel.Attribute;
import jakarta.persistence.metamodel.ManagedType;
import jakarta.persistence.metamodel.PluralAttribute;
import jakarta.persistence.metamodel.SingularAttribute;
import jakarta.persistence.metamodel.Type;

import java.util.Objects;

/**
 * Path navigation helpers for translated filters and fetch plans.
 * <p>
 * Attributes are looked up in the JPA metamodel of the current {@link From}. Navigating
 * through a single-valued association creates (or reuses) a {@link JoinType#LEFT LEFT}
 * join, so an entity whose association is {@code null} is still a row of the query and
 * only the conditions over the missing side fail to match. Embedded attributes are
 * navigated with {@link Path#get(String)}.
 * </p>
 *
 * <pre>{@code
 * Path<?> city = PathResolverUtils.navigate(
 *         PathResolverUtils.navigate(root, "customer"), "city");   // LEFT JOIN customer
 * PathResolverUtils.fetch(root, "customer.orders");                // LEFT JOIN FETCH, chained
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class PathResolverUtils {

    private PathResolverUtils() {
        throw new UnsupportedOperationException("PathResolverUtils is a utility class and cannot be instantiated");
    }

    /**
     * Resolves the attribute {@code attribute} of {@code owner} as an intermediate step of a path.
     *
     * @param owner the path to navigate from
     * @param attribute the attribute name
     * @return a join for an association, a plain path otherwise
     * @throws ExpressionTranslationException if the attribute does not exist or is collection-valued
     */
    public static Path<?> navigate(Path<?> owner, String attribute) {
        Objects.requireNonNull(owner, "owner must not be null");
        if (!(owner instanceof From<?, ?> from)) {
            return get(owner, attribute);
        }
        Attribute<?, ?> model = attributeOf(from, attribute);
        if (model == null || !model.isAssociation()) {
            return get(from, attribute);
        }
        if (model.isCollection()) {
            throw new ExpressionTranslationException(String.format(
                    "Cannot navigate through collection '%s' of %s", attribute, from.getJavaType().getSimpleName()));
        }
        return joinOnce(from, attribute);
    }

    /**
     * Resolves the attribute {@code attribute} of {@code owner} as the last step of a path.
     *
     * @throws ExpressionTranslationException if the attribute does not exist
     */
    public static Path<?> get(Path<?> owner, String attribute) {
        if (owner instanceof From<?, ?> from) {
            attributeOf(from, attribute);
        }
        try {
            return owner.get(attribute);
        } catch (IllegalArgumentException e) {
            throw new ExpressionTranslationException(String.format(
                    "Attribute '%s' not found on %s", attribute, owner.getJavaType().getSimpleName()), e);
        }
    }

    /**
     * Adds left fetch joins for every segment of a dotted path, reusing existing fetches.
     *
     * @param root the query root
     * @param dottedPath e.g. {@code "customer"} or {@code "customer.orders"}
     * @throws IllegalArgumentException if the path is blank
     */
    public static void fetch(Root<?> root, String dottedPath) {
        Objects.requireNonNull(root, "root must not be null");
        if (dottedPath == null || dottedPath.isBlank()) {
            throw new IllegalArgumentException("Fetch path cannot be null or blank");
        }
        FetchParent<?, ?> current = root;
        for (String segment : dottedPath.split("\\.")) {
            current = fetchOnce(current, segment.trim());
        }
    }

    /**
     * Looks an attribute up in the metamodel of {@code from}.
     *
     * @return the attribute, or {@code null} when the managed type cannot be determined
     * @throws ExpressionTranslationException if the managed type has no such attribute
     */
    private static Attribute<?, ?> attributeOf(From<?, ?> from, String attribute) {
        ManagedType<?> type = managedType(from);
        if (type == null) {
            return null;
        }
        try {
            return type.getAttribute(attribute);
        } catch (IllegalArgumentException e) {
            throw new ExpressionTranslationException(String.format(
                    "Attribute '%s' not found on %s", attribute, from.getJavaType().getSimpleName()), e);
        }
    }

    private static ManagedType<?> managedType(From<?, ?> from) {
        if (from instanceof Root<?> root) {
            return root.getModel();
        }
        if (from instanceof Join<?, ?> join) {
            Attribute<?, ?> attribute = join.getAttribute();
            Type<?> type = null;
            if (attribute instanceof SingularAttribute<?, ?> singular) {
                type = singular.getType();
            } else if (attribute instanceof PluralAttribute<?, ?, ?> plural) {
                type = plural.getElementType();
            }
            return type instanceof ManagedType<?> managed ? managed : null;
        }
        return null;
    }

    /**
     * Join the attribute only once per From, avoids duplicate joins.
     */
    private static From<?, ?> joinOnce(From<?, ?> from, String attribute) {
        return from.getJoins().stream()
                .filter(j -> j.getAttribute().getName().equals(attribute) && j.getJoinType() == JoinType.LEFT)
                .findFirst()
                .map(j -> (From<?, ?>) j)
                .orElseGet(() -> from.join(attribute, JoinType.LEFT));
    }

    private static FetchParent<?, ?> fetchOnce(FetchParent<?, ?> parent, String attribute) {
        for (Fetch<?, ?> fetch : parent.getFetches()) {
            if (fetch.getAttribute().getName().equals(attribute)) {
                return fetch;
            }
        }
        return parent.fetch(attribute, JoinType.LEFT);
    }
}
