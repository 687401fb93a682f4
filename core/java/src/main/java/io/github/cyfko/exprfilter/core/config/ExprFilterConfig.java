package io.github.cyfko.exprfilter.core.config;

import io.github.cyfko.exprfilter.core.expr.LambdaExpr;
import io.github.cyfko.exprfilter.core.expr.Placeholder;

import java.util.List;
import java.util.Objects;

/**
 * Central configuration object for the composition builders and the in-memory evaluator.
 * <p>
 * Exposes the {@link PlaceholderStrategy} used when several fragments are merged, the
 * name of fresh placeholders, and the {@link NullNavigationPolicy} applied by in-memory
 * evaluation. A builder keeps construction fluent; {@link #defaults()} matches
 * {@code ExprFilterConfig.builder().build()}.
 * </p>
 */
public final class ExprFilterConfig {

    private static final ExprFilterConfig DEFAULTS = builder().build();

    private final PlaceholderStrategy placeholderStrategy;
    private final String placeholderName;
    private final NullNavigationPolicy nullNavigationPolicy;

    private ExprFilterConfig(Builder builder) {
        this.placeholderStrategy = builder.placeholderStrategy;
        this.placeholderName = builder.placeholderName;
        this.nullNavigationPolicy = builder.nullNavigationPolicy;
    }

    public static Builder builder() { return new Builder(); }

    public static ExprFilterConfig defaults() { return DEFAULTS; }

    public PlaceholderStrategy getPlaceholderStrategy() { return placeholderStrategy; }
    public String getPlaceholderName() { return placeholderName; }
    public NullNavigationPolicy getNullNavigationPolicy() { return nullNavigationPolicy; }

    /**
     * Selects the placeholder that a composition over {@code lambdas} is expressed over.
     *
     * @param lambdas the fragments or accessors being merged, in order
     * @return the first lambda's placeholder under {@link PlaceholderStrategy#REUSE_FIRST}
     *         when there is one, a fresh placeholder otherwise
     */
    public Placeholder selectPlaceholder(List<? extends LambdaExpr> lambdas) {
        if (placeholderStrategy == PlaceholderStrategy.REUSE_FIRST && !lambdas.isEmpty()) {
            return lambdas.get(0).placeholder();
        }
        return new Placeholder(placeholderName);
    }

    /**
     * Builder for {@link ExprFilterConfig}.
     */
    public static final class Builder {
        private PlaceholderStrategy placeholderStrategy = PlaceholderStrategy.FRESH; // default
        private String placeholderName = "x"; // default
        private NullNavigationPolicy nullNavigationPolicy = NullNavigationPolicy.NO_MATCH; // default, mirrors SQL

        public Builder placeholderStrategy(PlaceholderStrategy strategy) {
            this.placeholderStrategy = Objects.requireNonNull(strategy, "placeholderStrategy");
            return this;
        }

        /**
         * @throws IllegalArgumentException if {@code name} is not a Java identifier
         */
        public Builder placeholderName(String name) {
            Objects.requireNonNull(name, "placeholderName");
            if (!isIdentifier(name)) {
                throw new IllegalArgumentException("Invalid placeholder name '" + name + "'");
            }
            this.placeholderName = name;
            return this;
        }

        public Builder nullNavigationPolicy(NullNavigationPolicy policy) {
            this.nullNavigationPolicy = Objects.requireNonNull(policy, "nullNavigationPolicy");
            return this;
        }

        public ExprFilterConfig build() { return new ExprFilterConfig(this); }

        private static boolean isIdentifier(String name) {
            if (name.isEmpty() || !Character.isJavaIdentifierStart(name.charAt(0))) {
                return false;
            }
            for (int i = 1; i < name.length(); i++) {
                if (!Character.isJavaIdentifierPart(name.charAt(i))) {
                    return false;
                }
            }
            return true;
        }
    }
}
