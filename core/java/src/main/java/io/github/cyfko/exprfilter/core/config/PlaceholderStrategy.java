package io.github.cyfko.exprfilter.core.config;

/**
 * Chooses the placeholder a composed filter is expressed over.
 */
public enum PlaceholderStrategy {
    /** Use a new placeholder named after {@link ExprFilterConfig#getPlaceholderName()}. */
    FRESH,
    /** Reuse the placeholder of the first fragment or accessor. */
    REUSE_FIRST
}
