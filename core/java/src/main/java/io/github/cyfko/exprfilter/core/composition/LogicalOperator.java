package io.github.cyfko.exprfilter.core.composition;

import io.github.cyfko.exprfilter.core.exception.InvalidOperatorException;

/**
 * Operator used to fold sibling fragments together.
 * <p>
 * Both operators are associative and commutative at the semantic level; the combinator
 * nevertheless produces a fixed left-to-right fold in fragment order.
 * </p>
 *
 * <ul>
 *     <li>AND / &amp; / &amp;&amp;</li>
 *     <li>OR / | / ||</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public enum LogicalOperator {

    /** Entity matches only if every fragment matches. */
    AND("&", "&&"),

    /** Entity matches if at least one fragment matches. */
    OR("|", "||");

    private final String symbol;
    private final String alternateSymbol;

    LogicalOperator(String symbol, String alternateSymbol) {
        this.symbol = symbol;
        this.alternateSymbol = alternateSymbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Finds a {@code LogicalOperator} by name or symbol, ignoring case.
     *
     * @param value "AND", "&amp;", "&amp;&amp;", "OR", "|" or "||"
     * @return the matching operator, never {@code null}
     * @throws InvalidOperatorException if {@code value} is {@code null} or unknown
     */
    public static LogicalOperator fromString(String value) {
        if (value == null) {
            throw new InvalidOperatorException("Logical operator must not be null");
        }
        String trimmed = value.trim();
        for (LogicalOperator operator : values()) {
            if (operator.name().equalsIgnoreCase(trimmed)
                    || operator.symbol.equals(trimmed)
                    || operator.alternateSymbol.equals(trimmed)) {
                return operator;
            }
        }
        throw new InvalidOperatorException("Unknown logical operator '" + value + "'");
    }
}
