package io.github.cyfko.exprfilter.core.exception;

/**
 * Exception thrown when a logical operator cannot be recognized.
 * <p>
 * Raised by {@code LogicalOperator.fromString} for unknown symbols and by the condition
 * combinator when asked to fold with a {@code null} or unhandled operator. This is a
 * programming error; the combinator never falls back to a default operator.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public class InvalidOperatorException extends RuntimeException {

    public InvalidOperatorException(String message) {
        super(message);
    }

    public InvalidOperatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
