package io.github.cyfko.exprfilter.core.exception;

/**
 * Exception thrown when an expression tree cannot be evaluated against in-memory objects.
 * <p>
 * Signals problems found while interpreting a filter, for example:
 * </p>
 * <ul>
 *   <li>a member that exists neither as getter, record accessor nor field</li>
 *   <li>an ordering comparison between values that are not mutually {@link Comparable}</li>
 *   <li>navigation through {@code null} under {@code NullNavigationPolicy.STRICT_EXCEPTION}</li>
 *   <li>a non-boolean value where a condition is expected</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public class ExpressionEvaluationException extends RuntimeException {

    /**
     * @param message explanation of the evaluation failure
     */
    public ExpressionEvaluationException(String message) {
        super(message);
    }

    /**
     * @param message explanation of the evaluation failure
     * @param cause underlying exception, e.g. a reflective access failure
     */
    public ExpressionEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
