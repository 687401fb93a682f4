package io.github.cyfko.exprfilter.jpa.exception;

/**
 * Exception thrown when an expression tree cannot be lowered to a JPA Criteria predicate.
 *
 * <p>This typically occurs when:</p>
 * <ul>
 *   <li>A non-boolean expression is used where a condition is expected</li>
 *   <li>A member does not exist on the entity model</li>
 *   <li>A path navigates through a collection-valued association</li>
 * </ul>
 *
 * @since 1.0
 */
public class ExpressionTranslationException extends RuntimeException {

    public ExpressionTranslationException(String message) {
        super(message);
    }

    public ExpressionTranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
