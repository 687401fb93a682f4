package io.github.cyfko.exprfilter.core.exception;

/**
 * Exception thrown when a scalar primitive a builder relies on is not available for
 * the type it would be applied to.
 * <p>
 * The substring filter needs a "contains" operation on the accessed values. It resolves
 * that operation once, before building any tree; when the operation cannot be found for
 * the declared value type of an accessor, construction fails with this exception instead
 * of producing a filter that would break for every row.
 * </p>
 *
 * <p><strong>Typical causes:</strong></p>
 * <ul>
 *   <li>An accessor declared over a non-textual type passed to a substring filter</li>
 *   <li>An unknown method name given to {@code ScalarMethod.resolve}</li>
 * </ul>
 *
 * <pre>{@code
 * FieldAccessor<Order, LocalDateTime> placedAt = FieldAccessor.path(LocalDateTime.class, "dateTime");
 * SubstringFilterBuilder.defaults().anyContains("2025", List.of(placedAt));
 * // -> CapabilityMissingException: Method 'contains' is not available on java.time.LocalDateTime ...
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public class CapabilityMissingException extends RuntimeException {

    /**
     * @param message which capability is missing and for which type
     */
    public CapabilityMissingException(String message) {
        super(message);
    }

    /**
     * @param message which capability is missing and for which type
     * @param cause underlying lookup failure
     */
    public CapabilityMissingException(String message, Throwable cause) {
        super(message, cause);
    }
}
