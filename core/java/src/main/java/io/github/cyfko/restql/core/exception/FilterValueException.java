package io.github.cyfko.restql.core.exception;

/**
 * Thrown by storage adapters when a filter value cannot be converted to the type of the
 * attribute it targets (for instance {@code id=abc} on a numeric identifier).
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterValueException extends RuntimeException {

    public FilterValueException(String message) {
        super(message);
    }

    public FilterValueException(String message, Throwable cause) {
        super(message, cause);
    }
}
