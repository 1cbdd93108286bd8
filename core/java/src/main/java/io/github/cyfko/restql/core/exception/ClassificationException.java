package io.github.cyfko.restql.core.exception;

/**
 * Exception thrown when a request parameter cannot be classified into a usable shape.
 * <p>
 * Raised by the {@link io.github.cyfko.restql.core.parsing.ParameterClassifier} before any query
 * is built. The offending parameter key is kept so that the HTTP layer can report it back to the
 * client. Parameters that are merely unknown never raise this exception: they are dropped.
 * </p>
 *
 * <p><strong>Typical messages:</strong></p>
 * <pre>{@code
 * // limit=abc
 * // → "Invalid value 'abc' for 'limit': expected a non-negative integer"
 *
 * // order=name sideways
 * // → "Invalid value 'name sideways' for 'order': unknown direction 'sideways'"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see InvalidDirectiveException
 */
public class ClassificationException extends RuntimeException {

    private final String key;

    /**
     * Creates the exception for the given parameter key.
     *
     * @param key     the parameter key that could not be classified (may include a nesting prefix, e.g. {@code comments.limit})
     * @param message a client-facing description of the problem
     */
    public ClassificationException(String key, String message) {
        super(message);
        this.key = key;
    }

    /**
     * Creates the exception for the given parameter key with an underlying cause.
     *
     * @param key     the parameter key that could not be classified
     * @param message a client-facing description of the problem
     * @param cause   the original parsing failure
     */
    public ClassificationException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    /**
     * @return the offending parameter key
     */
    public String getKey() {
        return key;
    }
}
