package io.github.cyfko.restql.core.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exception thrown when a record cannot be saved because some of its attributes are invalid.
 * <p>
 * Carries field-level messages, keyed by attribute name, so that the HTTP layer can answer with
 * a {@code 422 Unprocessable Entity} payload such as:
 * </p>
 * <pre>{@code
 * { "errors": { "title": ["must not be blank"], "author": ["is invalid"] } }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class RecordValidationException extends RuntimeException {

    private final Map<String, List<String>> fieldErrors;

    /**
     * @param fieldErrors messages grouped by attribute name (must not be empty)
     */
    public RecordValidationException(Map<String, List<String>> fieldErrors) {
        super("Validation failed: " + fieldErrors);
        Map<String, List<String>> copy = new LinkedHashMap<>();
        fieldErrors.forEach((field, messages) -> copy.put(field, List.copyOf(messages)));
        this.fieldErrors = Collections.unmodifiableMap(copy);
    }

    /**
     * @param fieldErrors messages grouped by attribute name
     * @param cause       the underlying validation or conversion failure
     */
    public RecordValidationException(Map<String, List<String>> fieldErrors, Throwable cause) {
        this(fieldErrors);
        initCause(cause);
    }

    /**
     * Shortcut for a single invalid attribute.
     *
     * @param field   attribute name
     * @param message description of the problem
     * @return the exception
     */
    public static RecordValidationException of(String field, String message) {
        return new RecordValidationException(Map.of(field, List.of(message)));
    }

    public Map<String, List<String>> getFieldErrors() {
        return fieldErrors;
    }
}
