package io.github.cyfko.restql.core.exception;

/**
 * Thrown when a reserved directive ({@code order}, {@code limit}, {@code offset}, {@code page},
 * {@code per_page}, {@code include}) carries a malformed value.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class InvalidDirectiveException extends ClassificationException {

    /**
     * @param key    the directive key, prefixed by its nesting path when nested
     * @param value  the raw value received
     * @param reason what was expected
     */
    public InvalidDirectiveException(String key, String value, String reason) {
        super(key, String.format("Invalid value '%s' for '%s': %s", value, key, reason));
    }

    /**
     * @param key    the directive key
     * @param value  the raw value received
     * @param reason what was expected
     * @param cause  the original parsing failure
     */
    public InvalidDirectiveException(String key, String value, String reason, Throwable cause) {
        super(key, String.format("Invalid value '%s' for '%s': %s", value, key, reason), cause);
    }
}
