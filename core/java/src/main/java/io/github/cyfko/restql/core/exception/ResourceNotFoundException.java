package io.github.cyfko.restql.core.exception;

/**
 * Distinguishable not-found signal raised when a record cannot be located by its configured key.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ResourceNotFoundException extends RuntimeException {

    /**
     * @param resourceType the resource type searched
     * @param keyField     the key field used for the lookup
     * @param key          the key value received
     */
    public ResourceNotFoundException(String resourceType, String keyField, Object key) {
        super(String.format("Couldn't find %s with '%s'=%s", resourceType, keyField, key));
    }

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
