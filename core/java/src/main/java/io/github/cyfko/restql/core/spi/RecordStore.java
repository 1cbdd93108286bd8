package io.github.cyfko.restql.core.spi;

import java.util.Map;

/**
 * Storage collaborator for the write actions.
 *
 * <p>
 * Each call is one unit of work. Attribute maps only hold writable names; a singular association
 * is given by the identity of the referenced record.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface RecordStore {

    /**
     * Persists a new record.
     *
     * @param resourceType resource type name
     * @param keyField     attribute the record is located by, the identifier unless configured
     * @param attributes   writable attributes
     * @return value of {@code keyField} on the new record
     * @throws io.github.cyfko.restql.core.exception.RecordValidationException if attributes are invalid
     * @throws io.github.cyfko.restql.core.exception.StatementRejectedException if the storage refuses the write
     */
    Object create(String resourceType, String keyField, Map<String, Object> attributes);

    /**
     * Updates the record located by {@code keyField = key}.
     *
     * @param resourceType resource type name
     * @param keyField     attribute used to locate the record
     * @param key          raw key value
     * @param attributes   writable attributes to change
     * @throws io.github.cyfko.restql.core.exception.ResourceNotFoundException if no record matches
     * @throws io.github.cyfko.restql.core.exception.RecordValidationException if attributes are invalid
     */
    void update(String resourceType, String keyField, Object key, Map<String, Object> attributes);

    /**
     * Deletes the record located by {@code keyField = key}.
     *
     * @param resourceType resource type name
     * @param keyField     attribute used to locate the record
     * @param key          raw key value
     * @throws io.github.cyfko.restql.core.exception.ResourceNotFoundException if no record matches
     * @throws io.github.cyfko.restql.core.exception.StatementRejectedException if the storage refuses the write
     */
    void delete(String resourceType, String keyField, Object key);
}
