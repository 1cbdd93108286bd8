package io.github.cyfko.restql.core.exception;

/**
 * Thrown by storage adapters when the database refuses a write statement: a foreign key still
 * referencing the record, a duplicate unique value, a missing mandatory column.
 * <p>
 * The message names the operation and the resource type only. The storage error is kept as the
 * cause and never reaches the client.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class StatementRejectedException extends RuntimeException {

    /**
     * @param operation    write operation, e.g. {@code delete}
     * @param resourceType the resource type written
     * @param cause        storage failure
     */
    public StatementRejectedException(String operation, String resourceType, Throwable cause) {
        super(String.format("Couldn't %s %s: the statement was rejected by the storage", operation, resourceType), cause);
    }
}
