package io.github.cyfko.restql.core.registry;

/**
 * Number of target records an association yields for one owner.
 */
public enum Cardinality {
    /** At most one related record ({@code belongs_to} or {@code has_one} style). */
    ONE,
    /** Any number of related records. */
    MANY
}
