package io.github.cyfko.restql.core.model;

import java.util.Objects;

/**
 * Sort specification with field name and direction.
 *
 * @param field field name to sort by
 * @param direction sort direction ("asc" or "desc", case-insensitive)
 */
public record SortBy(String field, String direction) {
    /**
     * Canonical constructor with validation.
     */
    public SortBy {
        Objects.requireNonNull(field, "Sorting field is required");
        Objects.requireNonNull(direction, "Sorting direction is required. Either 'asc' (ascending) or 'desc' (descending)");

        if (field.isBlank()) {
            throw new IllegalArgumentException("field cannot be blank");
        }

        direction = direction.toLowerCase();
        if (!direction.equals("asc") && !direction.equals("desc")) {
            throw new IllegalArgumentException("direction must be 'asc' or 'desc', got: " + direction);
        }
    }

    public static SortBy asc(String field) {
        return new SortBy(field, "asc");
    }

    public static SortBy desc(String field) {
        return new SortBy(field, "desc");
    }

    /**
     * @return {@code true} when sorting is descending
     */
    public boolean isDescending() {
        return "desc".equals(direction);
    }
}
