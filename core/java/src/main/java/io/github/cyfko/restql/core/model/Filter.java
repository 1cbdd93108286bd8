package io.github.cyfko.restql.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Client-supplied condition on a whitelisted name.
 * <p>
 * A single value means equality, several values mean set membership.
 * Values stay raw strings; storage adapters convert them to the attribute type.
 * </p>
 *
 * @param field  the whitelisted name the condition applies to
 * @param values the raw values, never empty
 */
public record Filter(String field, List<String> values) {

    public Filter {
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(values, "values are required");
        if (values.isEmpty()) {
            throw new IllegalArgumentException("A filter needs at least one value: " + field);
        }
        values = List.copyOf(values);
    }

    public static Filter of(String field, String... values) {
        return new Filter(field, List.of(values));
    }

    public boolean isMultiValued() {
        return values.size() > 1;
    }
}
