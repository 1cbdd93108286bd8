package io.github.cyfko.restql.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Conjunctive predicate of a {@link QueryPlan}.
 * <p>
 * {@code path} is a dotted attribute path relative to the plan's resource type: {@code title}
 * for a scalar field, {@code author.name} for a condition on a related record.
 * </p>
 *
 * @param path     dotted attribute path
 * @param operator comparison to apply
 * @param values   operands, exactly one for {@link Operator#EQ}
 */
public record FilterPredicate(String path, Operator operator, List<Object> values) {

    /**
     * Supported comparisons.
     */
    public enum Operator {
        /** Equality on a single value. */
        EQ,
        /** Membership in a set of values. */
        IN
    }

    public FilterPredicate {
        Objects.requireNonNull(path, "path is required");
        Objects.requireNonNull(operator, "operator is required");
        Objects.requireNonNull(values, "values are required");
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Predicate on '" + path + "' needs at least one value");
        }
        if (operator == Operator.EQ && values.size() != 1) {
            throw new IllegalArgumentException("EQ predicate on '" + path + "' takes exactly one value");
        }
        values = List.copyOf(values);
    }

    /**
     * Builds an equality predicate for one value and a membership predicate otherwise.
     *
     * @param path   dotted attribute path
     * @param values operands
     * @return the predicate
     */
    public static FilterPredicate of(String path, List<?> values) {
        Operator op = values.size() == 1 ? Operator.EQ : Operator.IN;
        return new FilterPredicate(path, op, List.copyOf(values));
    }

    public static FilterPredicate eq(String path, Object value) {
        return new FilterPredicate(path, Operator.EQ, List.of(value));
    }

    /**
     * @return the first segment of the path
     */
    public String head() {
        int dot = path.indexOf('.');
        return dot < 0 ? path : path.substring(0, dot);
    }
}
