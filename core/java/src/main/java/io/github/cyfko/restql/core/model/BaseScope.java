package io.github.cyfko.restql.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The collection a query starts from before client refinements are applied.
 * <p>
 * Constraints are set by server code and bypass the whitelist: they are how a remote
 * collection provider or the dispatcher (key lookups) narrows a collection.
 * </p>
 *
 * @param resourceType resource type of the collection
 * @param anchor       ownership binding, nullable
 * @param constraints  server-side predicates
 */
public record BaseScope(String resourceType, OwnershipAnchor anchor, List<FilterPredicate> constraints) {

    public BaseScope {
        Objects.requireNonNull(resourceType, "resourceType is required");
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }

    /**
     * @param resourceType resource type
     * @return every record of the type
     */
    public static BaseScope all(String resourceType) {
        return new BaseScope(resourceType, null, List.of());
    }

    /**
     * @param resourceType resource type of the children
     * @param anchor       binding to the parent
     * @return the children of one parent
     */
    public static BaseScope anchored(String resourceType, OwnershipAnchor anchor) {
        return new BaseScope(resourceType, Objects.requireNonNull(anchor, "anchor is required"), List.of());
    }

    /**
     * @param path   attribute path
     * @param values accepted values
     * @return a copy of this scope with one more constraint
     */
    public BaseScope where(String path, Object... values) {
        List<FilterPredicate> extended = new ArrayList<>(constraints);
        extended.add(FilterPredicate.of(path, List.of(values)));
        return new BaseScope(resourceType, anchor, extended);
    }
}
