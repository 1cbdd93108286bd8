package io.github.cyfko.restql.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Classified and whitelisted representation of one request's query parameters.
 *
 * <p>
 * Produced by the {@link io.github.cyfko.restql.core.parsing.ParameterClassifier}: every name it
 * holds was checked against the whitelist of {@code resourceType}. Nested association nodes are
 * themselves refinement requests, classified against the association's target type, so that a
 * query string such as
 * </p>
 * <pre>{@code
 * title=Hello&comments.approved=true&comments.order=-createdAt&comments.limit=3&include=author
 * }</pre>
 * <p>becomes the tree:</p>
 * <pre>{@code
 * posts  filters=[title=Hello]
 *  ├─ comments  filters=[approved=true] order=[createdAt desc] limit=3
 *  └─ author    (empty node: eager load only)
 * }</pre>
 *
 * <h2>Component Details</h2>
 * <dl>
 *   <dt><strong>{@code pagination}</strong></dt>
 *   <dd>Raw {@code limit}/{@code offset}, {@code null} when neither was sent.</dd>
 *   <dt><strong>{@code page}</strong></dt>
 *   <dd>Raw {@code page}/{@code per_page}, {@code null} when neither was sent. Wins over
 *       {@code pagination} during refinement.</dd>
 * </dl>
 *
 * Instances are request-scoped and immutable.
 *
 * @param resourceType the resource type the names were classified against
 * @param filters      conjunctive conditions
 * @param order        ordering, possibly empty
 * @param pagination   raw limit/offset window, nullable
 * @param page         raw page window, nullable
 * @param associations association-traversal nodes keyed by association name
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record RefinementRequest(
        String resourceType,
        List<Filter> filters,
        List<SortBy> order,
        Pagination pagination,
        PageRequest page,
        Map<String, RefinementRequest> associations
) {

    public RefinementRequest {
        Objects.requireNonNull(resourceType, "resourceType is required");
        filters = filters == null ? List.of() : List.copyOf(filters);
        order = order == null ? List.of() : List.copyOf(order);
        associations = associations == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(associations));
    }

    /**
     * @param resourceType the resource type
     * @return a request without any condition, ordering, window or traversal
     */
    public static RefinementRequest empty(String resourceType) {
        return new RefinementRequest(resourceType, List.of(), List.of(), null, null, Map.of());
    }

    /**
     * @param retained the filters to keep
     * @return a copy of this request holding only {@code retained} as filters
     */
    public RefinementRequest withFilters(List<Filter> retained) {
        return new RefinementRequest(resourceType, retained, order, pagination, page, associations);
    }

    /**
     * @param nodes the traversal nodes to keep
     * @return a copy of this request holding only {@code nodes} as traversal
     */
    public RefinementRequest withAssociations(Map<String, RefinementRequest> nodes) {
        return new RefinementRequest(resourceType, filters, order, pagination, page, nodes);
    }

    /**
     * @return a copy keeping only the traversal tree, as needed for singular relations
     */
    public RefinementRequest associationsOnly() {
        return new RefinementRequest(resourceType, List.of(), List.of(), null, null, associations);
    }
}
