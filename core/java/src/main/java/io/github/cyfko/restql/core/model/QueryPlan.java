package io.github.cyfko.restql.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Executable description of one query, produced by the
 * {@link io.github.cyfko.restql.core.refine.QueryRefiner}.
 *
 * <p>
 * A plan is storage-agnostic: it names attributes by path and leaves translation to a
 * {@link io.github.cyfko.restql.core.spi.QueryExecutor}. Execution semantics are fixed:
 * </p>
 * <ol>
 *   <li>rows of {@code resourceType}, restricted to the {@code anchor} when present;</li>
 *   <li>every predicate applied as a conjunction;</li>
 *   <li>rows sorted by {@code order};</li>
 *   <li>the {@code pagination} window applied last;</li>
 *   <li>each eager load resolved for the whole page in one batched query.</li>
 * </ol>
 *
 * Plans are built per request and never cached.
 *
 * @param resourceType root resource type
 * @param anchor       ownership binding, {@code null} for top-level collections
 * @param predicates   conjunctive predicates
 * @param eagerLoads   associations loaded alongside the rows
 * @param order        final sort, never empty once refined
 * @param pagination   row window applied after filtering and sorting
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record QueryPlan(
        String resourceType,
        OwnershipAnchor anchor,
        List<FilterPredicate> predicates,
        List<EagerLoad> eagerLoads,
        List<SortBy> order,
        Pagination pagination
) {

    public QueryPlan {
        Objects.requireNonNull(resourceType, "resourceType is required");
        predicates = predicates == null ? List.of() : List.copyOf(predicates);
        eagerLoads = eagerLoads == null ? List.of() : List.copyOf(eagerLoads);
        order = order == null ? List.of() : List.copyOf(order);
        Objects.requireNonNull(pagination, "pagination is required");
    }

    public boolean isAnchored() {
        return anchor != null;
    }

    /**
     * @param window the row window to use
     * @return a copy of this plan with another window
     */
    public QueryPlan withPagination(Pagination window) {
        return new QueryPlan(resourceType, anchor, predicates, eagerLoads, order, window);
    }
}
