package io.github.cyfko.restql.core.model;

import io.github.cyfko.restql.core.registry.AssociationDefinition;

import java.util.Objects;

/**
 * Instruction to load an association for every row of the owning plan in one batched query.
 * <p>
 * The child plan carries the conditions, ordering and window that apply inside the nested
 * collection, per parent row. It has no anchor: the adapter binds it to the batch of parent
 * identities. For singular associations the child plan only carries further eager loads.
 * </p>
 *
 * @param association the association to load
 * @param plan        plan of the nested collection
 */
public record EagerLoad(AssociationDefinition association, QueryPlan plan) {

    public EagerLoad {
        Objects.requireNonNull(association, "association is required");
        Objects.requireNonNull(plan, "plan is required");
    }

    public String name() {
        return association.name();
    }
}
