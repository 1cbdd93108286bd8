package io.github.cyfko.restql.core.model;

import java.util.Objects;

/**
 * Binds a child collection to the identity of its parent record.
 * <p>
 * The anchor is set by the association resolver from server data only and is never derived
 * from client parameters: storage adapters translate it to {@code <ownershipKey>.<id> = parentId}.
 * </p>
 *
 * @param parentType   the owning resource type
 * @param parentId     identity of the parent record
 * @param ownershipKey attribute of the child type referencing the parent
 */
public record OwnershipAnchor(String parentType, Object parentId, String ownershipKey) {

    public OwnershipAnchor {
        Objects.requireNonNull(parentType, "parentType is required");
        Objects.requireNonNull(parentId, "parentId is required");
        Objects.requireNonNull(ownershipKey, "ownershipKey is required");
    }
}
