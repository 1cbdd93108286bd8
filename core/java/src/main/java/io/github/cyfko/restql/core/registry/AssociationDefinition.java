package io.github.cyfko.restql.core.registry;

import java.util.Objects;

/**
 * Declared relationship between an owner resource type and a target resource type.
 *
 * <p>
 * The {@code ownershipKey} is the attribute of the <em>target</em> that references the owner
 * (for instance {@code post} on comments). It anchors every child query and is a protected
 * field: client filters on it are discarded. A singular association without ownership key is a
 * reference held by the owner itself (for instance {@code author} on posts).
 * </p>
 *
 * <pre>{@code
 * AssociationDefinition.hasMany("comments", "comments", "post");
 * AssociationDefinition.belongsTo("author", "authors");
 * AssociationDefinition.hasOne("profile", "profiles", "author");
 * }</pre>
 *
 * @param name         association name on the owner
 * @param cardinality  number of targets per owner
 * @param targetType   resource type of the targets
 * @param ownershipKey attribute of the target referencing the owner, {@code null} when the owner holds the reference
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record AssociationDefinition(String name, Cardinality cardinality, String targetType, String ownershipKey) {

    public AssociationDefinition {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(cardinality, "cardinality is required");
        Objects.requireNonNull(targetType, "targetType is required");
        if (name.isBlank() || name.contains(".")) {
            throw new IllegalArgumentException("Invalid association name: '" + name + "'");
        }
        if (cardinality == Cardinality.MANY && (ownershipKey == null || ownershipKey.isBlank())) {
            throw new IllegalArgumentException("Association '" + name + "' of cardinality MANY requires an ownership key");
        }
    }

    public static AssociationDefinition belongsTo(String name, String targetType) {
        return new AssociationDefinition(name, Cardinality.ONE, targetType, null);
    }

    public static AssociationDefinition hasOne(String name, String targetType, String ownershipKey) {
        return new AssociationDefinition(name, Cardinality.ONE, targetType, ownershipKey);
    }

    public static AssociationDefinition hasMany(String name, String targetType, String ownershipKey) {
        return new AssociationDefinition(name, Cardinality.MANY, targetType, ownershipKey);
    }

    public boolean isSingular() {
        return cardinality == Cardinality.ONE;
    }

    /**
     * @return {@code true} when the owner itself holds the reference to the target
     */
    public boolean isOwnerReference() {
        return ownershipKey == null;
    }
}
