package io.github.cyfko.restql.core.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Whitelist of one resource type: its queryable fields, associations and remote collections.
 *
 * @param type         resource type name
 * @param fields       scalar field names
 * @param associations associations keyed by name
 * @param remotes      remote collections keyed by name
 */
public record ResourceDefinition(
        String type,
        Set<String> fields,
        Map<String, AssociationDefinition> associations,
        Map<String, RemoteDefinition> remotes
) {

    public ResourceDefinition {
        Objects.requireNonNull(type, "type is required");
        fields = Collections.unmodifiableSet(new LinkedHashSet<>(fields));
        associations = Collections.unmodifiableMap(new LinkedHashMap<>(associations));
        remotes = Collections.unmodifiableMap(new LinkedHashMap<>(remotes));
    }

    /**
     * Merges another declaration of the same type into this one. Names are united; for an
     * association or remote declared twice, the declaration from {@code other} wins.
     *
     * @param other later declaration
     * @return the merged definition
     */
    public ResourceDefinition merge(ResourceDefinition other) {
        if (!type.equals(other.type)) {
            throw new IllegalArgumentException("Cannot merge definitions of '" + type + "' and '" + other.type + "'");
        }
        Set<String> mergedFields = new LinkedHashSet<>(fields);
        mergedFields.addAll(other.fields);
        Map<String, AssociationDefinition> mergedAssociations = new LinkedHashMap<>(associations);
        mergedAssociations.putAll(other.associations);
        Map<String, RemoteDefinition> mergedRemotes = new LinkedHashMap<>(remotes);
        mergedRemotes.putAll(other.remotes);
        return new ResourceDefinition(type, mergedFields, mergedAssociations, mergedRemotes);
    }
}
