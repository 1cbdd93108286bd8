package io.github.cyfko.restql.core.registry;

import io.github.cyfko.restql.core.spi.RemoteCollectionProvider;

import java.util.Objects;

/**
 * Declared virtual collection computed by server logic.
 *
 * @param name       collection name on the owner
 * @param targetType resource type of the records the collection yields, used to gate parameters
 * @param provider   server logic resolving the collection
 */
public record RemoteDefinition(String name, String targetType, RemoteCollectionProvider provider) {

    public RemoteDefinition {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(targetType, "targetType is required");
        Objects.requireNonNull(provider, "provider is required");
        if (name.isBlank() || name.contains(".")) {
            throw new IllegalArgumentException("Invalid remote name: '" + name + "'");
        }
    }
}
