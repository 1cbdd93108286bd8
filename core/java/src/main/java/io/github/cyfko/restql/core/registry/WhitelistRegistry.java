package io.github.cyfko.restql.core.registry;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Per resource type declaration of the names clients may use in query parameters.
 *
 * <p>
 * Every name reaching query construction goes through {@link #isAllowed(String, String)}.
 * Registration is additive: registering a type twice merges both declarations, and there is no
 * removal. Querying an undeclared type answers {@link NameKind#NONE} for every name, so unknown
 * types fail closed.
 * </p>
 *
 * <h2>Name conflicts</h2>
 * <p>
 * A name declared under several kinds for the same type is logged as a warning and resolved
 * with the precedence FIELD, then ASSOCIATION, then REMOTE.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * The registry is written during single-threaded start-up and only read afterwards. It holds
 * plain maps and performs no locking: do not register while requests are being served.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * WhitelistRegistry registry = new WhitelistRegistry();
 * registry.register("posts",
 *     Set.of("title", "createdAt"),
 *     List.of(AssociationDefinition.hasMany("comments", "comments", "post"),
 *             AssociationDefinition.belongsTo("author", "authors")),
 *     List.of());
 *
 * registry.isAllowed("posts", "title");    // FIELD
 * registry.isAllowed("posts", "comments"); // ASSOCIATION
 * registry.isAllowed("posts", "secret");   // NONE
 * registry.isAllowed("users", "title");    // NONE (undeclared type)
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class WhitelistRegistry {

    private static final Logger logger = Logger.getLogger(WhitelistRegistry.class.getName());

    private final Map<String, ResourceDefinition> definitions = new HashMap<>();

    /**
     * Declares, or extends the declaration of, a resource type.
     *
     * @param type         resource type name
     * @param fields       scalar field names
     * @param associations associations of the type
     * @param remotes      remote collections of the type
     * @throws NullPointerException if any argument is null
     */
    public void register(String type,
                         Set<String> fields,
                         Collection<AssociationDefinition> associations,
                         Collection<RemoteDefinition> remotes) {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(fields, "fields are required");
        Objects.requireNonNull(associations, "associations are required");
        Objects.requireNonNull(remotes, "remotes are required");

        ResourceDefinition declared = new ResourceDefinition(
                type,
                fields,
                associations.stream().collect(Collectors.toMap(
                        AssociationDefinition::name, Function.identity(), (a, b) -> b, LinkedHashMap::new)),
                remotes.stream().collect(Collectors.toMap(
                        RemoteDefinition::name, Function.identity(), (a, b) -> b, LinkedHashMap::new))
        );

        ResourceDefinition merged = definitions.merge(type, declared, ResourceDefinition::merge);
        warnOnConflicts(merged);
        logger.fine(() -> String.format("Registered resource '%s': fields=%s, associations=%s, remotes=%s",
                type, merged.fields(), merged.associations().keySet(), merged.remotes().keySet()));
    }

    /**
     * Classifies a name for a resource type.
     *
     * @param type resource type name
     * @param name client-supplied name
     * @return the kind of the name, {@link NameKind#NONE} when undeclared
     */
    public NameKind isAllowed(String type, String name) {
        ResourceDefinition definition = definitions.get(type);
        if (definition == null || name == null) {
            return NameKind.NONE;
        }
        if (definition.fields().contains(name)) return NameKind.FIELD;
        if (definition.associations().containsKey(name)) return NameKind.ASSOCIATION;
        if (definition.remotes().containsKey(name)) return NameKind.REMOTE;
        return NameKind.NONE;
    }

    /**
     * @param type resource type name
     * @param name association name
     * @return the association when {@code name} resolves to one
     */
    public Optional<AssociationDefinition> association(String type, String name) {
        if (isAllowed(type, name) != NameKind.ASSOCIATION) {
            return Optional.empty();
        }
        return Optional.of(definitions.get(type).associations().get(name));
    }

    /**
     * @param type resource type name
     * @param name remote collection name
     * @return the remote collection when {@code name} resolves to one
     */
    public Optional<RemoteDefinition> remote(String type, String name) {
        if (isAllowed(type, name) != NameKind.REMOTE) {
            return Optional.empty();
        }
        return Optional.of(definitions.get(type).remotes().get(name));
    }

    public Optional<ResourceDefinition> definitionOf(String type) {
        return Optional.ofNullable(definitions.get(type));
    }

    public Set<String> registeredTypes() {
        return Collections.unmodifiableSet(definitions.keySet());
    }

    private void warnOnConflicts(ResourceDefinition definition) {
        for (String name : definition.associations().keySet()) {
            if (definition.fields().contains(name)) {
                logger.warning(String.format("Resource '%s' declares '%s' both as field and association; field wins",
                        definition.type(), name));
            }
        }
        for (String name : definition.remotes().keySet()) {
            if (definition.fields().contains(name) || definition.associations().containsKey(name)) {
                logger.warning(String.format("Resource '%s' declares remote '%s' under an already used name; remote ignored",
                        definition.type(), name));
            }
        }
    }
}
