package io.github.cyfko.restql.core.dispatch;

import io.github.cyfko.restql.core.registry.AssociationDefinition;
import io.github.cyfko.restql.core.registry.RemoteDefinition;
import io.github.cyfko.restql.core.registry.WhitelistRegistry;
import io.github.cyfko.restql.core.spi.RemoteCollectionProvider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Declaration of one exposed resource type: its backing model, enabled actions and whitelist.
 *
 * <p>
 * Actions are disabled by default; only those passed to {@link Builder#handles(ApiAction...)}
 * get a route. The record name is the root key of single-record payloads and defaults to the
 * decapitalized model class name. The primary key used by {@code show}, {@code update} and
 * {@code destroy} defaults to the storage identifier.
 * </p>
 *
 * <pre>{@code
 * ResourceConfig posts = ResourceConfig.builder("posts", Post.class)
 *     .handles(ApiAction.INDEX, ApiAction.SHOW, ApiAction.CREATE, ApiAction.ASSOCIATED)
 *     .fields("title", "body", "createdAt")
 *     .belongsTo("author", "authors")
 *     .hasMany("comments", "comments", "post")
 *     .remote("commenters", "authors", commentersProvider)
 *     .build();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ResourceConfig {

    private static final Logger logger = Logger.getLogger(ResourceConfig.class.getName());

    private final String type;
    private final Class<?> modelClass;
    private final String recordName;
    private final String primaryKey;
    private final Set<ApiAction> actions;
    private final Set<String> fields;
    private final Set<String> writable;
    private final List<AssociationDefinition> associations;
    private final List<RemoteDefinition> remotes;

    private ResourceConfig(Builder builder) {
        this.type = builder.type;
        this.modelClass = builder.modelClass;
        this.recordName = builder.recordName != null
                ? builder.recordName
                : decapitalize(builder.modelClass.getSimpleName());
        this.primaryKey = builder.primaryKey;
        this.actions = Collections.unmodifiableSet(EnumSet.copyOf(builder.actions));
        this.fields = Collections.unmodifiableSet(new LinkedHashSet<>(builder.fields));
        this.associations = List.copyOf(builder.associations);
        this.remotes = List.copyOf(builder.remotes);
        this.writable = Collections.unmodifiableSet(builder.writable != null
                ? new LinkedHashSet<>(builder.writable)
                : defaultWritable());
    }

    /**
     * @param type       resource type name, also the collection path segment
     * @param modelClass backing storage model
     * @return a builder with every action disabled
     */
    public static Builder builder(String type, Class<?> modelClass) {
        return new Builder(type, modelClass);
    }

    public String getType() { return type; }
    public Class<?> getModelClass() { return modelClass; }
    public String getRecordName() { return recordName; }
    public Optional<String> getPrimaryKey() { return Optional.ofNullable(primaryKey); }
    public Set<ApiAction> getActions() { return actions; }
    public Set<String> getFields() { return fields; }
    public Set<String> getWritable() { return writable; }
    public List<AssociationDefinition> getAssociations() { return associations; }
    public List<RemoteDefinition> getRemotes() { return remotes; }

    public boolean handles(ApiAction action) {
        return actions.contains(action);
    }

    /**
     * Declares the whitelist of this resource.
     *
     * @param registry registry being populated at start-up
     */
    public void registerInto(WhitelistRegistry registry) {
        registry.register(type, fields, associations, remotes);
    }

    private Set<String> defaultWritable() {
        Set<String> names = new LinkedHashSet<>(fields);
        associations.stream()
                .filter(AssociationDefinition::isOwnerReference)
                .forEach(a -> names.add(a.name()));
        return names;
    }

    private static String decapitalize(String name) {
        if (name.isEmpty()) {
            return name;
        }
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }

    @Override
    public String toString() {
        return String.format("ResourceConfig{type=%s, model=%s, actions=%s}", type, modelClass.getSimpleName(), actions);
    }

    /**
     * Builder for {@link ResourceConfig}.
     */
    public static final class Builder {
        private final String type;
        private final Class<?> modelClass;
        private String recordName;
        private String primaryKey;
        private final Set<ApiAction> actions = EnumSet.noneOf(ApiAction.class);
        private final Set<String> fields = new LinkedHashSet<>();
        private Set<String> writable;
        private final List<AssociationDefinition> associations = new ArrayList<>();
        private final List<RemoteDefinition> remotes = new ArrayList<>();

        private Builder(String type, Class<?> modelClass) {
            this.type = Objects.requireNonNull(type, "type is required");
            this.modelClass = Objects.requireNonNull(modelClass, "modelClass is required");
            if (type.isBlank() || type.contains("/")) {
                throw new IllegalArgumentException("Invalid resource type: '" + type + "'");
            }
        }

        public Builder recordName(String recordName) {
            this.recordName = Objects.requireNonNull(recordName, "recordName");
            return this;
        }

        public Builder primaryKey(String primaryKey) {
            this.primaryKey = Objects.requireNonNull(primaryKey, "primaryKey");
            return this;
        }

        public Builder handles(ApiAction... enabled) {
            actions.addAll(List.of(enabled));
            return this;
        }

        /**
         * Enables actions by name. {@code "all"} enables every action; unknown names are ignored
         * with a warning.
         *
         * @param names action names
         * @return this builder
         */
        public Builder handles(String... names) {
            List<String> unhandled = new ArrayList<>();
            for (String name : names) {
                if ("all".equalsIgnoreCase(name)) {
                    handlesAll();
                    continue;
                }
                ApiAction.fromName(name).ifPresentOrElse(actions::add, () -> unhandled.add(name));
            }
            if (!unhandled.isEmpty()) {
                logger.warning(String.format("Resource '%s' isn't handling the following unknown actions: %s",
                        type, String.join(",", unhandled)));
            }
            return this;
        }

        public Builder handlesAll() {
            actions.addAll(EnumSet.allOf(ApiAction.class));
            return this;
        }

        public Builder fields(String... names) {
            fields.addAll(List.of(names));
            return this;
        }

        /**
         * Restricts the attributes accepted by {@code create} and {@code update}. Defaults to
         * the fields plus the associations held by the record.
         *
         * @param names writable names
         * @return this builder
         */
        public Builder writable(String... names) {
            writable = new LinkedHashSet<>(List.of(names));
            return this;
        }

        public Builder belongsTo(String name, String targetType) {
            associations.add(AssociationDefinition.belongsTo(name, targetType));
            return this;
        }

        public Builder hasOne(String name, String targetType, String ownershipKey) {
            associations.add(AssociationDefinition.hasOne(name, targetType, ownershipKey));
            return this;
        }

        public Builder hasMany(String name, String targetType, String ownershipKey) {
            associations.add(AssociationDefinition.hasMany(name, targetType, ownershipKey));
            return this;
        }

        public Builder remote(String name, String targetType, RemoteCollectionProvider provider) {
            remotes.add(new RemoteDefinition(name, targetType, provider));
            return this;
        }

        public ResourceConfig build() {
            return new ResourceConfig(this);
        }
    }
}
