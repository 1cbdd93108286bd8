package io.github.cyfko.restql.jpa;

import io.github.cyfko.restql.core.spi.SchemaInspector;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.metamodel.Attribute;
import jakarta.persistence.metamodel.EntityType;
import jakarta.persistence.metamodel.Metamodel;
import jakarta.persistence.metamodel.SingularAttribute;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link SchemaInspector} backed by the JPA {@link Metamodel}.
 *
 * <p>
 * Resource type names are bound to entity classes at construction; every lookup afterwards
 * reads the metamodel of the persistence unit, so a whitelisted name without a mapped attribute
 * is reported as absent instead of failing inside a query.
 * </p>
 *
 * <pre>{@code
 * JpaSchemaInspector schema = new JpaSchemaInspector(emf, Map.of(
 *     "posts", Post.class,
 *     "comments", Comment.class));
 *
 * schema.hasAttribute("posts", "title"); // true
 * schema.identifierOf("posts");          // "id"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JpaSchemaInspector implements SchemaInspector {

    private final Metamodel metamodel;
    private final Map<String, Class<?>> entityTypes;

    /**
     * @param emf         persistence unit holding the entities
     * @param entityTypes entity class of every resource type
     * @throws IllegalArgumentException if a class is not a managed entity
     */
    public JpaSchemaInspector(EntityManagerFactory emf, Map<String, Class<?>> entityTypes) {
        Objects.requireNonNull(emf, "EntityManagerFactory is required");
        Objects.requireNonNull(entityTypes, "entityTypes are required");
        this.metamodel = emf.getMetamodel();
        this.entityTypes = Collections.unmodifiableMap(new LinkedHashMap<>(entityTypes));
        this.entityTypes.forEach((type, entityClass) -> metamodel.entity(entityClass));
    }

    @Override
    public boolean hasAttribute(String resourceType, String attribute) {
        return attributeOf(resourceType, attribute).isPresent();
    }

    @Override
    public String identifierOf(String resourceType) {
        return entityType(resourceType).getSingularAttributes().stream()
                .filter(SingularAttribute::isId)
                .map(Attribute::getName)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Entity of '" + resourceType + "' has no single identifier"));
    }

    /**
     * @param resourceType resource type name
     * @return the entity class bound to the type
     * @throws IllegalArgumentException if the type is unknown
     */
    public Class<?> entityClassOf(String resourceType) {
        Class<?> entityClass = entityTypes.get(resourceType);
        if (entityClass == null) {
            throw new IllegalArgumentException("No entity bound to resource type '" + resourceType + "'");
        }
        return entityClass;
    }

    /**
     * @param resourceType resource type name
     * @param attribute    attribute name
     * @return the mapped attribute, empty when the entity has none of that name
     */
    public Optional<Attribute<?, ?>> attributeOf(String resourceType, String attribute) {
        if (!entityTypes.containsKey(resourceType) || attribute == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(entityType(resourceType).getAttribute(attribute));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * @return {@code true} when the attribute references another entity
     */
    public boolean isAssociation(String resourceType, String attribute) {
        return attributeOf(resourceType, attribute).map(Attribute::isAssociation).orElse(false);
    }

    EntityType<?> entityType(String resourceType) {
        return metamodel.entity(entityClassOf(resourceType));
    }
}
