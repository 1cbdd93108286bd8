package io.github.cyfko.restql.core.spi;

/**
 * Read access to the storage schema, used to reject whitelisted names that the storage does not know.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface SchemaInspector {

    /**
     * @param resourceType resource type name
     * @param attribute    attribute name (single segment)
     * @return {@code true} if the storage model of the type has this attribute
     */
    boolean hasAttribute(String resourceType, String attribute);

    /**
     * @param resourceType resource type name
     * @return name of the identifier attribute of the type
     * @throws IllegalArgumentException if the type is unknown to the storage
     */
    String identifierOf(String resourceType);
}
