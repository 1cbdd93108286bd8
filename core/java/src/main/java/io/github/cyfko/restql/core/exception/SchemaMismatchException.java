package io.github.cyfko.restql.core.exception;

/**
 * Exception thrown when a whitelisted name does not exist in the underlying storage schema.
 * <p>
 * A whitelist entry can outlive the attribute it describes (renamed column, typo in the
 * declaration). Such a reference is reported to the caller as a client error rather than a
 * server fault, and no query is executed.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class SchemaMismatchException extends RuntimeException {

    private final String resourceType;
    private final String attribute;

    /**
     * @param resourceType the resource type whose schema was consulted
     * @param attribute    the missing attribute
     */
    public SchemaMismatchException(String resourceType, String attribute) {
        super(String.format("Unknown attribute '%s' for resource '%s'", attribute, resourceType));
        this.resourceType = resourceType;
        this.attribute = attribute;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getAttribute() {
        return attribute;
    }
}
