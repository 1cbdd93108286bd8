package io.github.cyfko.restql.core.registry;

/**
 * Answer of {@link WhitelistRegistry#isAllowed(String, String)}.
 */
public enum NameKind {
    FIELD,
    ASSOCIATION,
    REMOTE,
    /** Not declared: the name must not reach query construction. */
    NONE
}
