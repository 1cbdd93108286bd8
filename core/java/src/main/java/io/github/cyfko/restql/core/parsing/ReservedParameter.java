package io.github.cyfko.restql.core.parsing;

import java.util.Arrays;
import java.util.Optional;

/**
 * Parameter names extracted before whitelist matching, at every nesting level.
 */
public enum ReservedParameter {
    ORDER("order"),
    LIMIT("limit"),
    OFFSET("offset"),
    PAGE("page"),
    PER_PAGE("per_page"),
    INCLUDE("include");

    private final String key;

    ReservedParameter(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<ReservedParameter> fromKey(String key) {
        return Arrays.stream(values()).filter(p -> p.key.equals(key)).findFirst();
    }
}
