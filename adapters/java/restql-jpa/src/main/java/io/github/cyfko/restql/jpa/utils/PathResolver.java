package io.github.cyfko.restql.jpa.utils;

import jakarta.persistence.criteria.From;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.JoinType;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Root;

import java.util.Objects;

/**
 * Resolves dotted attribute paths against one query root.
 * <p>
 * Every segment but the last is joined, and a join is created once per attribute and reused by
 * all the paths going through it, so a selection on {@code author.id} and a predicate on
 * {@code author.name} share the same join. Joins are {@link JoinType#LEFT LEFT} to keep rows
 * whose reference is empty in selections.
 * </p>
 *
 * <pre>{@code
 * PathResolver paths = new PathResolver(root);
 * Path<?> name = paths.resolve("author.name");
 * Path<?> id = paths.resolve("author.id");   // same join
 * paths.hasCollectionJoin();                // false
 * }</pre>
 *
 * <p>One instance per criteria query; not thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class PathResolver {

    private final Root<?> root;
    private boolean collectionJoin;

    public PathResolver(Root<?> root) {
        this.root = Objects.requireNonNull(root, "Root cannot be null");
    }

    /**
     * @param path dotted attribute path, e.g. {@code title} or {@code author.profile.bio}
     * @return the criteria path of the last segment
     * @throws IllegalArgumentException if the path is blank or a segment is not mapped
     */
    public Path<?> resolve(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Path cannot be null or blank");
        }
        String[] segments = path.split("\\.");
        From<?, ?> current = root;
        for (int i = 0; i < segments.length - 1; i++) {
            current = joinOnce(current, segments[i]);
        }
        return current.get(segments[segments.length - 1]);
    }

    /**
     * @return {@code true} once a path went through a collection, so rows may repeat
     */
    public boolean hasCollectionJoin() {
        return collectionJoin;
    }

    public Root<?> root() {
        return root;
    }

    private From<?, ?> joinOnce(From<?, ?> from, String attribute) {
        Join<?, ?> join = from.getJoins().stream()
                .filter(j -> j.getAttribute().getName().equals(attribute))
                .findFirst()
                .map(j -> (Join<?, ?>) j)
                .orElseGet(() -> from.join(attribute, JoinType.LEFT));
        if (join.getAttribute().isCollection()) {
            collectionJoin = true;
        }
        return join;
    }
}
