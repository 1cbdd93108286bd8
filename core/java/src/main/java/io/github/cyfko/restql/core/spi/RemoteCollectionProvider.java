package io.github.cyfko.restql.core.spi;

import io.github.cyfko.restql.core.model.RefinementRequest;

import java.util.Map;

/**
 * Server logic behind a remote (virtual) collection.
 *
 * <p>
 * The provider receives the parent row and the client parameters already classified and
 * whitelisted against the collection's target type. It either narrows a collection that the
 * engine will refine like an {@code index}, or returns the records itself:
 * </p>
 * <pre>{@code
 * // Authors who commented a post
 * RemoteCollectionProvider commenters = (post, request) ->
 *     RemoteResult.scope(BaseScope.all("authors").where("comments.post.id", post.get("id")));
 *
 * // Records computed elsewhere
 * RemoteCollectionProvider related = (post, request) ->
 *     RemoteResult.records(recommendationService.similarTo(post.get("id")));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface RemoteCollectionProvider {

    /**
     * @param parent  row of the parent record
     * @param request gated parameters, classified against the collection's target type
     * @return the scope to refine or the materialized records
     */
    RemoteResult resolve(Map<String, Object> parent, RefinementRequest request);
}
