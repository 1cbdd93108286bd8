package io.github.cyfko.restql.spring.web;

import io.github.cyfko.restql.core.dispatch.ActionResponse;
import io.github.cyfko.restql.core.dispatch.ResourceActionDispatcher;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * HTTP handler of one resource type.
 * <p>
 * Instances are not Spring beans: the {@link ResourceRouteRegistrar} creates one per declared
 * resource and maps only the methods of its enabled actions. Each method hands the request over
 * to the {@link ResourceActionDispatcher} and turns its {@link ActionResponse} into a
 * {@link ResponseEntity}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ResourceEndpoint {

    private final String type;
    private final String collectionPath;
    private final ResourceActionDispatcher dispatcher;

    /**
     * @param type           resource type served
     * @param collectionPath route of the collection, used for {@code Location} headers
     * @param dispatcher     action dispatcher
     */
    public ResourceEndpoint(String type, String collectionPath, ResourceActionDispatcher dispatcher) {
        this.type = Objects.requireNonNull(type, "type is required");
        this.collectionPath = Objects.requireNonNull(collectionPath, "collectionPath is required");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher is required");
    }

    public String getType() {
        return type;
    }

    public ResponseEntity<Object> index(@RequestParam MultiValueMap<String, String> params) {
        return toResponseEntity(dispatcher.index(type, params), null);
    }

    public ResponseEntity<Object> create(@RequestBody(required = false) Map<String, Object> body,
                                         UriComponentsBuilder uriBuilder) {
        ActionResponse response = dispatcher.create(type, body);
        URI location = response.locationKey() == null
                ? null
                : uriBuilder.path(collectionPath).path("/{key}").buildAndExpand(response.locationKey()).toUri();
        return toResponseEntity(response, location);
    }

    public ResponseEntity<Object> show(@PathVariable("key") String key,
                                       @RequestParam MultiValueMap<String, String> params) {
        return toResponseEntity(dispatcher.show(type, key, params), null);
    }

    public ResponseEntity<Object> update(@PathVariable("key") String key,
                                         @RequestBody(required = false) Map<String, Object> body) {
        return toResponseEntity(dispatcher.update(type, key, body), null);
    }

    public ResponseEntity<Object> destroy(@PathVariable("key") String key) {
        return toResponseEntity(dispatcher.destroy(type, key), null);
    }

    public ResponseEntity<Object> associated(@PathVariable("key") String key,
                                             @PathVariable("association") String association,
                                             @RequestParam MultiValueMap<String, String> params) {
        return toResponseEntity(dispatcher.associated(type, key, association, params), null);
    }

    public ResponseEntity<Object> remoted(@PathVariable("key") String key,
                                          @PathVariable("remote") String remote,
                                          @RequestParam MultiValueMap<String, String> params) {
        return toResponseEntity(dispatcher.remoted(type, key, remote, params), null);
    }

    static ResponseEntity<Object> toResponseEntity(ActionResponse response, URI location) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(response.status());
        if (location != null) {
            builder.location(location);
        }
        return response.body() == null ? builder.build() : builder.body(response.body());
    }
}
