package io.github.cyfko.restql.spring.web;

import io.github.cyfko.restql.core.dispatch.ApiAction;
import io.github.cyfko.restql.core.dispatch.ResourceActionDispatcher;
import io.github.cyfko.restql.core.dispatch.ResourceConfig;
import io.github.cyfko.restql.core.registry.AssociationDefinition;
import io.github.cyfko.restql.core.registry.RemoteDefinition;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.util.ClassUtils;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.servlet.mvc.method.RequestMappingInfo;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;
import org.springframework.web.util.UriComponentsBuilder;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Registers the HTTP routes of every declared resource at start-up.
 *
 * <h2>Routes</h2>
 * <table>
 *   <tr><th>Action</th><th>Route</th></tr>
 *   <tr><td>index</td><td>{@code GET /{type}}</td></tr>
 *   <tr><td>create</td><td>{@code POST /{type}}</td></tr>
 *   <tr><td>show</td><td>{@code GET /{type}/{key}}</td></tr>
 *   <tr><td>update</td><td>{@code PUT|PATCH /{type}/{key}}</td></tr>
 *   <tr><td>destroy</td><td>{@code DELETE /{type}/{key}}</td></tr>
 *   <tr><td>associated</td><td>{@code GET /{type}/{key}/{association}}</td></tr>
 *   <tr><td>remoted</td><td>{@code GET /{type}/{key}/{remote}}</td></tr>
 * </table>
 * <p>
 * Only enabled actions are mapped, so a disabled action has no route at all and the servlet
 * answers it like any unknown URL. Association and remote routes only match the names declared
 * for the type. Every route is prefixed with the configured base path.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ResourceRouteRegistrar implements InitializingBean {

    private static final Logger logger = Logger.getLogger(ResourceRouteRegistrar.class.getName());

    private static final Method INDEX = endpointMethod("index", MultiValueMap.class);
    private static final Method CREATE = endpointMethod("create", Map.class, UriComponentsBuilder.class);
    private static final Method SHOW = endpointMethod("show", String.class, MultiValueMap.class);
    private static final Method UPDATE = endpointMethod("update", String.class, Map.class);
    private static final Method DESTROY = endpointMethod("destroy", String.class);
    private static final Method ASSOCIATED = endpointMethod("associated", String.class, String.class, MultiValueMap.class);
    private static final Method REMOTED = endpointMethod("remoted", String.class, String.class, MultiValueMap.class);

    private final ResourceActionDispatcher dispatcher;
    private final RequestMappingHandlerMapping handlerMapping;
    private final String basePath;

    /**
     * @param dispatcher     dispatcher holding the resource declarations
     * @param handlerMapping Spring MVC mapping receiving the routes
     * @param basePath       route prefix, blank for none
     */
    public ResourceRouteRegistrar(ResourceActionDispatcher dispatcher,
                                  RequestMappingHandlerMapping handlerMapping,
                                  String basePath) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher is required");
        this.handlerMapping = Objects.requireNonNull(handlerMapping, "handlerMapping is required");
        this.basePath = normalize(basePath);
    }

    @Override
    public void afterPropertiesSet() {
        for (ResourceConfig config : dispatcher.resources()) {
            register(config);
        }
    }

    private void register(ResourceConfig config) {
        String collection = basePath + "/" + config.getType();
        String member = collection + "/{key}";
        ResourceEndpoint endpoint = new ResourceEndpoint(config.getType(), collection, dispatcher);
        List<String> routes = new ArrayList<>();

        if (config.handles(ApiAction.INDEX)) {
            map(routes, endpoint, INDEX, collection, RequestMethod.GET);
        }
        if (config.handles(ApiAction.CREATE)) {
            map(routes, endpoint, CREATE, collection, RequestMethod.POST);
        }
        if (config.handles(ApiAction.SHOW)) {
            map(routes, endpoint, SHOW, member, RequestMethod.GET);
        }
        if (config.handles(ApiAction.UPDATE)) {
            map(routes, endpoint, UPDATE, member, RequestMethod.PUT, RequestMethod.PATCH);
        }
        if (config.handles(ApiAction.DESTROY)) {
            map(routes, endpoint, DESTROY, member, RequestMethod.DELETE);
        }
        if (config.handles(ApiAction.ASSOCIATED) && !config.getAssociations().isEmpty()) {
            String names = config.getAssociations().stream()
                    .map(AssociationDefinition::name)
                    .collect(Collectors.joining("|"));
            map(routes, endpoint, ASSOCIATED, member + "/{association:" + names + "}", RequestMethod.GET);
        }
        if (config.handles(ApiAction.REMOTED) && !config.getRemotes().isEmpty()) {
            String names = config.getRemotes().stream()
                    .map(RemoteDefinition::name)
                    .collect(Collectors.joining("|"));
            map(routes, endpoint, REMOTED, member + "/{remote:" + names + "}", RequestMethod.GET);
        }

        logger.info(() -> String.format("Resource '%s' routed: %s", config.getType(), routes));
    }

    private void map(List<String> routes, ResourceEndpoint endpoint, Method method, String path, RequestMethod... verbs) {
        RequestMappingInfo info = RequestMappingInfo.paths(path)
                .methods(verbs)
                .options(handlerMapping.getBuilderConfiguration())
                .build();
        handlerMapping.registerMapping(info, endpoint, method);
        for (RequestMethod verb : verbs) {
            routes.add(verb + " " + path);
        }
    }

    private static String normalize(String basePath) {
        if (basePath == null || basePath.isBlank()) {
            return "";
        }
        String trimmed = basePath.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.isEmpty() || trimmed.startsWith("/") ? trimmed : "/" + trimmed;
    }

    private static Method endpointMethod(String name, Class<?>... parameterTypes) {
        return ClassUtils.getMethod(ResourceEndpoint.class, name, parameterTypes);
    }
}
