package io.github.cyfko.restql.core.dispatch;

import io.github.cyfko.restql.core.exception.ClassificationException;
import io.github.cyfko.restql.core.exception.FilterValueException;
import io.github.cyfko.restql.core.exception.RecordValidationException;
import io.github.cyfko.restql.core.exception.ResourceNotFoundException;
import io.github.cyfko.restql.core.exception.SchemaMismatchException;
import io.github.cyfko.restql.core.exception.StatementRejectedException;
import io.github.cyfko.restql.core.model.BaseScope;
import io.github.cyfko.restql.core.model.EagerLoad;
import io.github.cyfko.restql.core.model.FilterPredicate;
import io.github.cyfko.restql.core.model.Pagination;
import io.github.cyfko.restql.core.model.QueryPlan;
import io.github.cyfko.restql.core.model.RefinementRequest;
import io.github.cyfko.restql.core.model.SortBy;
import io.github.cyfko.restql.core.refine.QueryRefiner;
import io.github.cyfko.restql.core.refine.RemoteResolution;
import io.github.cyfko.restql.core.registry.AssociationDefinition;
import io.github.cyfko.restql.core.registry.WhitelistRegistry;
import io.github.cyfko.restql.core.spi.QueryExecutor;
import io.github.cyfko.restql.core.spi.RecordStore;
import io.github.cyfko.restql.core.spi.SchemaInspector;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry points of the seven resource actions.
 *
 * <p>
 * Each action takes the resource type, the raw parameters and, for writes, the decoded body, and
 * returns an {@link ActionResponse}. The dispatcher composes classification, refinement and
 * execution; it never throws: failures are converted to error responses at this boundary.
 * </p>
 *
 * <h2>Action Contract</h2>
 * <table border="1">
 *   <caption>Actions</caption>
 *   <tr><th>Action</th><th>Success</th><th>Payload</th></tr>
 *   <tr><td>index</td><td>200</td><td>{@code {<type>: [...]}}</td></tr>
 *   <tr><td>create</td><td>201</td><td>{@code {<recordName>: {...}}} and the new key</td></tr>
 *   <tr><td>show</td><td>200</td><td>{@code {<recordName>: {...}}}</td></tr>
 *   <tr><td>update / destroy</td><td>204</td><td>none</td></tr>
 *   <tr><td>associated</td><td>200</td><td>{@code {<association>: [...]}}, a single object or null for singular associations</td></tr>
 *   <tr><td>remoted</td><td>200</td><td>{@code {<remote>: [...]}}</td></tr>
 * </table>
 *
 * <h2>Error Mapping</h2>
 * <ul>
 *   <li>{@link ClassificationException}, {@link SchemaMismatchException}, {@link FilterValueException},
 *       {@link StatementRejectedException} → 400</li>
 *   <li>{@link ResourceNotFoundException} → 404</li>
 *   <li>{@link RecordValidationException} → 422 with field-level messages</li>
 *   <li>anything else → 500 with a generic message; details are only logged</li>
 * </ul>
 *
 * <p>
 * Actions a resource does not enable answer 404 here as well, although the routing layer never
 * registers them in the first place.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ResourceActionDispatcher {

    private static final Logger logger = Logger.getLogger(ResourceActionDispatcher.class.getName());

    public static final String INTERNAL_ERROR_MESSAGE = "Internal server error";
    private static final String ID_SUFFIX = "Id";

    private final Map<String, ResourceConfig> resources = new LinkedHashMap<>();
    private final WhitelistRegistry registry;
    private final QueryRefiner refiner;
    private final QueryExecutor executor;
    private final RecordStore store;
    private final SchemaInspector schema;

    /**
     * Builds the dispatcher and registers the whitelist of every resource.
     *
     * @param configs  resource declarations
     * @param registry registry shared with the refiner
     * @param refiner  query refiner
     * @param executor storage executor for reads
     * @param store    storage collaborator for writes
     * @param schema   storage schema
     * @throws IllegalArgumentException if a resource type is declared twice
     */
    public ResourceActionDispatcher(Collection<ResourceConfig> configs,
                                    WhitelistRegistry registry,
                                    QueryRefiner refiner,
                                    QueryExecutor executor,
                                    RecordStore store,
                                    SchemaInspector schema) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.refiner = Objects.requireNonNull(refiner, "refiner is required");
        this.executor = Objects.requireNonNull(executor, "executor is required");
        this.store = Objects.requireNonNull(store, "store is required");
        this.schema = Objects.requireNonNull(schema, "schema is required");

        for (ResourceConfig config : configs) {
            if (resources.putIfAbsent(config.getType(), config) != null) {
                throw new IllegalArgumentException("Resource type declared twice: " + config.getType());
            }
            config.registerInto(registry);
        }
        logger.info(() -> String.format("Dispatcher ready for resources %s", resources.keySet()));
    }

    public Collection<ResourceConfig> resources() {
        return Collections.unmodifiableCollection(resources.values());
    }

    /**
     * Lists the records of a resource type, refined by the parameters.
     */
    public ActionResponse index(String type, Map<String, List<String>> params) {
        return handle(ApiAction.INDEX, type, config -> {
            RefinementRequest request = refiner.classifier().classify(type, params);
            List<Map<String, Object>> rows = executor.execute(refiner.refine(BaseScope.all(type), request));
            return ActionResponse.ok(type, rows);
        });
    }

    /**
     * Creates a record from the writable attributes of the body.
     *
     * @param body decoded JSON object, wrapped in the record name or bare
     */
    public ActionResponse create(String type, Map<String, Object> body) {
        return handle(ApiAction.CREATE, type, config -> {
            String keyField = keyField(config);
            Object key = store.create(type, keyField, writableAttributes(config, body));
            List<Map<String, Object>> rows = executor.execute(singleRecordPlan(type, keyField, key, List.of()));
            if (rows.isEmpty()) {
                throw new IllegalStateException(String.format("Created %s %s cannot be read back", type, key));
            }
            return ActionResponse.created(config.getRecordName(), rows.get(0), String.valueOf(key));
        });
    }

    /**
     * Shows one record located by the configured primary key. Only association traversal
     * parameters ({@code include}, nested paths) are honoured: they shape the eager loads.
     */
    public ActionResponse show(String type, String key, Map<String, List<String>> params) {
        return handle(ApiAction.SHOW, type, config ->
                ActionResponse.ok(config.getRecordName(), find(config, key, params)));
    }

    public ActionResponse update(String type, String key, Map<String, Object> body) {
        return handle(ApiAction.UPDATE, type, config -> {
            store.update(type, keyField(config), key, writableAttributes(config, body));
            return ActionResponse.noContent();
        });
    }

    public ActionResponse destroy(String type, String key) {
        return handle(ApiAction.DESTROY, type, config -> {
            store.delete(type, keyField(config), key);
            return ActionResponse.noContent();
        });
    }

    /**
     * Lists the records of a declared association of one parent, refined by the parameters.
     */
    public ActionResponse associated(String type, String key, String associationName, Map<String, List<String>> params) {
        return handle(ApiAction.ASSOCIATED, type, config -> {
            AssociationDefinition association = registry.association(type, associationName)
                    .orElseThrow(() -> new ResourceNotFoundException(
                            String.format("No association '%s' on '%s'", associationName, type)));
            RefinementRequest nested = refiner.classifier().classify(association.targetType(), params);

            if (association.isSingular()) {
                EagerLoad load = refiner.associations().resolveNested(type, association, nested);
                List<Map<String, Object>> rows = executor.execute(
                        singleRecordPlan(type, keyField(config), key, List.of(load)));
                if (rows.isEmpty()) {
                    throw new ResourceNotFoundException(type, keyField(config), key);
                }
                return ActionResponse.ok(associationName, rows.get(0).get(associationName));
            }

            Map<String, Object> parent = find(config, key, Map.of());
            Object parentId = parent.get(schema.identifierOf(type));
            QueryPlan plan = refiner.associations().resolve(type, parentId, associationName, nested);
            return ActionResponse.ok(associationName, executor.execute(plan));
        });
    }

    /**
     * Lists a remote collection of one parent.
     */
    public ActionResponse remoted(String type, String key, String remoteName, Map<String, List<String>> params) {
        return handle(ApiAction.REMOTED, type, config -> {
            if (registry.remote(type, remoteName).isEmpty()) {
                throw new ResourceNotFoundException(String.format("No remote collection '%s' on '%s'", remoteName, type));
            }
            Map<String, Object> parent = find(config, key, Map.of());
            RemoteResolution resolution = refiner.associations().resolveRemote(type, parent, remoteName, params);
            List<Map<String, Object>> rows = resolution.hasPlan()
                    ? executor.execute(resolution.plan())
                    : resolution.records();
            return ActionResponse.ok(remoteName, rows);
        });
    }

    private ActionResponse handle(ApiAction action, String type, Function<ResourceConfig, ActionResponse> work) {
        long startTime = System.nanoTime();
        ActionResponse response;
        try {
            ResourceConfig config = resources.get(type);
            if (config == null || !config.handles(action)) {
                throw new ResourceNotFoundException(
                        String.format("No action '%s' for resource '%s'", action.actionName(), type));
            }
            response = work.apply(config);
        } catch (ClassificationException | SchemaMismatchException | FilterValueException
                 | StatementRejectedException e) {
            logger.fine(() -> String.format("Rejected %s on '%s': %s", action.actionName(), type, e.getMessage()));
            response = ActionResponse.error(ActionResponse.BAD_REQUEST, e.getMessage());
        } catch (ResourceNotFoundException e) {
            response = ActionResponse.error(ActionResponse.NOT_FOUND, e.getMessage());
        } catch (RecordValidationException e) {
            response = ActionResponse.error(ActionResponse.UNPROCESSABLE_ENTITY, e.getFieldErrors());
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, String.format("Unexpected failure in %s on '%s'", action.actionName(), type), e);
            response = ActionResponse.error(ActionResponse.INTERNAL_SERVER_ERROR, INTERNAL_ERROR_MESSAGE);
        }

        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        int status = response.status();
        logger.info(() -> String.format("Action %s on '%s' completed in %dms with status %d",
                action.actionName(), type, durationMs, status));
        return response;
    }

    private Map<String, Object> find(ResourceConfig config, String key, Map<String, List<String>> params) {
        String type = config.getType();
        RefinementRequest request = refiner.classifier().classify(type, params);
        List<EagerLoad> eagerLoads = new ArrayList<>();
        request.associations().forEach((name, node) -> registry.association(type, name)
                .ifPresent(association -> eagerLoads.add(refiner.associations().resolveNested(type, association, node))));

        List<Map<String, Object>> rows = executor.execute(singleRecordPlan(type, keyField(config), key, eagerLoads));
        if (rows.isEmpty()) {
            throw new ResourceNotFoundException(type, keyField(config), key);
        }
        return rows.get(0);
    }

    private QueryPlan singleRecordPlan(String type, String keyField, Object key, List<EagerLoad> eagerLoads) {
        return new QueryPlan(type, null, List.of(FilterPredicate.eq(keyField, key)), eagerLoads,
                List.of(SortBy.asc(schema.identifierOf(type))), new Pagination(1, 0));
    }

    private String keyField(ResourceConfig config) {
        return config.getPrimaryKey().orElseGet(() -> schema.identifierOf(config.getType()));
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> writableAttributes(ResourceConfig config, Map<String, Object> body) {
        if (body == null) {
            throw new ClassificationException(config.getRecordName(), "Request body must be a JSON object");
        }
        Object wrapped = body.get(config.getRecordName());
        Map<String, Object> source = wrapped instanceof Map<?, ?> ? (Map<String, Object>) wrapped : body;

        Map<String, Object> attributes = new LinkedHashMap<>();
        for (String name : config.getWritable()) {
            if (source.containsKey(name)) {
                attributes.put(name, source.get(name));
            } else if (isOwnerReference(config, name) && source.containsKey(name + ID_SUFFIX)) {
                attributes.put(name, source.get(name + ID_SUFFIX));
            }
        }
        if (logger.isLoggable(Level.FINE)) {
            source.keySet().stream()
                    .filter(k -> !attributes.containsKey(k) && !attributes.containsKey(stripIdSuffix(k)))
                    .forEach(k -> logger.fine(String.format("Ignored non-writable attribute '%s' of '%s'", k, config.getType())));
        }
        return attributes;
    }

    private boolean isOwnerReference(ResourceConfig config, String name) {
        return config.getAssociations().stream()
                .anyMatch(a -> a.name().equals(name) && a.isOwnerReference());
    }

    private static String stripIdSuffix(String name) {
        return name.endsWith(ID_SUFFIX) ? name.substring(0, name.length() - ID_SUFFIX.length()) : name;
    }
}
