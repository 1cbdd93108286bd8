package io.github.cyfko.restql.core.refine;

import io.github.cyfko.restql.core.config.RefinementPolicy;
import io.github.cyfko.restql.core.exception.InvalidDirectiveException;
import io.github.cyfko.restql.core.exception.SchemaMismatchException;
import io.github.cyfko.restql.core.model.BaseScope;
import io.github.cyfko.restql.core.model.EagerLoad;
import io.github.cyfko.restql.core.model.Filter;
import io.github.cyfko.restql.core.model.FilterPredicate;
import io.github.cyfko.restql.core.model.PageRequest;
import io.github.cyfko.restql.core.model.Pagination;
import io.github.cyfko.restql.core.model.QueryPlan;
import io.github.cyfko.restql.core.model.RefinementRequest;
import io.github.cyfko.restql.core.model.SortBy;
import io.github.cyfko.restql.core.parsing.ParameterClassifier;
import io.github.cyfko.restql.core.parsing.ReservedParameter;
import io.github.cyfko.restql.core.registry.AssociationDefinition;
import io.github.cyfko.restql.core.registry.NameKind;
import io.github.cyfko.restql.core.registry.WhitelistRegistry;
import io.github.cyfko.restql.core.spi.SchemaInspector;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Core engine turning a {@link BaseScope} and a {@link RefinementRequest} into a {@link QueryPlan}.
 *
 * <h2>Refinement Steps</h2>
 * <ol>
 *   <li><strong>Conditions:</strong> scope constraints, then every filter as a conjunctive
 *       predicate ({@code IN} for multi-valued filters).</li>
 *   <li><strong>Traversal:</strong> each plural node becomes an {@link EagerLoad} resolved by the
 *       {@link AssociationResolver}; its conditions, ordering and window stay inside the nested
 *       collection. A singular node short-circuits: its conditions become related-object
 *       predicates of this plan ({@code author.name}) and the referenced record is eager loaded.</li>
 *   <li><strong>Ordering:</strong> the requested ordering, or the identifier ascending when none
 *       is given.</li>
 *   <li><strong>Window:</strong> applied last. {@code page}/{@code per_page} wins over
 *       {@code limit}/{@code offset}; every limit is clamped to
 *       {@link RefinementPolicy#getMaxLimit()} and a missing limit defaults to it.</li>
 * </ol>
 *
 * <p>
 * Every attribute a plan references is checked against the {@link SchemaInspector}; a whitelisted
 * name unknown to the storage raises {@link SchemaMismatchException} before anything executes.
 * </p>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * // GET /posts?author.name=Alice&order=-createdAt&per_page=5&page=2
 * QueryPlan plan = refiner.refine(BaseScope.all("posts"), request);
 * // predicates  → [author.name EQ Alice]
 * // eagerLoads  → [author]
 * // order       → [createdAt desc]
 * // pagination  → limit=5, offset=5
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Stateless once built; a single instance serves all requests.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see AssociationResolver
 */
public class QueryRefiner {

    private static final Logger logger = Logger.getLogger(QueryRefiner.class.getName());

    private final WhitelistRegistry registry;
    private final SchemaInspector schema;
    private final RefinementPolicy policy;
    private final ParameterClassifier classifier;
    private final AssociationResolver associationResolver;

    public QueryRefiner(WhitelistRegistry registry, SchemaInspector schema, RefinementPolicy policy) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.schema = Objects.requireNonNull(schema, "schema is required");
        this.policy = Objects.requireNonNull(policy, "policy is required");
        this.classifier = new ParameterClassifier(registry, policy);
        this.associationResolver = new AssociationResolver(registry, classifier, this);
    }

    /**
     * Refines a scope with the client request.
     *
     * @param scope   collection to start from
     * @param request whitelisted request classified against the scope's resource type
     * @return the executable plan
     * @throws SchemaMismatchException   if a referenced attribute is unknown to the storage
     * @throws InvalidDirectiveException if the requested page lies beyond the addressable range
     */
    public QueryPlan refine(BaseScope scope, RefinementRequest request) {
        Objects.requireNonNull(scope, "scope is required");
        Objects.requireNonNull(request, "request is required");
        String type = scope.resourceType();
        if (!type.equals(request.resourceType())) {
            throw new IllegalArgumentException(String.format(
                    "Request classified for '%s' cannot refine a scope of '%s'", request.resourceType(), type));
        }

        List<FilterPredicate> predicates = new ArrayList<>(scope.constraints());
        for (Filter filter : request.filters()) {
            predicateOf(type, filter).ifPresent(predicates::add);
        }

        List<EagerLoad> eagerLoads = new ArrayList<>();
        for (Map.Entry<String, RefinementRequest> node : request.associations().entrySet()) {
            Optional<AssociationDefinition> association = registry.association(type, node.getKey());
            if (association.isEmpty()) {
                continue;
            }
            AssociationDefinition definition = association.get();
            if (definition.isSingular()) {
                promote(type, definition, node.getValue(), definition.name() + ".", predicates);
            }
            eagerLoads.add(associationResolver.resolveNested(type, definition, node.getValue()));
        }

        List<SortBy> order = orderOf(type, request.order());
        Pagination window = windowOf(request);

        QueryPlan plan = new QueryPlan(type, scope.anchor(), predicates, eagerLoads, order, window);
        logger.fine(() -> String.format("Refined plan for '%s': %d predicate(s), eager loads %s, order %s, %s",
                type, plan.predicates().size(),
                plan.eagerLoads().stream().map(EagerLoad::name).toList(), plan.order(), plan.pagination()));
        return plan;
    }

    public ParameterClassifier classifier() {
        return classifier;
    }

    public AssociationResolver associations() {
        return associationResolver;
    }

    public RefinementPolicy policy() {
        return policy;
    }

    /**
     * @param type      resource type
     * @param attribute attribute name
     * @throws SchemaMismatchException if the storage model of {@code type} lacks the attribute
     */
    void requireAttribute(String type, String attribute) {
        if (!schema.hasAttribute(type, attribute)) {
            throw new SchemaMismatchException(type, attribute);
        }
    }

    private Optional<FilterPredicate> predicateOf(String type, Filter filter) {
        NameKind kind = registry.isAllowed(type, filter.field());
        if (kind == NameKind.FIELD) {
            requireAttribute(type, filter.field());
            return Optional.of(FilterPredicate.of(filter.field(), filter.values()));
        }
        if (kind == NameKind.ASSOCIATION) {
            AssociationDefinition association = registry.association(type, filter.field()).orElseThrow();
            if (association.isSingular()) {
                requireAttribute(type, filter.field());
                String path = filter.field() + "." + schema.identifierOf(association.targetType());
                return Optional.of(FilterPredicate.of(path, filter.values()));
            }
        }
        logger.fine(() -> String.format("Ignored filter '%s' on '%s'", filter.field(), type));
        return Optional.empty();
    }

    private void promote(String ownerType,
                         AssociationDefinition association,
                         RefinementRequest node,
                         String prefix,
                         List<FilterPredicate> out) {
        String target = association.targetType();
        if (hasRelatedConditions(target, node)) {
            requireAttribute(ownerType, association.name());
        }
        for (Filter filter : node.filters()) {
            if (filter.field().equals(association.ownershipKey())) {
                logger.fine(() -> String.format("Discarded condition on ownership key '%s%s'", prefix, filter.field()));
                continue;
            }
            predicateOf(target, filter)
                    .map(p -> new FilterPredicate(prefix + p.path(), p.operator(), p.values()))
                    .ifPresent(out::add);
        }
        for (Map.Entry<String, RefinementRequest> child : node.associations().entrySet()) {
            registry.association(target, child.getKey())
                    .filter(AssociationDefinition::isSingular)
                    .ifPresent(d -> promote(target, d, child.getValue(), prefix + d.name() + ".", out));
        }
    }

    private boolean hasRelatedConditions(String type, RefinementRequest node) {
        if (!node.filters().isEmpty()) {
            return true;
        }
        for (Map.Entry<String, RefinementRequest> child : node.associations().entrySet()) {
            Optional<AssociationDefinition> association = registry.association(type, child.getKey());
            if (association.isPresent() && association.get().isSingular()
                    && hasRelatedConditions(association.get().targetType(), child.getValue())) {
                return true;
            }
        }
        return false;
    }

    private List<SortBy> orderOf(String type, List<SortBy> requested) {
        if (requested.isEmpty()) {
            return List.of(SortBy.asc(schema.identifierOf(type)));
        }
        for (SortBy sortBy : requested) {
            requireAttribute(type, sortBy.field());
        }
        return requested;
    }

    private Pagination windowOf(RefinementRequest request) {
        PageRequest page = request.page();
        if (page != null) {
            if (request.pagination() != null) {
                logger.fine(() -> "page/per_page supersedes limit/offset for " + request.resourceType());
            }
            int perPage = clamp(page.perPage() != null ? page.perPage() : policy.getDefaultPerPage());
            try {
                return page.toPagination(perPage);
            } catch (ArithmeticException e) {
                throw new InvalidDirectiveException(ReservedParameter.PAGE.key(), String.valueOf(page.page()),
                        "page out of range", e);
            }
        }

        Pagination raw = request.pagination();
        if (raw != null) {
            return new Pagination(raw.hasLimit() ? clamp(raw.limit()) : policy.getMaxLimit(), raw.offset());
        }
        return new Pagination(policy.getMaxLimit(), 0);
    }

    private int clamp(int limit) {
        return Math.min(limit, policy.getMaxLimit());
    }
}
