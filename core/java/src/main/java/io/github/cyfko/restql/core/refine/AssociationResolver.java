package io.github.cyfko.restql.core.refine;

import io.github.cyfko.restql.core.exception.ResourceNotFoundException;
import io.github.cyfko.restql.core.model.BaseScope;
import io.github.cyfko.restql.core.model.EagerLoad;
import io.github.cyfko.restql.core.model.Filter;
import io.github.cyfko.restql.core.model.OwnershipAnchor;
import io.github.cyfko.restql.core.model.Pagination;
import io.github.cyfko.restql.core.model.QueryPlan;
import io.github.cyfko.restql.core.model.RefinementRequest;
import io.github.cyfko.restql.core.parsing.ParameterClassifier;
import io.github.cyfko.restql.core.registry.AssociationDefinition;
import io.github.cyfko.restql.core.registry.RemoteDefinition;
import io.github.cyfko.restql.core.registry.WhitelistRegistry;
import io.github.cyfko.restql.core.spi.RemoteResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Builds child collection plans for associations and remote collections.
 *
 * <h2>Ownership Protection</h2>
 * <p>
 * A child plan of a declared association is always bound to its parent through the ownership
 * key. Client input can never replace that binding: a nested filter on the ownership key, or a
 * related-object condition reached through it, is discarded before refinement. Nothing tells the
 * client it happened, so the protection does not disclose its own existence.
 * </p>
 *
 * <pre>{@code
 * // GET /posts/1/comments?post=2&approved=true
 * QueryPlan plan = resolver.resolve("posts", 1L, "comments", request);
 * // anchor     → post = 1   (the "post=2" filter is dropped)
 * // predicates → [approved EQ true]
 * }</pre>
 *
 * <h2>Singular Associations</h2>
 * <p>
 * Singular associations short-circuit refinement: their plans carry no condition, ordering or
 * window, only further eager loads.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see QueryRefiner
 */
public class AssociationResolver {

    private static final Logger logger = Logger.getLogger(AssociationResolver.class.getName());

    private final WhitelistRegistry registry;
    private final ParameterClassifier classifier;
    private final QueryRefiner refiner;

    AssociationResolver(WhitelistRegistry registry, ParameterClassifier classifier, QueryRefiner refiner) {
        this.registry = registry;
        this.classifier = classifier;
        this.refiner = refiner;
    }

    /**
     * Builds the plan of the records associated with one parent.
     *
     * @param parentType      resource type of the parent
     * @param parentId        identity of the parent
     * @param associationName declared association of {@code parentType}
     * @param nested          request classified against the association's target type
     * @return plan anchored to {@code parentId}
     * @throws ResourceNotFoundException if the association is not declared
     * @throws IllegalArgumentException  if the parent itself holds the reference, which has no ownership key to anchor on
     */
    public QueryPlan resolve(String parentType, Object parentId, String associationName, RefinementRequest nested) {
        AssociationDefinition association = registry.association(parentType, associationName)
                .orElseThrow(() -> new ResourceNotFoundException(
                        String.format("No association '%s' on '%s'", associationName, parentType)));
        if (association.isOwnerReference()) {
            throw new IllegalArgumentException(String.format(
                    "Association '%s' of '%s' is held by the parent and cannot be anchored", associationName, parentType));
        }
        refiner.requireAttribute(association.targetType(), association.ownershipKey());

        OwnershipAnchor anchor = new OwnershipAnchor(parentType, parentId, association.ownershipKey());
        BaseScope scope = BaseScope.anchored(association.targetType(), anchor);
        if (association.isSingular()) {
            QueryPlan plan = refiner.refine(scope, withoutConditions(nested));
            return new QueryPlan(plan.resourceType(), anchor, List.of(), plan.eagerLoads(), plan.order(),
                    new Pagination(1, 0));
        }
        return refiner.refine(scope, withoutOwnershipConditions(association, nested));
    }

    /**
     * Builds the eager load of an association requested through a traversal node.
     *
     * @param ownerType   resource type owning the association
     * @param association declared association
     * @param nested      traversal node, classified against the association's target type
     * @return the eager load, whose plan is unanchored
     */
    public EagerLoad resolveNested(String ownerType, AssociationDefinition association, RefinementRequest nested) {
        if (association.isOwnerReference()) {
            refiner.requireAttribute(ownerType, association.name());
        } else {
            refiner.requireAttribute(association.targetType(), association.ownershipKey());
        }

        BaseScope scope = BaseScope.all(association.targetType());
        if (association.isSingular()) {
            QueryPlan plan = refiner.refine(scope, withoutConditions(nested));
            return new EagerLoad(association, new QueryPlan(plan.resourceType(), null, List.of(),
                    plan.eagerLoads(), List.of(), new Pagination(null, 0)));
        }
        return new EagerLoad(association, refiner.refine(scope, withoutOwnershipConditions(association, nested)));
    }

    /**
     * Resolves a remote collection of a parent record.
     * <p>
     * Parameters are classified against the collection's target type before the provider sees
     * them, so the provider only receives whitelisted names.
     * </p>
     *
     * @param parentType resource type of the parent
     * @param parent     row of the parent record
     * @param remoteName declared remote collection of {@code parentType}
     * @param rawParams  raw client parameters
     * @return a plan to execute or the records computed by the provider
     * @throws ResourceNotFoundException if the remote collection is not declared
     */
    public RemoteResolution resolveRemote(String parentType,
                                          Map<String, Object> parent,
                                          String remoteName,
                                          Map<String, List<String>> rawParams) {
        RemoteDefinition remote = registry.remote(parentType, remoteName)
                .orElseThrow(() -> new ResourceNotFoundException(
                        String.format("No remote collection '%s' on '%s'", remoteName, parentType)));

        RefinementRequest gated = classifier.classify(remote.targetType(), rawParams);
        RemoteResult result = remote.provider().resolve(parent, gated);
        if (result == null) {
            throw new IllegalStateException(String.format(
                    "Provider of remote collection '%s' on '%s' returned no result", remoteName, parentType));
        }
        if (!result.isScope()) {
            return RemoteResolution.of(result.getRecords());
        }

        BaseScope scope = result.getScope();
        if (!scope.resourceType().equals(remote.targetType())) {
            throw new IllegalStateException(String.format(
                    "Provider of remote collection '%s' returned a scope of '%s', expected '%s'",
                    remoteName, scope.resourceType(), remote.targetType()));
        }
        return RemoteResolution.of(refiner.refine(scope, gated));
    }

    private RefinementRequest withoutOwnershipConditions(AssociationDefinition association, RefinementRequest nested) {
        String ownershipKey = association.ownershipKey();

        List<Filter> retained = nested.filters().stream()
                .filter(filter -> {
                    boolean protectedField = filter.field().equals(ownershipKey);
                    if (protectedField) {
                        logger.fine(() -> String.format("Discarded filter on ownership key '%s' of '%s'",
                                ownershipKey, association.name()));
                    }
                    return !protectedField;
                })
                .collect(Collectors.toList());

        Map<String, RefinementRequest> nodes = new LinkedHashMap<>(nested.associations());
        RefinementRequest ownerNode = nodes.get(ownershipKey);
        if (ownerNode != null) {
            nodes.put(ownershipKey, withoutConditions(ownerNode));
        }
        return nested.withFilters(retained).withAssociations(nodes);
    }

    /**
     * Strips conditions that a singular node would promote to its owner, keeping eager loads.
     */
    private RefinementRequest withoutConditions(RefinementRequest node) {
        Map<String, RefinementRequest> nodes = new LinkedHashMap<>();
        for (Map.Entry<String, RefinementRequest> child : node.associations().entrySet()) {
            boolean singular = registry.association(node.resourceType(), child.getKey())
                    .map(AssociationDefinition::isSingular)
                    .orElse(false);
            nodes.put(child.getKey(), singular ? withoutConditions(child.getValue()) : child.getValue());
        }
        return node.associationsOnly().withAssociations(nodes);
    }
}
