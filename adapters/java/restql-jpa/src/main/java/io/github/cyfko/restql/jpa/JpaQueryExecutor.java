package io.github.cyfko.restql.jpa;

import io.github.cyfko.restql.core.config.EnumMatchMode;
import io.github.cyfko.restql.core.model.EagerLoad;
import io.github.cyfko.restql.core.model.FilterPredicate;
import io.github.cyfko.restql.core.model.OwnershipAnchor;
import io.github.cyfko.restql.core.model.Pagination;
import io.github.cyfko.restql.core.model.QueryPlan;
import io.github.cyfko.restql.core.model.SortBy;
import io.github.cyfko.restql.core.registry.AssociationDefinition;
import io.github.cyfko.restql.core.registry.WhitelistRegistry;
import io.github.cyfko.restql.core.spi.QueryExecutor;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * {@link QueryExecutor} running query plans through the JPA Criteria API.
 *
 * <h2>Execution</h2>
 * <ol>
 *   <li>The root query selects, as a tuple, the identifier, the whitelisted fields and the
 *       identifier of every singular reference held by the record ({@code authorId}), applies the
 *       anchor, the predicates, the order completed by the identifier, then the window.</li>
 *   <li>Eager loads are fetched level by level: one query per association edge for a whole page
 *       of parents, with parent identities bound through {@code IN} lists of at most
 *       {@value #BATCH_SIZE} values. The child window is applied per parent in memory.</li>
 * </ol>
 *
 * <p>
 * The number of statements therefore depends on the eager-load edges of the plan, never on the
 * number of rows. Values are returned as scalars: no entity is materialized, so no lazy
 * association can be triggered while the rows are serialized.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Stateless between calls: each execution opens and closes its own {@link EntityManager}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JpaQueryExecutor implements QueryExecutor {

    private static final Logger logger = Logger.getLogger(JpaQueryExecutor.class.getName());

    static final int BATCH_SIZE = 1000;
    private static final String ID_SUFFIX = "Id";
    private static final String PARENT_KEY = "__parentKey";

    private final EntityManagerFactory emf;
    private final JpaSchemaInspector schema;
    private final WhitelistRegistry registry;
    private final EnumMatchMode enumMatchMode;

    /**
     * @param emf           persistence unit to query
     * @param schema        resource type to entity binding
     * @param registry      whitelist deciding which fields make a row
     * @param enumMatchMode matching of enum filter values
     */
    public JpaQueryExecutor(EntityManagerFactory emf,
                            JpaSchemaInspector schema,
                            WhitelistRegistry registry,
                            EnumMatchMode enumMatchMode) {
        this.emf = Objects.requireNonNull(emf, "EntityManagerFactory is required");
        this.schema = Objects.requireNonNull(schema, "schema is required");
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.enumMatchMode = Objects.requireNonNull(enumMatchMode, "enumMatchMode is required");
    }

    @Override
    public List<Map<String, Object>> execute(QueryPlan plan) {
        long startTime = System.nanoTime();
        EntityManager em = emf.createEntityManager();
        try {
            List<Map<String, Object>> rows = fetchRoot(em, plan);
            attachEagerLoads(em, plan.resourceType(), rows, plan.eagerLoads());

            long durationMs = (System.nanoTime() - startTime) / 1_000_000;
            logger.info(() -> String.format("Plan on '%s' completed in %dms: %d rows, %d eager loads",
                    plan.resourceType(), durationMs, rows.size(), plan.eagerLoads().size()));
            return rows;
        } finally {
            em.close();
        }
    }

    // ==================== Root Query ====================

    private List<Map<String, Object>> fetchRoot(EntityManager em, QueryPlan plan) {
        Pagination window = plan.pagination();
        if (window.hasLimit() && window.limit() == 0) {
            return new ArrayList<>();
        }

        String type = plan.resourceType();
        RowQuery query = recordQuery(em, type);
        if (plan.isAnchored()) {
            OwnershipAnchor anchor = plan.anchor();
            query.where(FilterPredicate.eq(
                    anchor.ownershipKey() + "." + schema.identifierOf(anchor.parentType()), anchor.parentId()));
        }
        plan.predicates().forEach(query::where);
        applyOrder(query, type, plan.order());
        return query.fetch(window);
    }

    private RowQuery recordQuery(EntityManager em, String type) {
        RowQuery query = new RowQuery(em, schema.entityClassOf(type), enumMatchMode);
        String idField = schema.identifierOf(type);
        query.select(idField, idField);

        registry.definitionOf(type).ifPresent(definition -> {
            for (String field : definition.fields()) {
                if (!field.equals(idField) && schema.hasAttribute(type, field) && !schema.isAssociation(type, field)) {
                    query.select(field, field);
                }
            }
            for (AssociationDefinition association : definition.associations().values()) {
                if (association.isSingular() && association.isOwnerReference()
                        && !definition.fields().contains(association.name())
                        && schema.hasAttribute(type, association.name())) {
                    query.select(association.name() + ID_SUFFIX,
                            association.name() + "." + schema.identifierOf(association.targetType()));
                }
            }
        });
        return query;
    }

    private void applyOrder(RowQuery query, String type, List<SortBy> order) {
        order.forEach(query::orderBy);
        String idField = schema.identifierOf(type);
        if (!query.isOrderedBy(idField)) {
            query.orderBy(SortBy.asc(idField));
        }
    }

    // ==================== Eager Loads ====================

    private void attachEagerLoads(EntityManager em, String parentType,
                                  List<Map<String, Object>> parents, List<EagerLoad> loads) {
        if (parents.isEmpty()) {
            return;
        }
        for (EagerLoad load : loads) {
            List<Map<String, Object>> children = load.association().isOwnerReference()
                    ? attachReferences(em, parents, load)
                    : attachOwned(em, parentType, parents, load);

            logger.fine(() -> String.format("Eager load '%s' of '%s': %d rows for %d parents",
                    load.name(), parentType, children.size(), parents.size()));

            attachEagerLoads(em, load.association().targetType(), children, load.plan().eagerLoads());
        }
    }

    /**
     * Singular association held by the parents: targets are fetched by the referenced identities.
     */
    private List<Map<String, Object>> attachReferences(EntityManager em,
                                                       List<Map<String, Object>> parents,
                                                       EagerLoad load) {
        String name = load.name();
        String targetType = load.association().targetType();
        String targetId = schema.identifierOf(targetType);

        Set<Object> keys = new LinkedHashSet<>();
        for (Map<String, Object> parent : parents) {
            Object key = parent.get(name + ID_SUFFIX);
            if (key != null) {
                keys.add(key);
            }
        }

        Map<Object, Map<String, Object>> targets = new HashMap<>();
        for (List<Object> batch : batches(new ArrayList<>(keys))) {
            RowQuery query = recordQuery(em, targetType);
            query.whereIn(targetId, batch);
            load.plan().predicates().forEach(query::where);
            for (Map<String, Object> row : query.fetch(null)) {
                targets.put(row.get(targetId), row);
            }
        }

        for (Map<String, Object> parent : parents) {
            parent.put(name, targets.get(parent.get(name + ID_SUFFIX)));
        }
        return new ArrayList<>(targets.values());
    }

    /**
     * Association owned through the target's ownership key: targets are fetched by parent identity
     * and grouped back per parent.
     */
    private List<Map<String, Object>> attachOwned(EntityManager em, String parentType,
                                                  List<Map<String, Object>> parents,
                                                  EagerLoad load) {
        AssociationDefinition association = load.association();
        QueryPlan childPlan = load.plan();
        String parentId = schema.identifierOf(parentType);
        String ownerPath = association.ownershipKey() + "." + parentId;

        Set<Object> keys = new LinkedHashSet<>();
        for (Map<String, Object> parent : parents) {
            keys.add(parent.get(parentId));
        }

        Map<Object, List<Map<String, Object>>> byParent = new HashMap<>();
        for (List<Object> batch : batches(new ArrayList<>(keys))) {
            RowQuery query = recordQuery(em, association.targetType());
            query.select(PARENT_KEY, ownerPath);
            query.whereIn(ownerPath, batch);
            childPlan.predicates().forEach(query::where);
            applyOrder(query, association.targetType(), childPlan.order());

            for (Map<String, Object> row : query.fetch(null)) {
                Object owner = row.remove(PARENT_KEY);
                byParent.computeIfAbsent(owner, k -> new ArrayList<>()).add(row);
            }
        }

        List<Map<String, Object>> kept = new ArrayList<>();
        for (Map<String, Object> parent : parents) {
            List<Map<String, Object>> children = byParent.getOrDefault(parent.get(parentId), List.of());
            if (association.isSingular()) {
                Map<String, Object> child = children.isEmpty() ? null : children.get(0);
                parent.put(association.name(), child);
                if (child != null) {
                    kept.add(child);
                }
            } else {
                List<Map<String, Object>> page = window(children, childPlan.pagination());
                parent.put(association.name(), page);
                kept.addAll(page);
            }
        }
        return kept;
    }

    private static List<Map<String, Object>> window(List<Map<String, Object>> rows, Pagination pagination) {
        int from = Math.min(pagination.offset(), rows.size());
        int to = pagination.hasLimit()
                ? (int) Math.min((long) from + pagination.limit(), rows.size())
                : rows.size();
        return new ArrayList<>(rows.subList(from, to));
    }

    private static List<List<Object>> batches(List<Object> values) {
        List<List<Object>> batches = new ArrayList<>();
        for (int start = 0; start < values.size(); start += BATCH_SIZE) {
            batches.add(values.subList(start, Math.min(start + BATCH_SIZE, values.size())));
        }
        return batches;
    }
}
