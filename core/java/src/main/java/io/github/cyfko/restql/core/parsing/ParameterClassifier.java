package io.github.cyfko.restql.core.parsing;

import io.github.cyfko.restql.core.config.RefinementPolicy;
import io.github.cyfko.restql.core.exception.ClassificationException;
import io.github.cyfko.restql.core.exception.InvalidDirectiveException;
import io.github.cyfko.restql.core.model.Filter;
import io.github.cyfko.restql.core.model.PageRequest;
import io.github.cyfko.restql.core.model.Pagination;
import io.github.cyfko.restql.core.model.RefinementRequest;
import io.github.cyfko.restql.core.model.SortBy;
import io.github.cyfko.restql.core.registry.AssociationDefinition;
import io.github.cyfko.restql.core.registry.NameKind;
import io.github.cyfko.restql.core.registry.WhitelistRegistry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Turns raw query parameters into a whitelisted {@link RefinementRequest}.
 *
 * <h2>Classification Rules</h2>
 * <ol>
 *   <li>Reserved names ({@link ReservedParameter}) are extracted first and parsed into directives.
 *       A malformed directive raises {@link InvalidDirectiveException} naming the key, prefixed by
 *       its nesting path ({@code comments.limit}).</li>
 *   <li>A declared field becomes a filter: one value means equality, several values mean set
 *       membership. {@code field[]} is accepted as an alias of {@code field}.</li>
 *   <li>A declared singular association used as a bare key filters on the referenced identity
 *       ({@code author=3}).</li>
 *   <li>A dotted key whose head is a declared association ({@code comments.approved}) feeds a
 *       nested node, classified recursively against the association's target type.</li>
 *   <li>{@code include=a,b.c} creates empty nodes so that the associations are eager loaded.</li>
 *   <li>Everything else is dropped silently and only logged at FINE level. Remote collection
 *       names are never filters.</li>
 * </ol>
 *
 * <p>
 * Nodes nested deeper than {@link RefinementPolicy#getMaxDepth()} are dropped as well.
 * </p>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * Map<String, List<String>> params = Map.of(
 *     "author.name", List.of("Alice"),
 *     "order", List.of("-createdAt"),
 *     "per_page", List.of("5"),
 *     "unknown", List.of("x"));
 *
 * RefinementRequest request = classifier.classify("posts", params);
 * // request.order()        → [createdAt desc]
 * // request.page()         → PageRequest(1, 5)
 * // request.associations() → {author: filters=[name=Alice]}
 * // "unknown" is dropped
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ParameterClassifier {

    private static final Logger logger = Logger.getLogger(ParameterClassifier.class.getName());
    private static final String ARRAY_SUFFIX = "[]";

    private final WhitelistRegistry registry;
    private final RefinementPolicy policy;

    public ParameterClassifier(WhitelistRegistry registry, RefinementPolicy policy) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.policy = Objects.requireNonNull(policy, "policy is required");
    }

    /**
     * Classifies the parameters of one request.
     *
     * @param resourceType resource type the parameters apply to
     * @param rawParams    parameter name to values, as decoded from the query string
     * @return the whitelisted request
     * @throws ClassificationException if a directive is malformed
     */
    public RefinementRequest classify(String resourceType, Map<String, List<String>> rawParams) {
        Objects.requireNonNull(resourceType, "resourceType is required");
        return classify(resourceType, rawParams == null ? Map.of() : rawParams, 0, "");
    }

    private RefinementRequest classify(String type, Map<String, List<String>> params, int depth, String prefix) {
        Map<String, List<String>> filterValues = new LinkedHashMap<>();
        Map<String, Map<String, List<String>>> nodes = new LinkedHashMap<>();
        List<SortBy> order = List.of();
        Integer limit = null;
        Integer offset = null;
        Integer page = null;
        Integer perPage = null;

        for (Map.Entry<String, List<String>> entry : params.entrySet()) {
            String key = normalizeKey(entry.getKey());
            List<String> values = entry.getValue() == null ? List.of() : entry.getValue();
            if (values.isEmpty()) {
                continue;
            }

            Optional<ReservedParameter> reserved = ReservedParameter.fromKey(key);
            if (reserved.isEmpty()) {
                classifyName(type, key, values, filterValues, nodes, prefix);
                continue;
            }

            String qualifiedKey = prefix + key;
            switch (reserved.get()) {
                case ORDER -> order = parseOrder(type, qualifiedKey, single(qualifiedKey, values));
                case LIMIT -> limit = parseInteger(qualifiedKey, single(qualifiedKey, values), 0);
                case OFFSET -> offset = parseInteger(qualifiedKey, single(qualifiedKey, values), 0);
                case PAGE -> page = parseInteger(qualifiedKey, single(qualifiedKey, values), 1);
                case PER_PAGE -> perPage = parseInteger(qualifiedKey, single(qualifiedKey, values), 1);
                case INCLUDE -> collectIncludes(type, values, nodes, prefix);
            }
        }

        List<Filter> filters = new ArrayList<>();
        filterValues.forEach((field, values) -> filters.add(new Filter(field, values)));

        Map<String, RefinementRequest> associations = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, List<String>>> node : nodes.entrySet()) {
            String name = node.getKey();
            if (depth + 1 > policy.getMaxDepth()) {
                logger.fine(() -> String.format("Dropped association path '%s%s': deeper than %d",
                        prefix, name, policy.getMaxDepth()));
                continue;
            }
            AssociationDefinition association = registry.association(type, name).orElseThrow();
            associations.put(name, classify(association.targetType(), node.getValue(), depth + 1, prefix + name + "."));
        }

        Pagination pagination = (limit != null || offset != null)
                ? new Pagination(limit, offset == null ? 0 : offset)
                : null;
        PageRequest pageRequest = (page != null || perPage != null)
                ? new PageRequest(page == null ? 1 : page, perPage)
                : null;

        return new RefinementRequest(type, filters, order, pagination, pageRequest, associations);
    }

    private void classifyName(String type,
                              String key,
                              List<String> values,
                              Map<String, List<String>> filterValues,
                              Map<String, Map<String, List<String>>> nodes,
                              String prefix) {
        int dot = key.indexOf('.');
        if (dot < 0) {
            NameKind kind = registry.isAllowed(type, key);
            boolean singularAssociation = kind == NameKind.ASSOCIATION
                    && registry.association(type, key).map(AssociationDefinition::isSingular).orElse(false);
            if (kind == NameKind.FIELD || singularAssociation) {
                filterValues.computeIfAbsent(key, k -> new ArrayList<>()).addAll(values);
            } else {
                dropped(prefix + key, type);
            }
            return;
        }

        String head = key.substring(0, dot);
        String rest = key.substring(dot + 1);
        if (rest.isEmpty() || registry.isAllowed(type, head) != NameKind.ASSOCIATION) {
            dropped(prefix + key, type);
            return;
        }
        nodes.computeIfAbsent(head, k -> new LinkedHashMap<>())
                .computeIfAbsent(rest, k -> new ArrayList<>())
                .addAll(values);
    }

    private void collectIncludes(String type,
                                 List<String> values,
                                 Map<String, Map<String, List<String>>> nodes,
                                 String prefix) {
        Set<String> paths = new LinkedHashSet<>();
        for (String value : values) {
            for (String path : value.split(",")) {
                if (!path.isBlank()) {
                    paths.add(path.trim());
                }
            }
        }

        for (String path : paths) {
            int dot = path.indexOf('.');
            String head = dot < 0 ? path : path.substring(0, dot);
            if (registry.isAllowed(type, head) != NameKind.ASSOCIATION) {
                dropped(prefix + ReservedParameter.INCLUDE.key() + "=" + path, type);
                continue;
            }
            Map<String, List<String>> node = nodes.computeIfAbsent(head, k -> new LinkedHashMap<>());
            if (dot >= 0 && dot < path.length() - 1) {
                node.computeIfAbsent(ReservedParameter.INCLUDE.key(), k -> new ArrayList<>())
                        .add(path.substring(dot + 1));
            }
        }
    }

    private List<SortBy> parseOrder(String type, String key, String value) {
        List<SortBy> retained = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (SortBy sortBy : OrderDirectiveParser.parse(key, value)) {
            if (registry.isAllowed(type, sortBy.field()) != NameKind.FIELD) {
                dropped(key + "=" + sortBy.field(), type);
                continue;
            }
            if (seen.add(sortBy.field())) {
                retained.add(sortBy);
            }
        }
        return retained;
    }

    private static String single(String key, List<String> values) {
        if (values.size() != 1) {
            throw new InvalidDirectiveException(key, String.join(",", values), "directive given more than once");
        }
        return values.get(0);
    }

    private static int parseInteger(String key, String value, int min) {
        String expected = min == 0 ? "expected a non-negative integer" : "expected an integer >= " + min;
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidDirectiveException(key, value, expected, e);
        }
        if (parsed < min) {
            throw new InvalidDirectiveException(key, value, expected);
        }
        return parsed;
    }

    private static String normalizeKey(String key) {
        return key.endsWith(ARRAY_SUFFIX) ? key.substring(0, key.length() - ARRAY_SUFFIX.length()) : key;
    }

    private static void dropped(String key, String type) {
        logger.fine(() -> String.format("Dropped parameter '%s': not declared for resource '%s'", key, type));
    }
}
