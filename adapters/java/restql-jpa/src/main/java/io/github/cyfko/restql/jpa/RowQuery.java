package io.github.cyfko.restql.jpa;

import io.github.cyfko.restql.core.config.EnumMatchMode;
import io.github.cyfko.restql.core.exception.FilterValueException;
import io.github.cyfko.restql.core.model.FilterPredicate;
import io.github.cyfko.restql.core.model.Pagination;
import io.github.cyfko.restql.core.model.SortBy;
import io.github.cyfko.restql.core.utils.TypeConversionUtils;
import io.github.cyfko.restql.jpa.utils.PathResolver;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Tuple;
import jakarta.persistence.TypedQuery;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Order;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Selection;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One tuple query producing rows as ordered maps, column name to value.
 * <p>
 * Raw operands are converted to the Java type of the attribute they are compared with; a value
 * that does not convert raises {@link FilterValueException}.
 * </p>
 */
final class RowQuery {

    private final EntityManager em;
    private final CriteriaBuilder cb;
    private final CriteriaQuery<Tuple> query;
    private final PathResolver paths;
    private final EnumMatchMode enumMatchMode;

    private final List<String> columns = new ArrayList<>();
    private final List<Selection<?>> selections = new ArrayList<>();
    private final List<Predicate> restrictions = new ArrayList<>();
    private final List<Order> orders = new ArrayList<>();
    private final Set<String> orderedFields = new HashSet<>();

    RowQuery(EntityManager em, Class<?> entityClass, EnumMatchMode enumMatchMode) {
        this.em = em;
        this.cb = em.getCriteriaBuilder();
        this.query = cb.createTupleQuery();
        this.paths = new PathResolver(query.from(entityClass));
        this.enumMatchMode = enumMatchMode;
    }

    void select(String column, String path) {
        columns.add(column);
        selections.add(paths.resolve(path));
    }

    void where(FilterPredicate predicate) {
        Path<?> path = paths.resolve(predicate.path());
        List<Object> values = convert(predicate.path(), path, predicate.values());
        if (predicate.operator() == FilterPredicate.Operator.EQ) {
            restrictions.add(cb.equal(path, values.get(0)));
        } else {
            restrictions.add(path.in(values));
        }
    }

    void whereIn(String attributePath, Collection<?> values) {
        Path<?> path = paths.resolve(attributePath);
        restrictions.add(path.in(convert(attributePath, path, new ArrayList<>(values))));
    }

    boolean isOrderedBy(String field) {
        return orderedFields.contains(field);
    }

    void orderBy(SortBy sort) {
        Path<?> path = paths.resolve(sort.field());
        orderedFields.add(sort.field());
        orders.add(sort.isDescending() ? cb.desc(path) : cb.asc(path));
    }

    /**
     * @param window row window, {@code null} for every row
     * @return the rows in query order
     */
    List<Map<String, Object>> fetch(Pagination window) {
        query.multiselect(selections);
        if (!restrictions.isEmpty()) {
            query.where(restrictions.toArray(new Predicate[0]));
        }
        if (paths.hasCollectionJoin()) {
            query.distinct(true);
        }
        if (!orders.isEmpty()) {
            query.orderBy(orders);
        }

        TypedQuery<Tuple> typed = em.createQuery(query);
        if (window != null) {
            typed.setFirstResult(window.offset());
            if (window.hasLimit()) {
                typed.setMaxResults(window.limit());
            }
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        for (Tuple tuple : typed.getResultList()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                row.put(columns.get(i), tuple.get(i));
            }
            rows.add(row);
        }
        return rows;
    }

    private List<Object> convert(String attributePath, Path<?> path, List<?> values) {
        try {
            return TypeConversionUtils.convertAll(path.getJavaType(), values, enumMatchMode);
        } catch (IllegalArgumentException e) {
            throw new FilterValueException(
                    String.format("Invalid value for '%s': %s", attributePath, e.getMessage()), e);
        }
    }
}
