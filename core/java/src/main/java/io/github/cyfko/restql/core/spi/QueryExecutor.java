package io.github.cyfko.restql.core.spi;

import io.github.cyfko.restql.core.model.QueryPlan;

import java.util.List;
import java.util.Map;

/**
 * <h2>QueryExecutor</h2>
 *
 * <p>
 * Storage collaborator running a {@link QueryPlan} and returning materialized rows.
 * </p>
 *
 * <h3>Row shape</h3>
 * <p>Each row is an insertion-ordered map holding:</p>
 * <ul>
 *   <li>the identifier of the record;</li>
 *   <li>every whitelisted field of the resource type;</li>
 *   <li>for every singular association held by the record, a minimal reference
 *       {@code <association>Id};</li>
 *   <li>for every eager load of the plan, the nested row (singular) or list of rows (plural)
 *       under the association name.</li>
 * </ul>
 *
 * <h3>Contract</h3>
 * <ul>
 *   <li>The number of statements issued for a plan depends on the number of eager-load edges,
 *       never on the number of rows.</li>
 *   <li>Pagination is applied after filtering and ordering; for eager loads it is applied per
 *       parent row.</li>
 *   <li>A filter value that cannot be converted to its attribute type raises
 *       {@link io.github.cyfko.restql.core.exception.FilterValueException}.</li>
 * </ul>
 *
 * <h3>Thread Safety:</h3>
 * <p>
 * Implementations are shared across requests and must not keep per-request state between calls.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface QueryExecutor {

    /**
     * Executes the plan.
     *
     * @param plan refined plan
     * @return the rows, in plan order
     */
    List<Map<String, Object>> execute(QueryPlan plan);
}
