package io.github.cyfko.restql.core.model;

/**
 * Row window expressed as limit and offset.
 *
 * <p>
 * Used twice along the pipeline: as the raw {@code limit}/{@code offset} pair carried by a
 * {@link RefinementRequest}, where {@code limit} may be {@code null} when the client only sent an
 * offset, and as the normalized window of a {@link QueryPlan}, where the limit is always set.
 * </p>
 *
 * <pre>{@code
 * new Pagination(10, 20);   // rows 21 to 30
 * new Pagination(null, 5);  // skip 5, no explicit limit
 * }</pre>
 *
 * @param limit  maximum number of rows ({@code >= 0}), {@code null} when unspecified
 * @param offset number of rows to skip ({@code >= 0})
 *
 * @throws IllegalArgumentException if {@code limit < 0} or {@code offset < 0}
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see PageRequest
 */
public record Pagination(Integer limit, int offset) {

    public Pagination {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("Limit cannot be negative. Provided: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative. Provided: " + offset);
        }
    }

    /**
     * @return {@code true} if an explicit limit is set
     */
    public boolean hasLimit() {
        return limit != null;
    }

    @Override
    public String toString() {
        return String.format("Pagination{limit=%s, offset=%d}", limit, offset);
    }
}
