package io.github.cyfko.restql.core.model;

/**
 * Page-oriented window as sent by clients through {@code page} and {@code per_page}.
 *
 * @param page    one-based page number ({@code >= 1})
 * @param perPage page size ({@code >= 1}), {@code null} to use the configured default
 */
public record PageRequest(int page, Integer perPage) {

    public PageRequest {
        if (page < 1) {
            throw new IllegalArgumentException("Page number must be at least 1. Provided: " + page);
        }
        if (perPage != null && perPage < 1) {
            throw new IllegalArgumentException("Page size must be positive. Provided: " + perPage);
        }
    }

    /**
     * Converts this page into a limit/offset window: {@code offset = (page - 1) * perPage}.
     *
     * @param effectivePerPage the page size to apply
     * @return the corresponding window
     * @throws ArithmeticException if the offset overflows an {@code int}
     */
    public Pagination toPagination(int effectivePerPage) {
        return new Pagination(effectivePerPage, Math.multiplyExact(page - 1, effectivePerPage));
    }
}
