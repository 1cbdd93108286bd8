package io.github.cyfko.restql.core.config;

import java.util.Objects;

/**
 * Bounds applied while turning client parameters into query plans.
 * <p>
 * Every limit a client asks for is clamped to {@link #getMaxLimit()}, a {@code page} given
 * without {@code per_page} uses {@link #getDefaultPerPage()}, and association paths nested deeper
 * than {@link #getMaxDepth()} are dropped. A builder keeps construction fluent; defaults suit a
 * typical public API.
 * </p>
 *
 * <pre>{@code
 * RefinementPolicy policy = RefinementPolicy.builder()
 *     .maxLimit(200)
 *     .defaultPerPage(20)
 *     .build();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class RefinementPolicy {

    public static final int DEFAULT_MAX_LIMIT = 1000;
    public static final int DEFAULT_PER_PAGE = 25;
    public static final int DEFAULT_MAX_DEPTH = 4;

    private final int maxLimit;
    private final int defaultPerPage;
    private final int maxDepth;
    private final EnumMatchMode enumMatchMode;

    private RefinementPolicy(Builder builder) {
        this.maxLimit = builder.maxLimit;
        this.defaultPerPage = builder.defaultPerPage;
        this.maxDepth = builder.maxDepth;
        this.enumMatchMode = builder.enumMatchMode;
    }

    public static Builder builder() { return new Builder(); }

    /**
     * @return a policy holding only default values
     */
    public static RefinementPolicy defaults() { return new Builder().build(); }

    public int getMaxLimit() { return maxLimit; }
    public int getDefaultPerPage() { return defaultPerPage; }
    public int getMaxDepth() { return maxDepth; }
    public EnumMatchMode getEnumMatchMode() { return enumMatchMode; }

    @Override
    public String toString() {
        return String.format("RefinementPolicy{maxLimit=%d, defaultPerPage=%d, maxDepth=%d, enumMatchMode=%s}",
                maxLimit, defaultPerPage, maxDepth, enumMatchMode);
    }

    /**
     * Builder for {@link RefinementPolicy}.
     */
    public static final class Builder {
        private int maxLimit = DEFAULT_MAX_LIMIT;
        private int defaultPerPage = DEFAULT_PER_PAGE;
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private EnumMatchMode enumMatchMode = EnumMatchMode.CASE_INSENSITIVE;

        public Builder maxLimit(int maxLimit) {
            if (maxLimit <= 0) {
                throw new IllegalArgumentException("maxLimit must be positive. Provided: " + maxLimit);
            }
            this.maxLimit = maxLimit;
            return this;
        }

        public Builder defaultPerPage(int defaultPerPage) {
            if (defaultPerPage <= 0) {
                throw new IllegalArgumentException("defaultPerPage must be positive. Provided: " + defaultPerPage);
            }
            this.defaultPerPage = defaultPerPage;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            if (maxDepth < 0) {
                throw new IllegalArgumentException("maxDepth cannot be negative. Provided: " + maxDepth);
            }
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder enumMatchMode(EnumMatchMode mode) {
            this.enumMatchMode = Objects.requireNonNull(mode, "enumMatchMode");
            return this;
        }

        public RefinementPolicy build() {
            if (defaultPerPage > maxLimit) {
                throw new IllegalArgumentException(
                        String.format("defaultPerPage (%d) cannot exceed maxLimit (%d)", defaultPerPage, maxLimit));
            }
            return new RefinementPolicy(this);
        }
    }
}
