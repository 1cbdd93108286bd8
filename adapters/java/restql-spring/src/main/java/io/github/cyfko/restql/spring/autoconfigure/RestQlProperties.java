package io.github.cyfko.restql.spring.autoconfigure;

import io.github.cyfko.restql.core.config.EnumMatchMode;
import io.github.cyfko.restql.core.config.RefinementPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the RestQL starter, bound from the {@code restql} prefix.
 *
 * <pre>
 * restql:
 *   base-path: /api
 *   max-limit: 500
 *   default-per-page: 20
 *   max-depth: 3
 * </pre>
 */
@ConfigurationProperties(prefix = "restql")
public class RestQlProperties {

    /** Prefix of every resource route, empty by default. */
    private String basePath = "";
    private int maxLimit = RefinementPolicy.DEFAULT_MAX_LIMIT;
    private int defaultPerPage = RefinementPolicy.DEFAULT_PER_PAGE;
    private int maxDepth = RefinementPolicy.DEFAULT_MAX_DEPTH;
    private EnumMatchMode enumMatchMode = EnumMatchMode.CASE_INSENSITIVE;

    /**
     * @return the refinement policy described by these settings
     * @throws IllegalArgumentException if the settings are inconsistent
     */
    public RefinementPolicy toPolicy() {
        return RefinementPolicy.builder()
                .maxLimit(maxLimit)
                .defaultPerPage(defaultPerPage)
                .maxDepth(maxDepth)
                .enumMatchMode(enumMatchMode)
                .build();
    }

    public String getBasePath() { return basePath; }
    public void setBasePath(String basePath) { this.basePath = basePath; }

    public int getMaxLimit() { return maxLimit; }
    public void setMaxLimit(int maxLimit) { this.maxLimit = maxLimit; }

    public int getDefaultPerPage() { return defaultPerPage; }
    public void setDefaultPerPage(int defaultPerPage) { this.defaultPerPage = defaultPerPage; }

    public int getMaxDepth() { return maxDepth; }
    public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }

    public EnumMatchMode getEnumMatchMode() { return enumMatchMode; }
    public void setEnumMatchMode(EnumMatchMode enumMatchMode) { this.enumMatchMode = enumMatchMode; }
}
