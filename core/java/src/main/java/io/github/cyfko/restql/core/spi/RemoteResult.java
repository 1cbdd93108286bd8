package io.github.cyfko.restql.core.spi;

import io.github.cyfko.restql.core.model.BaseScope;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a {@link RemoteCollectionProvider}: a scope to refine, or materialized records.
 */
public final class RemoteResult {

    private final BaseScope scope;
    private final List<Map<String, Object>> records;

    private RemoteResult(BaseScope scope, List<Map<String, Object>> records) {
        this.scope = scope;
        this.records = records;
    }

    /**
     * @param scope collection the engine refines with the client parameters
     * @return the result
     */
    public static RemoteResult scope(BaseScope scope) {
        return new RemoteResult(Objects.requireNonNull(scope, "scope is required"), null);
    }

    /**
     * @param records rows returned as they are
     * @return the result
     */
    public static RemoteResult records(List<Map<String, Object>> records) {
        return new RemoteResult(null, List.copyOf(Objects.requireNonNull(records, "records are required")));
    }

    public boolean isScope() {
        return scope != null;
    }

    public BaseScope getScope() {
        return scope;
    }

    public List<Map<String, Object>> getRecords() {
        return records;
    }
}
