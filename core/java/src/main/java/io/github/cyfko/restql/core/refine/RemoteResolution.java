package io.github.cyfko.restql.core.refine;

import io.github.cyfko.restql.core.model.QueryPlan;

import java.util.List;
import java.util.Map;

/**
 * Result of resolving a remote collection: a refined plan still to execute, or records computed
 * by the provider.
 *
 * @param plan    plan to execute, {@code null} when records are given
 * @param records materialized rows, {@code null} when a plan is given
 */
public record RemoteResolution(QueryPlan plan, List<Map<String, Object>> records) {

    public RemoteResolution {
        if ((plan == null) == (records == null)) {
            throw new IllegalArgumentException("Exactly one of plan or records must be set");
        }
    }

    public static RemoteResolution of(QueryPlan plan) {
        return new RemoteResolution(plan, null);
    }

    public static RemoteResolution of(List<Map<String, Object>> records) {
        return new RemoteResolution(null, records);
    }

    public boolean hasPlan() {
        return plan != null;
    }
}
