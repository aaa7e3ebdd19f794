package com.repo.hotspot.core;

import java.util.Collection;
import java.util.List;

/**
 * Chooses which aggregated rows reach the report.
 */
public final class ResultSelector {

    private ResultSelector() {
    }

    /**
     * Drops deleted rows unless {@code includeDeleted} is set. Keeps input order.
     */
    public static List<PathMetrics> select(Collection<PathMetrics> metrics, boolean includeDeleted) {
        return metrics.stream()
                .filter(m -> includeDeleted || !m.isDeleted())
                .toList();
    }
}
