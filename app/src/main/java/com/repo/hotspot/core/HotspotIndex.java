package com.repo.hotspot.core;

/**
 * Hotspot index: how urgently a path needs refactoring.
 * Frequent change combined with poor maintainability ranks highest.
 */
public final class HotspotIndex {

    private HotspotIndex() {
    }

    public static double of(PathMetrics metrics) {
        return compute(metrics.changes(), metrics.maintainability());
    }

    /**
     * {@code changes / (maintainability / 100)} in plain double arithmetic.
     * Zero or negative maintainability is not special-cased.
     */
    public static double compute(int changes, double maintainability) {
        return changes / (maintainability / 100);
    }
}
