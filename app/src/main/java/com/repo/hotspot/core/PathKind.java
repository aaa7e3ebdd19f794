package com.repo.hotspot.core;

/**
 * Kind of a path in the aggregated tree.
 * A MODULE is a single measured source file, a PACKAGE is any directory
 * (including the root) that aggregates modules beneath it.
 */
public enum PathKind {
    MODULE("module"),
    PACKAGE("package");

    private final String label;

    PathKind(String label) {
        this.label = label;
    }

    /**
     * Lowercase name used in reports.
     */
    public String label() {
        return label;
    }

    public static PathKind fromLabel(String label) {
        for (PathKind kind : values()) {
            if (kind.label.equalsIgnoreCase(label.trim())) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown path type: " + label);
    }
}
