package com.repo.hotspot.report;

import com.repo.hotspot.core.PathMetrics;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Report columns that rows can be sorted by.
 * Text columns sort ascending, numeric columns descending so the worst
 * paths come first.
 */
public enum SortField {
    PATH("path", false, Comparator.comparing(m -> m.path().toString())),
    PATH_TYPE("path_type", false, Comparator.comparing(m -> m.kind().label())),
    HALSTEAD_VOLUME("halstead_volume", true, Comparator.comparingDouble(PathMetrics::halsteadVolume)),
    CYCLOMATIC_COMPLEXITY("cyclomatic_complexity", true,
            Comparator.comparingInt(PathMetrics::cyclomaticComplexity)),
    LOC("loc", true, Comparator.comparingInt(PathMetrics::loc)),
    COMMENTS_PERCENTAGE("comments_percentage", true,
            Comparator.comparingDouble(PathMetrics::commentsPercentage)),
    MAINTAINABILITY_INDEX("maintainability_index", true,
            Comparator.comparingDouble(PathMetrics::maintainability)),
    CHANGES_COUNT("changes_count", true, Comparator.comparingInt(PathMetrics::changes)),
    HOTSPOT_INDEX("hotspot_index", true, Comparator.comparingDouble(PathMetrics::hotspotIndex));

    private final String fieldName;
    private final boolean descending;
    private final Comparator<PathMetrics> natural;

    SortField(String fieldName, boolean descending, Comparator<PathMetrics> natural) {
        this.fieldName = fieldName;
        this.descending = descending;
        this.natural = natural;
    }

    public String fieldName() {
        return fieldName;
    }

    public boolean isDescending() {
        return descending;
    }

    /**
     * Comparator in report order, ties broken by path.
     */
    public Comparator<PathMetrics> comparator() {
        Comparator<PathMetrics> primary = descending ? natural.reversed() : natural;
        return primary.thenComparing(m -> m.path().toString());
    }

    public String describe() {
        return fieldName + (descending ? " (descending)" : " (ascending)");
    }

    public static SortField fromName(String name) {
        if ("lines_of_code".equals(name)) {
            return LOC;
        }
        for (SortField field : values()) {
            if (field.fieldName.equals(name)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown sort field: " + name
                + ". Use one of " + Arrays.stream(values()).map(SortField::fieldName).toList());
    }
}
