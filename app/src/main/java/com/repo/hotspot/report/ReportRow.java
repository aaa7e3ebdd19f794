package com.repo.hotspot.report;

import com.repo.hotspot.core.PathKind;
import com.repo.hotspot.core.PathMetrics;

/**
 * One rendered report line.
 */
public record ReportRow(
        String path,
        PathKind kind,
        double halsteadVolume,
        int cyclomaticComplexity,
        int loc,
        double commentsPercentage,
        double maintainability,
        int changes,
        double hotspotIndex) {

    public static final String[] FIELD_NAMES = {
            "path", "path_type", "halstead_volume", "cyclomatic_complexity", "loc", "comments_percentage",
            "maintainability_index", "changes_count", "hotspot_index"
    };

    public static ReportRow from(PathMetrics metrics) {
        return new ReportRow(
                metrics.path().toString(),
                metrics.kind(),
                metrics.halsteadVolume(),
                metrics.cyclomaticComplexity(),
                metrics.loc(),
                metrics.commentsPercentage(),
                metrics.maintainability(),
                metrics.changes(),
                metrics.hotspotIndex());
    }

    /**
     * Cell values in {@link #FIELD_NAMES} order.
     */
    public String[] cells() {
        return new String[] {
                path,
                kind.label(),
                formatNumber(halsteadVolume),
                Integer.toString(cyclomaticComplexity),
                Integer.toString(loc),
                formatNumber(commentsPercentage),
                formatNumber(maintainability),
                Integer.toString(changes),
                formatNumber(hotspotIndex)
        };
    }

    /**
     * Shortest round-trippable decimal text; non-finite values as inf, -inf and nan.
     */
    public static String formatNumber(double value) {
        if (Double.isNaN(value))
            return "nan";
        if (value == Double.POSITIVE_INFINITY)
            return "inf";
        if (value == Double.NEGATIVE_INFINITY)
            return "-inf";
        return Double.toString(value);
    }

    public static double parseNumber(String text) {
        return switch (text.trim().toLowerCase()) {
            case "nan" -> Double.NaN;
            case "inf", "+inf", "infinity" -> Double.POSITIVE_INFINITY;
            case "-inf", "-infinity" -> Double.NEGATIVE_INFINITY;
            default -> Double.parseDouble(text.trim());
        };
    }
}
