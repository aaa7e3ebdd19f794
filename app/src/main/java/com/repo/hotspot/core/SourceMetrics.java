package com.repo.hotspot.core;

/**
 * What a scorer learns about one source file: the maintainability score
 * plus the structural measures it is derived from.
 */
public record SourceMetrics(
        double maintainability,
        double halsteadVolume,
        int cyclomaticComplexity,
        int loc,
        /** Comment lines per source line, 0 to 100 */
        double commentsPercentage) {

    /**
     * For scorers that only report a score.
     */
    public static SourceMetrics scoreOnly(double maintainability) {
        return new SourceMetrics(maintainability, 0.0, 0, 0, 0.0);
    }

    public SourceMetrics withMaintainability(double score) {
        return new SourceMetrics(score, halsteadVolume, cyclomaticComplexity, loc, commentsPercentage);
    }
}
