package com.repo.hotspot.core;

import java.nio.file.Path;

/**
 * Measurements of one surviving source file.
 */
public record FileMeasurement(
        /** Path relative to the analyzed directory */
        Path path,

        /** Raw scorer output; the score is not yet clamped */
        SourceMetrics metrics) {

    public FileMeasurement(Path path, double score) {
        this(path, SourceMetrics.scoreOnly(score));
    }

    public double score() {
        return metrics.maintainability();
    }
}
