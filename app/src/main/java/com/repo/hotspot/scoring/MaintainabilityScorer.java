package com.repo.hotspot.scoring;

import com.repo.hotspot.core.SourceMetrics;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Plugin interface for maintainability scorers.
 * Each implementation turns one source file into a score from 0 (worst)
 * to 100 (best).
 */
public interface MaintainabilityScorer {

    /**
     * Unique identifier for this scorer (e.g., "radon", "heuristic").
     */
    String getScorerId();

    /**
     * File extensions this scorer handles (e.g., ".py").
     * Extensions should include the leading dot.
     */
    Set<String> getSupportedExtensions();

    /**
     * Check if this scorer is available at runtime.
     * For example, the radon scorer checks if radon is installed.
     */
    boolean isAvailable();

    /**
     * Score a single source file.
     *
     * @param sourceFile path to the source file
     * @return maintainability, nominally 0 to 100
     * @throws IOException if the file cannot be read or scored; this aborts the run
     */
    double score(Path sourceFile) throws IOException;

    /**
     * Score plus structural measures. Scorers that only produce a score
     * report zero for everything else.
     */
    default SourceMetrics measure(Path sourceFile) throws IOException {
        return SourceMetrics.scoreOnly(score(sourceFile));
    }

    /**
     * Priority when multiple scorers support the same extension.
     * Lower values = higher priority. Default is 100.
     */
    default int getPriority() {
        return 100;
    }
}
