package com.repo.hotspot.scoring;

import com.repo.hotspot.core.SourceMetrics;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Registry for maintainability scorers.
 * Routes files to appropriate scorers based on extension.
 */
public class ScorerRegistry {

    private final List<MaintainabilityScorer> scorers;
    private final Map<String, MaintainabilityScorer> extensionMap;
    private final MaintainabilityScorer fallbackScorer;

    public ScorerRegistry(List<MaintainabilityScorer> scorers, MaintainabilityScorer fallbackScorer) {
        this.scorers = new ArrayList<>(scorers);
        this.fallbackScorer = fallbackScorer;
        this.extensionMap = buildExtensionMap();
    }

    /**
     * Registry with the radon scorer for Python and the heuristic scorer for everything else.
     */
    public static ScorerRegistry standard() {
        return new ScorerRegistry(List.of(new RadonMaintainabilityScorer()), new HeuristicMaintainabilityScorer());
    }

    private Map<String, MaintainabilityScorer> buildExtensionMap() {
        Map<String, MaintainabilityScorer> map = new HashMap<>();

        List<MaintainabilityScorer> sorted = new ArrayList<>(scorers);
        sorted.sort(Comparator.comparingInt(MaintainabilityScorer::getPriority));

        // First available scorer wins for each extension
        for (MaintainabilityScorer scorer : sorted) {
            if (!scorer.isAvailable()) {
                System.err.println("  [SKIP] " + scorer.getScorerId() + " scorer not available");
                continue;
            }

            for (String ext : scorer.getSupportedExtensions()) {
                map.putIfAbsent(ext.toLowerCase(Locale.ROOT), scorer);
            }
        }

        return map;
    }

    /**
     * Get the appropriate scorer for a file.
     */
    public MaintainabilityScorer getScorer(Path file) {
        String ext = getExtension(file);
        return extensionMap.getOrDefault(ext, fallbackScorer);
    }

    public double score(Path file) throws IOException {
        return getScorer(file).score(file);
    }

    public SourceMetrics measure(Path file) throws IOException {
        return getScorer(file).measure(file);
    }

    /**
     * Print summary of available scorers.
     */
    public void printSummary() {
        System.err.println("Available scorers:");
        for (MaintainabilityScorer scorer : scorers) {
            if (scorer.isAvailable()) {
                System.err.printf("  [%s] %s%n", scorer.getScorerId(),
                        String.join(", ", scorer.getSupportedExtensions()));
            }
        }
        System.err.printf("  [fallback] %s (all other files)%n", fallbackScorer.getScorerId());
    }

    private String getExtension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot).toLowerCase(Locale.ROOT) : "";
    }
}
