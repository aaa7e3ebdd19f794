package com.repo.hotspot.core;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Folds file-level measurements up through every ancestor directory.
 *
 * <p>The tree is never built explicitly: each contribution walks its own
 * ancestor chain and fetches-or-creates the entry for every level.
 * Maintainability aggregates with {@code min} (a package is only as good as
 * its worst file), change counts aggregate with {@code sum}. The structural
 * measures follow the rules in {@link PathMetrics}.
 *
 * <p>Both passes are additive. Applying the same input twice counts it twice.
 * Instances are single-writer and belong to one run.
 */
public class MetricsAggregator {

    /** Lowest score a file may carry; a true zero would make its hotspot index infinite. */
    public static final double DEFAULT_MINIMUM_MAINTAINABILITY = 0.01;

    private final Path root;
    private final double minimumMaintainability;
    private final PathClassifier classifier;
    private final AncestorExpander expander;
    private final Map<Path, PathMetrics> metrics = new LinkedHashMap<>();

    public MetricsAggregator(Path root, double minimumMaintainability, PathClassifier classifier) {
        this.root = root;
        this.minimumMaintainability = minimumMaintainability;
        this.classifier = classifier;
        this.expander = new AncestorExpander(root);

        // The root is always reported, even for an empty tree
        metrics.put(root, new PathMetrics(root, PathKind.PACKAGE));
    }

    public void applyMaintainability(Collection<FileMeasurement> measurements) {
        for (FileMeasurement measurement : measurements) {
            double score = clamp(measurement.score());
            for (Path level : expander.expand(measurement.path())) {
                PathMetrics entry = fetchOrCreate(level);
                entry.mergeMaintainability(score);
                entry.mergeStructure(measurement.metrics());
            }
        }
    }

    public void applyChanges(Collection<FileChange> changes) {
        for (FileChange change : changes) {
            for (Path level : expander.expand(change.path())) {
                fetchOrCreate(level).addChanges(change.count());
            }
        }
    }

    /**
     * Raises scores below the floor to the floor.
     */
    public double clamp(double score) {
        return Math.max(score, minimumMaintainability);
    }

    private PathMetrics fetchOrCreate(Path path) {
        return metrics.computeIfAbsent(path, p -> new PathMetrics(p, kindOf(p)));
    }

    private PathKind kindOf(Path path) {
        return path.equals(root) ? PathKind.PACKAGE : classifier.classify(path);
    }

    /**
     * Read-only view in first-contribution order.
     */
    public Map<Path, PathMetrics> metrics() {
        return Collections.unmodifiableMap(metrics);
    }

    public PathMetrics get(Path path) {
        return metrics.get(expander.normalize(path));
    }

    public Path root() {
        return root;
    }
}
