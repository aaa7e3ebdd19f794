package com.repo.hotspot;

import com.repo.hotspot.core.*;
import com.repo.hotspot.git.ChangeCounter;
import com.repo.hotspot.git.ChangeLogSource;
import com.repo.hotspot.scoring.MaintainabilityCollector;
import com.repo.hotspot.scoring.ScorerRegistry;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * One full hotspot run over a directory.
 *
 * <p>The change log is read on its own thread while files are scored; both
 * must finish before the aggregator sees any input. Every run starts from an
 * empty aggregator, nothing is carried between runs.
 */
public class HotspotAnalysis {

    private final ScorerRegistry registry;
    private final ChangeLogSource changeLogSource;

    public HotspotAnalysis(ScorerRegistry registry, ChangeLogSource changeLogSource) {
        this.registry = registry;
        this.changeLogSource = changeLogSource;
    }

    /**
     * Scores, counts, aggregates and selects. Rows come back unsorted.
     */
    public List<PathMetrics> run(Path directory, HotspotConfig config) throws IOException {
        ExecutorService gitExecutor = Executors.newSingleThreadExecutor();
        try {
            System.err.println("\n>>> PHASE 1: MINING EVOLUTION (GIT) <<<");
            Future<List<FileChange>> pendingChanges = gitExecutor.submit(() -> countChanges(directory, config));

            System.err.println("\n>>> PHASE 2: SCORING MAINTAINABILITY <<<");
            List<FileMeasurement> measurements = measure(directory, config);
            List<FileChange> changes = await(pendingChanges);

            System.err.println("\n>>> PHASE 3: AGGREGATING <<<");
            MetricsAggregator aggregator = aggregate(measurements, changes, config);
            List<PathMetrics> selected = ResultSelector.select(
                    aggregator.metrics().values(), config.isIncludeDeleted());
            System.err.printf("Aggregated %d paths, reporting %d%n", aggregator.metrics().size(), selected.size());
            return selected;
        } finally {
            gitExecutor.shutdownNow();
        }
    }

    public List<FileMeasurement> measure(Path directory, HotspotConfig config) throws IOException {
        MaintainabilityCollector collector = new MaintainabilityCollector(registry, config.getThreads());
        return collector.collect(directory, config.classifier(), config.exclusionFilter());
    }

    public List<FileChange> countChanges(Path directory, HotspotConfig config) throws IOException {
        return new ChangeCounter(changeLogSource)
                .count(directory, config.getSince(), config.classifier(), config.exclusionFilter());
    }

    /**
     * Folds both inputs into a fresh aggregator seeded with the root.
     */
    public static MetricsAggregator aggregate(List<FileMeasurement> measurements, List<FileChange> changes,
            HotspotConfig config) {
        MetricsAggregator aggregator = new MetricsAggregator(
                config.getRootPath(), config.getMinimumMaintainability(), config.classifier());
        aggregator.applyMaintainability(measurements);
        aggregator.applyChanges(changes);
        return aggregator;
    }

    private static List<FileChange> await(Future<List<FileChange>> pending) throws IOException {
        try {
            return pending.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof UncheckedIOException unchecked) {
                throw unchecked.getCause();
            }
            throw new IOException("Reading change log failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while reading change log");
        }
    }
}
