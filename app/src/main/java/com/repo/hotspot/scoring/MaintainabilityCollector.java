package com.repo.hotspot.scoring;

import com.repo.hotspot.core.ExclusionFilter;
import com.repo.hotspot.core.FileMeasurement;
import com.repo.hotspot.core.PathClassifier;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.stream.Stream;

/**
 * Walks a directory tree and scores every surviving source file.
 *
 * <p>Scoring runs on a fixed worker pool. Workers only produce
 * {@link FileMeasurement}s; nothing shared is mutated until all of them
 * are done. Any file that cannot be scored aborts the whole collection.
 */
public class MaintainabilityCollector {

    private final ScorerRegistry registry;
    private final int threads;

    public MaintainabilityCollector(ScorerRegistry registry, int threads) {
        this.registry = registry;
        this.threads = Math.max(1, threads);
    }

    /**
     * Source files under {@code directory}, relative to it, in sorted walk order.
     */
    public List<Path> discover(Path directory, PathClassifier classifier, ExclusionFilter exclusions)
            throws IOException {
        try (Stream<Path> walk = Files.walk(directory)) {
            return walk
                    .filter(Files::isRegularFile)
                    .map(directory::relativize)
                    .filter(relative -> !relative.startsWith(".git"))
                    .filter(classifier::isSourceFile)
                    .filter(relative -> !exclusions.isExcluded(relative))
                    .sorted()
                    .toList();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    public List<FileMeasurement> collect(Path directory, PathClassifier classifier, ExclusionFilter exclusions)
            throws IOException {
        List<Path> files = discover(directory, classifier, exclusions);
        System.err.println("Found " + files.size() + " source files to score.");
        return score(directory, files);
    }

    private List<FileMeasurement> score(Path directory, List<Path> files) throws IOException {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<FileMeasurement>> futures = new ArrayList<>(files.size());
            for (Path relative : files) {
                futures.add(pool.submit(() -> new FileMeasurement(relative,
                        registry.measure(directory.resolve(relative)))));
            }

            List<FileMeasurement> measurements = new ArrayList<>(files.size());
            for (Future<FileMeasurement> future : futures) {
                measurements.add(future.get());

                if (measurements.size() % 100 == 0 || measurements.size() == files.size()) {
                    System.err.print("\r> scoring files... " + measurements.size() + "/" + files.size());
                    System.err.flush();
                }
            }
            if (!files.isEmpty()) {
                System.err.println(); // Newline after progress
            }
            return measurements;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException("Scoring failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while scoring files");
        } finally {
            pool.shutdownNow();
        }
    }
}
