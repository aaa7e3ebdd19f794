package com.repo.hotspot.git;

import com.repo.hotspot.core.ExclusionFilter;
import com.repo.hotspot.core.FileChange;
import com.repo.hotspot.core.PathClassifier;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the raw change log into per-file change counts.
 * Only source files survive, excluded paths are dropped before counting.
 * Files that no longer exist on disk are kept and show up as deleted rows
 * in the report.
 */
public class ChangeCounter {

    private final ChangeLogSource source;

    public ChangeCounter(ChangeLogSource source) {
        this.source = source;
    }

    public List<FileChange> count(Path directory, LocalDate since, PathClassifier classifier,
            ExclusionFilter exclusions) throws IOException {
        List<String> changedFiles = source.changedFiles(directory, since);
        List<FileChange> changes = count(changedFiles, classifier, exclusions);
        System.err.println("Found " + changes.size() + " changed source files.");
        return changes;
    }

    /**
     * Counts occurrences in first-seen order.
     */
    public static List<FileChange> count(List<String> changedFiles, PathClassifier classifier,
            ExclusionFilter exclusions) {
        Map<Path, Integer> counts = new LinkedHashMap<>();
        for (String line : changedFiles) {
            Path file = Path.of(line).normalize();
            if (!classifier.isSourceFile(file) || exclusions.isExcluded(file)) {
                continue;
            }
            counts.merge(file, 1, Integer::sum);
        }

        List<FileChange> changes = new ArrayList<>(counts.size());
        counts.forEach((path, count) -> changes.add(new FileChange(path, count)));
        return changes;
    }
}
