package com.repo.hotspot.core;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Aggregated metrics for one path: a measured file or an ancestor of one.
 * Maintainability starts unset (positive infinity) and only goes down as
 * contributions arrive; changes start at zero and only go up.
 *
 * <p>Structural measures combine per rule: Halstead volume and cyclomatic
 * complexity keep the maximum, lines of code add up, and the comments
 * percentage is the average weighted by lines of code.
 */
public class PathMetrics {

    /** Maintainability of a path no measured file has reached yet. */
    public static final double UNSET_MAINTAINABILITY = Double.POSITIVE_INFINITY;

    private final Path path;
    private final PathKind kind;
    private double maintainability;
    private int changes;
    private double halsteadVolume;
    private int cyclomaticComplexity;
    private int loc;
    private double commentsPercentage;

    public PathMetrics(Path path, PathKind kind) {
        this(path, kind, UNSET_MAINTAINABILITY, 0);
    }

    public PathMetrics(Path path, PathKind kind, double maintainability, int changes) {
        this(path, kind, maintainability, changes, 0.0, 0, 0, 0.0);
    }

    public PathMetrics(Path path, PathKind kind, double maintainability, int changes,
            double halsteadVolume, int cyclomaticComplexity, int loc, double commentsPercentage) {
        this.path = Objects.requireNonNull(path, "path");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.maintainability = maintainability;
        this.changes = changes;
        this.halsteadVolume = halsteadVolume;
        this.cyclomaticComplexity = cyclomaticComplexity;
        this.loc = loc;
        this.commentsPercentage = commentsPercentage;
    }

    public Path path() {
        return path;
    }

    public PathKind kind() {
        return kind;
    }

    public double maintainability() {
        return maintainability;
    }

    public int changes() {
        return changes;
    }

    public double halsteadVolume() {
        return halsteadVolume;
    }

    public int cyclomaticComplexity() {
        return cyclomaticComplexity;
    }

    public int loc() {
        return loc;
    }

    public double commentsPercentage() {
        return commentsPercentage;
    }

    /**
     * Lowers maintainability to {@code score} if it is worse than the current value.
     */
    void mergeMaintainability(double score) {
        maintainability = Math.min(maintainability, score);
    }

    void addChanges(int count) {
        changes += count;
    }

    void mergeStructure(SourceMetrics source) {
        halsteadVolume = Math.max(halsteadVolume, source.halsteadVolume());
        cyclomaticComplexity = Math.max(cyclomaticComplexity, source.cyclomaticComplexity());

        int totalLoc = loc + source.loc();
        commentsPercentage = totalLoc == 0
                ? 0.0
                : (commentsPercentage * loc + source.commentsPercentage() * source.loc()) / totalLoc;
        loc = totalLoc;
    }

    /**
     * Ranking score: {@code changes / (maintainability / 100)}.
     * The division is not guarded; a maintainability of zero yields an
     * infinite (or NaN) index, an unset maintainability yields 0.
     */
    public double hotspotIndex() {
        return HotspotIndex.of(this);
    }

    /**
     * True when no measured file ever contributed to this path, typically a
     * file that was changed and later deleted.
     */
    public boolean isDeleted() {
        return maintainability == UNSET_MAINTAINABILITY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PathMetrics other))
            return false;
        return path.equals(other.path)
                && kind == other.kind
                && Double.compare(maintainability, other.maintainability) == 0
                && changes == other.changes
                && Double.compare(halsteadVolume, other.halsteadVolume) == 0
                && cyclomaticComplexity == other.cyclomaticComplexity
                && loc == other.loc
                && Double.compare(commentsPercentage, other.commentsPercentage) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, kind, maintainability, changes, halsteadVolume, cyclomaticComplexity, loc,
                commentsPercentage);
    }

    @Override
    public String toString() {
        return ("PathMetrics[path=%s, kind=%s, maintainability=%s, changes=%d, "
                + "volume=%s, complexity=%d, loc=%d, comments=%s]")
                .formatted(path, kind.label(), maintainability, changes, halsteadVolume, cyclomaticComplexity, loc,
                        commentsPercentage);
    }
}
