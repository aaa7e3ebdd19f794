package com.repo.hotspot.core;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Suppresses excluded paths and everything beneath them.
 * Containment is decided segment by segment, so excluding {@code a/b}
 * leaves {@code a/bc} alone.
 */
public class ExclusionFilter {

    private final Set<Path> excluded;

    public ExclusionFilter(Collection<Path> excluded) {
        this.excluded = excluded.stream()
                .map(Path::normalize)
                .collect(Collectors.toUnmodifiableSet());
    }

    public static ExclusionFilter none() {
        return new ExclusionFilter(Set.of());
    }

    public boolean isExcluded(Path path) {
        return isExcluded(path, excluded);
    }

    /**
     * True if {@code path} equals, or lies under, any path of {@code excludedSet}.
     */
    public static boolean isExcluded(Path path, Collection<Path> excludedSet) {
        Path candidate = path.normalize();
        for (Path exclusion : excludedSet) {
            Path normalized = exclusion.normalize();
            if (normalized.toString().isEmpty()) {
                // "." excludes the whole relative tree
                if (!candidate.isAbsolute()) {
                    return true;
                }
                continue;
            }
            if (candidate.startsWith(normalized)) {
                return true;
            }
        }
        return false;
    }

    public Set<Path> excludedPaths() {
        return excluded;
    }
}
