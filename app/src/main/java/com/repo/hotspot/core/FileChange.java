package com.repo.hotspot.core;

import java.nio.file.Path;

/**
 * Number of change-log entries that touched one file.
 */
public record FileChange(
        /** Path relative to the analyzed directory */
        Path path,

        /** Occurrences in the change log within the date window */
        int count) {
}
