package com.repo.hotspot.git;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

/**
 * Source of historical change events.
 * Returns one entry per changed file per commit, so a file touched by three
 * commits appears three times.
 */
@FunctionalInterface
public interface ChangeLogSource {

    /**
     * @param directory directory whose history is read; returned paths are relative to it
     * @param since     only commits on or after this date, or null for all history
     */
    List<String> changedFiles(Path directory, LocalDate since) throws IOException;
}
