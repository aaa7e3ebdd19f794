package com.repo.hotspot.core;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExclusionFilterTest {

    private static final Path FILE = Path.of("/a/b/c/file.py");

    @Test
    void testPathUnderExcludedDirectory() {
        assertTrue(ExclusionFilter.isExcluded(FILE, Set.of(Path.of("/a/b"))));
    }

    @Test
    void testPathNotExcluded() {
        assertFalse(ExclusionFilter.isExcluded(FILE, Set.of(Path.of("/x/y"))));
    }

    @Test
    void testExcludedAmongMultiple() {
        assertTrue(ExclusionFilter.isExcluded(FILE, Set.of(Path.of("/a/b"), Path.of("/x/y"))));
    }

    @Test
    void testNoExclusions() {
        assertFalse(ExclusionFilter.isExcluded(FILE, Set.of()));
        assertFalse(ExclusionFilter.none().isExcluded(FILE));
    }

    @Test
    void testMatchingFilename() {
        assertTrue(ExclusionFilter.isExcluded(FILE, Set.of(Path.of("/a/b/c/file.py"))));
    }

    @Test
    void testMatchingDirectory() {
        assertTrue(ExclusionFilter.isExcluded(Path.of("/a/b/c/"), Set.of(Path.of("/a/b/c/"))));
    }

    @Test
    void testSegmentContainmentNotStringPrefix() {
        ExclusionFilter filter = new ExclusionFilter(Set.of(Path.of("/a/b")));
        assertFalse(filter.isExcluded(Path.of("/a/bc")));
        assertFalse(filter.isExcluded(Path.of("/a/bc/x.py")));
        assertTrue(filter.isExcluded(Path.of("/a/b/x.py")));
    }

    @Test
    void testRelativePathsAreNormalized() {
        ExclusionFilter filter = new ExclusionFilter(Set.of(Path.of("./vendor")));
        assertTrue(filter.isExcluded(Path.of("vendor/lib/x.py")));
        assertTrue(filter.isExcluded(Path.of("src/../vendor/y.py")));
        assertFalse(filter.isExcluded(Path.of("vendored/z.py")));
    }
}
