package com.repo.hotspot.core;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AncestorExpanderTest {

    private final AncestorExpander expander = new AncestorExpander(Path.of("."));

    @Test
    void testAbsolutePathEndsAtFilesystemRoot() {
        List<Path> chain = expander.expand(Path.of("/a/b/c/file.txt"));
        assertEquals(List.of(
                Path.of("/a/b/c/file.txt"),
                Path.of("/a/b/c"),
                Path.of("/a/b"),
                Path.of("/a"),
                Path.of("/")), chain);
    }

    @Test
    void testFileAtAbsoluteRoot() {
        assertEquals(List.of(Path.of("/file.txt"), Path.of("/")), expander.expand(Path.of("/file.txt")));
    }

    @Test
    void testRelativePathEndsAtRootSentinel() {
        assertEquals(List.of(Path.of("file.txt"), Path.of(".")), expander.expand(Path.of("file.txt")));
        assertEquals(List.of(Path.of("a/x.py"), Path.of("a"), Path.of(".")), expander.expand(Path.of("a/x.py")));
    }

    @Test
    void testDotSegmentsAreNormalized() {
        assertEquals(List.of(Path.of("a/x.py"), Path.of("a"), Path.of(".")),
                expander.expand(Path.of("./a/b/../x.py")));
    }

    @Test
    void testRootExpandsToItself() {
        assertEquals(List.of(Path.of(".")), expander.expand(Path.of(".")));
        assertEquals(List.of(Path.of("/")), expander.expand(Path.of("/")));
    }

    @Test
    void testEveryLevelVisitedOnce() {
        List<Path> chain = expander.expand(Path.of("a/b/c/d/e.py"));
        assertEquals(6, chain.size());
        assertEquals(chain.size(), new HashSet<>(chain).size(), "No level may repeat");
    }

    @Test
    void testCustomRootSentinel() {
        AncestorExpander custom = new AncestorExpander(Path.of("<root>"));
        assertEquals(List.of(Path.of("x.py"), Path.of("<root>")), custom.expand(Path.of("x.py")));
    }
}
