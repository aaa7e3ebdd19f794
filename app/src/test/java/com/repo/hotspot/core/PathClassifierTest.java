package com.repo.hotspot.core;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PathClassifierTest {

    private final PathClassifier classifier = new PathClassifier(Set.of(".py", ".java"));

    @Test
    void testSourceFileIsModule() {
        assertEquals(PathKind.MODULE, classifier.classify(Path.of("module.py")));
        assertEquals(PathKind.MODULE, classifier.classify(Path.of("directory/another_module.py")));
        assertEquals(PathKind.MODULE, classifier.classify(Path.of("src/Main.java")));
    }

    @Test
    void testDirectoryIsPackage() {
        assertEquals(PathKind.PACKAGE, classifier.classify(Path.of("directory/package")));
        assertEquals(PathKind.PACKAGE, classifier.classify(Path.of(".")));
        assertEquals(PathKind.PACKAGE, classifier.classify(Path.of("/")));
    }

    @Test
    void testOtherExtensionsArePackages() {
        // Only the last component counts, and only configured extensions
        assertEquals(PathKind.PACKAGE, classifier.classify(Path.of("notes/readme.md")));
        assertEquals(PathKind.PACKAGE, classifier.classify(Path.of("module.py/inner")));
        assertEquals(PathKind.PACKAGE, classifier.classify(Path.of(".py")));
    }

    @Test
    void testExtensionMatchIgnoresCase() {
        assertEquals(PathKind.MODULE, classifier.classify(Path.of("LEGACY.PY")));
    }

    @Test
    void testClassificationIsPure() {
        Path path = Path.of("a/b/c.py");
        PathKind first = classifier.classify(path);
        MetricsAggregator aggregator = new MetricsAggregator(Path.of("."), 0.01, classifier);
        aggregator.applyChanges(List.of(new FileChange(path, 3)));
        assertEquals(first, classifier.classify(path));
        assertEquals(first, aggregator.get(path).kind());
    }
}
