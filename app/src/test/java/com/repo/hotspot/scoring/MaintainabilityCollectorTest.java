package com.repo.hotspot.scoring;

import com.repo.hotspot.core.ExclusionFilter;
import com.repo.hotspot.core.FileMeasurement;
import com.repo.hotspot.core.PathClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MaintainabilityCollectorTest {

    @TempDir
    Path repo;

    private final PathClassifier classifier = new PathClassifier(Set.of(".py"));

    @BeforeEach
    void createTree() throws IOException {
        write("a/x.py", "x = 1\n");
        write("a/y.py", "y = 2\n");
        write("a/notes.txt", "not source\n");
        write("a/bc/z.py", "z = 3\n");
        write("a/b/skip.py", "skip = 4\n");
        write("top.py", "");
        write(".git/hooks/pre-commit.py", "hook = 5\n");
    }

    private void write(String relative, String content) throws IOException {
        Path file = repo.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    void testDiscoverFiltersAndRelativizes() throws IOException {
        MaintainabilityCollector collector = new MaintainabilityCollector(
                new ScorerRegistry(List.of(), new HeuristicMaintainabilityScorer()), 2);

        List<Path> files = collector.discover(repo, classifier, new ExclusionFilter(Set.of(Path.of("a/b"))));

        assertEquals(List.of(
                Path.of("a/bc/z.py"),
                Path.of("a/x.py"),
                Path.of("a/y.py"),
                Path.of("top.py")), files);
    }

    @Test
    void testCollectScoresEveryFile() throws IOException {
        MaintainabilityScorer fixed = new ScorerRegistryTest.FixedScorer("fixed", Set.of("*"), true, 1, 55.5);
        MaintainabilityCollector collector = new MaintainabilityCollector(new ScorerRegistry(List.of(), fixed), 4);

        List<FileMeasurement> measurements = collector.collect(repo, classifier, ExclusionFilter.none());

        assertEquals(5, measurements.size());
        assertTrue(measurements.stream().allMatch(m -> m.score() == 55.5));
        assertTrue(measurements.stream().noneMatch(m -> m.path().isAbsolute()));
        assertTrue(measurements.stream().anyMatch(m -> m.path().equals(Path.of("a/b/skip.py"))));
    }

    @Test
    void testCollectWithRealScorer() throws IOException {
        MaintainabilityCollector collector = new MaintainabilityCollector(
                new ScorerRegistry(List.of(), new HeuristicMaintainabilityScorer()), 1);

        List<FileMeasurement> measurements = collector.collect(repo, classifier, ExclusionFilter.none());

        FileMeasurement top = measurements.stream()
                .filter(m -> m.path().equals(Path.of("top.py")))
                .findFirst()
                .orElseThrow();
        assertEquals(100.0, top.score(), "Empty file scores 100");
    }

    @Test
    void testScoringFailureAbortsRun() {
        MaintainabilityScorer failing = new ScorerRegistryTest.FixedScorer("failing", Set.of("*"), true, 1, 0) {
            @Override
            public double score(Path sourceFile) throws IOException {
                if (sourceFile.endsWith("y.py")) {
                    throw new IOException("cannot read " + sourceFile);
                }
                return 80;
            }
        };
        MaintainabilityCollector collector = new MaintainabilityCollector(new ScorerRegistry(List.of(), failing), 3);

        IOException e = assertThrows(IOException.class,
                () -> collector.collect(repo, classifier, ExclusionFilter.none()));
        assertTrue(e.getMessage().contains("y.py"));
    }

    @Test
    void testEmptyTree(@TempDir Path empty) throws IOException {
        MaintainabilityCollector collector = new MaintainabilityCollector(
                new ScorerRegistry(List.of(), new HeuristicMaintainabilityScorer()), 2);
        assertEquals(List.of(), collector.collect(empty, classifier, ExclusionFilter.none()));
    }
}
