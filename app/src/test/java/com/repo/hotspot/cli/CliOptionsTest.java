package com.repo.hotspot.cli;

import com.repo.hotspot.core.HotspotConfig;
import com.repo.hotspot.report.OutputFormat;
import com.repo.hotspot.report.SortField;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CliOptionsTest {

    @Test
    void testReportIsDefaultCommand() {
        CliOptions options = CliOptions.parse(new String[] { "src" });
        assertEquals(CliOptions.Command.REPORT, options.command());
        assertEquals(Path.of("src"), options.directory());
        assertNull(options.includeDeleted());
        assertNull(options.sortField());
    }

    @Test
    void testAllReportOptions() {
        CliOptions options = CliOptions.parse(new String[] {
                "report", "repo", "--exclude", "vendor", "-e", "tests", "--since", "2023-10-01",
                "--deleted", "--sort", "changes_count", "--format", "csv", "--output", "out.csv",
                "--threads", "4" });

        assertEquals(CliOptions.Command.REPORT, options.command());
        assertEquals(List.of(Path.of("vendor"), Path.of("tests")), options.exclusions());
        assertEquals(LocalDate.of(2023, 10, 1), options.since());
        assertTrue(options.includeDeleted());
        assertEquals(SortField.CHANGES_COUNT, options.sortField());
        assertEquals(OutputFormat.CSV, options.outputFormat());
        assertEquals(Path.of("out.csv"), options.outputPath());
        assertEquals(4, options.threads());
    }

    @Test
    void testSubcommands() {
        CliOptions mi = CliOptions.parse(new String[] { "mi", "repo", "--json" });
        assertEquals(CliOptions.Command.MI, mi.command());
        assertTrue(mi.json());

        CliOptions changes = CliOptions.parse(new String[] { "changes", "repo", "--since", "2024-01-31" });
        assertEquals(CliOptions.Command.CHANGES, changes.command());
        assertEquals(LocalDate.of(2024, 1, 31), changes.since());

        CliOptions combine = CliOptions.parse(new String[] { "combine", "-m", "mi.json", "-c", "changes.json" });
        assertEquals(CliOptions.Command.COMBINE, combine.command());
        assertEquals(Path.of("mi.json"), combine.maintainabilityFile());
        assertEquals(Path.of("changes.json"), combine.changesFile());
    }

    @Test
    void testInvalidSinceRejected() {
        for (String since : List.of("2023-13-01", "2023-10-32", "invalid-date")) {
            UsageException e = assertThrows(UsageException.class,
                    () -> CliOptions.parse(new String[] { "repo", "--since", since }));
            assertEquals("Invalid date format. Use 'YYYY-MM-DD'", e.getMessage());
        }
    }

    @Test
    void testUsageErrors() {
        assertThrows(UsageException.class, () -> CliOptions.parse(new String[] {}));
        assertThrows(UsageException.class, () -> CliOptions.parse(new String[] { "repo", "--bogus" }));
        assertThrows(UsageException.class, () -> CliOptions.parse(new String[] { "repo", "other" }));
        assertThrows(UsageException.class, () -> CliOptions.parse(new String[] { "repo", "--sort" }));
        assertThrows(UsageException.class, () -> CliOptions.parse(new String[] { "repo", "--sort", "size" }));
        assertThrows(UsageException.class, () -> CliOptions.parse(new String[] { "repo", "--threads", "0" }));
        assertThrows(UsageException.class, () -> CliOptions.parse(new String[] { "combine", "-m", "mi.json" }));
    }

    @Test
    void testStructuralSortFields() {
        assertEquals(SortField.LOC, CliOptions.parse(new String[] { "repo", "--sort", "loc" }).sortField());
        assertEquals(SortField.COMMENTS_PERCENTAGE,
                CliOptions.parse(new String[] { "repo", "--sort", "comments_percentage" }).sortField());
        assertEquals(SortField.HALSTEAD_VOLUME,
                CliOptions.parse(new String[] { "repo", "--sort", "halstead_volume" }).sortField());
    }

    @Test
    void testHelpNeedsNoDirectory() {
        assertTrue(CliOptions.parse(new String[] { "--help" }).help());
    }

    @Test
    void testApplyToOverridesOnlyGivenOptions() {
        HotspotConfig config = HotspotConfig.defaults().withOutputFormat(OutputFormat.CSV);
        CliOptions options = CliOptions.parse(new String[] { "repo", "--sort", "path", "--exclude", "/work/repo/gen" });

        options.applyTo(config, Path.of("/work/repo"));

        assertEquals(SortField.PATH, config.getSortField());
        assertEquals(OutputFormat.CSV, config.getOutputFormat(), "Untouched option keeps config value");
        assertEquals(Set.of(Path.of("gen")), config.getExclusions(), "Absolute exclusion made relative");
    }

    @Test
    void testRelativeTo() {
        assertEquals(Path.of("a/b"), CliOptions.relativeTo(Path.of("/repo"), Path.of("./a/b")));
        assertEquals(Path.of("a/b"), CliOptions.relativeTo(Path.of("/repo"), Path.of("/repo/a/b")));
        assertEquals(Path.of("/elsewhere"), CliOptions.relativeTo(Path.of("/repo"), Path.of("/elsewhere")));
    }
}
