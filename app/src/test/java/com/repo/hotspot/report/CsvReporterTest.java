package com.repo.hotspot.report;

import com.repo.hotspot.core.PathKind;
import com.repo.hotspot.core.PathMetrics;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvReporterTest {

    private final CsvReporter reporter = new CsvReporter();

    @Test
    void testSingleMetric() {
        String csv = reporter.render(List.of(new PathMetrics(Path.of("/a/b"), PathKind.MODULE, 75.0, 5)));

        assertEquals(List.of(
                "path,path_type,halstead_volume,cyclomatic_complexity,loc,comments_percentage,maintainability_index,changes_count,hotspot_index",
                "/a/b,module,0.0,0,0,0.0,75.0,5,6.666666666666667"), csv.lines().toList());
    }

    @Test
    void testEmptyMetrics() {
        assertEquals(List.of("path,path_type,halstead_volume,cyclomatic_complexity,loc,comments_percentage,maintainability_index,changes_count,hotspot_index"),
                reporter.render(List.of()).lines().toList());
    }

    @Test
    void testUnsetMaintainabilityRendersAsInf() {
        String csv = reporter.render(List.of(new PathMetrics(Path.of("gone.py"), PathKind.MODULE,
                PathMetrics.UNSET_MAINTAINABILITY, 4)));
        assertEquals("gone.py,module,0.0,0,0,0.0,inf,4,0.0", csv.lines().toList().get(1));
    }

    @Test
    void testRoundTrip() {
        List<PathMetrics> metrics = List.of(
                new PathMetrics(Path.of("."), PathKind.PACKAGE, 12.345678901234, 17, 812.25, 14, 230, 18.75),
                new PathMetrics(Path.of("odd,name/mod.py"), PathKind.MODULE, 0.01, 3),
                new PathMetrics(Path.of("quote\"d.py"), PathKind.MODULE, 99.9, 0),
                new PathMetrics(Path.of("gone.py"), PathKind.MODULE, PathMetrics.UNSET_MAINTAINABILITY, 2));

        List<ReportRow> parsed = reporter.parse(reporter.render(metrics));

        assertEquals(metrics.size(), parsed.size());
        for (int i = 0; i < metrics.size(); i++) {
            ReportRow expected = ReportRow.from(metrics.get(i));
            ReportRow actual = parsed.get(i);
            assertEquals(expected.path(), actual.path());
            assertEquals(expected.kind(), actual.kind());
            assertEquals(expected.halsteadVolume(), actual.halsteadVolume(), 1e-9);
            assertEquals(expected.cyclomaticComplexity(), actual.cyclomaticComplexity());
            assertEquals(expected.loc(), actual.loc());
            assertEquals(expected.commentsPercentage(), actual.commentsPercentage(), 1e-9);
            assertEquals(expected.maintainability(), actual.maintainability(), 1e-9);
            assertEquals(expected.changes(), actual.changes());
            assertEquals(expected.hotspotIndex(), actual.hotspotIndex(), 1e-9);
        }
    }

    @Test
    void testParseRejectsForeignCsv() {
        assertThrows(IllegalArgumentException.class, () -> reporter.parse("a,b,c\n1,2,3\n"));
        assertThrows(IllegalArgumentException.class, () -> reporter.parse(""));
        assertThrows(IllegalArgumentException.class, () -> reporter.parse(
                "path,path_type,halstead_volume,cyclomatic_complexity,loc,comments_percentage,maintainability_index,changes_count,hotspot_index\nx.py,module,1.0\n"));
    }

    @Test
    void testNonFiniteNumbers() {
        assertEquals("nan", ReportRow.formatNumber(Double.NaN));
        assertEquals("-inf", ReportRow.formatNumber(Double.NEGATIVE_INFINITY));
        assertTrue(Double.isNaN(ReportRow.parseNumber("nan")));
        assertEquals(Double.NEGATIVE_INFINITY, ReportRow.parseNumber("-inf"));
        assertEquals(Double.POSITIVE_INFINITY, ReportRow.parseNumber("inf"));
    }
}
