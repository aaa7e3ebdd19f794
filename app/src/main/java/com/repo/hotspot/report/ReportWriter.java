package com.repo.hotspot.report;

import com.repo.hotspot.core.PathMetrics;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Sorts report rows and writes them in the requested format, either to a
 * file or to standard output.
 */
public class ReportWriter {

    private final CsvReporter csvReporter = new CsvReporter();
    private final TableReporter tableReporter = new TableReporter();

    public static List<PathMetrics> sort(List<PathMetrics> metrics, SortField sortField) {
        return metrics.stream()
                .sorted(sortField.comparator())
                .toList();
    }

    public String render(List<PathMetrics> metrics, OutputFormat format, SortField sortField) {
        List<PathMetrics> sorted = sort(metrics, sortField);
        return switch (format) {
            case CSV -> csvReporter.render(sorted);
            case TABLE -> tableReporter.render(sorted, sortField);
        };
    }

    /**
     * @param outputPath target file, or null for {@code out}
     */
    public void write(List<PathMetrics> metrics, OutputFormat format, SortField sortField,
            Path outputPath, PrintStream out) throws IOException {
        String report = render(metrics, format, sortField);
        if (outputPath == null) {
            out.print(report);
            out.flush();
            return;
        }
        Files.writeString(outputPath, report);
        System.err.println("Report generated at: " + outputPath.toAbsolutePath());
    }
}
