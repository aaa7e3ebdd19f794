package com.repo.hotspot.report;

import com.repo.hotspot.core.PathMetrics;

import java.util.List;

/**
 * Fixed-width grid for terminals. The path column is left-aligned, all
 * other columns right-aligned. A caption under the grid names the sort order.
 */
public class TableReporter {

    public String render(List<PathMetrics> metrics, SortField sortField) {
        List<String[]> rows = metrics.stream()
                .map(m -> ReportRow.from(m).cells())
                .toList();

        int[] widths = new int[ReportRow.FIELD_NAMES.length];
        for (int i = 0; i < widths.length; i++) {
            widths[i] = ReportRow.FIELD_NAMES[i].length();
        }
        for (String[] row : rows) {
            for (int i = 0; i < row.length; i++) {
                widths[i] = Math.max(widths[i], row[i].length());
            }
        }

        String separator = separator(widths);
        StringBuilder table = new StringBuilder();
        table.append(separator);
        table.append(line(ReportRow.FIELD_NAMES, widths));
        table.append(separator);
        for (String[] row : rows) {
            table.append(line(row, widths));
        }
        table.append(separator);
        table.append("Sorted by ").append(sortField.describe()).append('\n');
        return table.toString();
    }

    private String separator(int[] widths) {
        StringBuilder sb = new StringBuilder("+");
        for (int width : widths) {
            sb.append("-".repeat(width + 2)).append('+');
        }
        return sb.append('\n').toString();
    }

    private String line(String[] cells, int[] widths) {
        StringBuilder sb = new StringBuilder("|");
        for (int i = 0; i < cells.length; i++) {
            String format = i == 0 ? " %-" + widths[i] + "s |" : " %" + widths[i] + "s |";
            sb.append(format.formatted(cells[i]));
        }
        return sb.append('\n').toString();
    }
}
