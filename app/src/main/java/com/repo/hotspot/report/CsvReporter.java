package com.repo.hotspot.report;

import com.repo.hotspot.core.PathKind;
import com.repo.hotspot.core.PathMetrics;

import java.util.ArrayList;
import java.util.List;

/**
 * Comma-separated report, one row per path, with a header line.
 */
public class CsvReporter {

    public String render(List<PathMetrics> metrics) {
        StringBuilder csv = new StringBuilder();
        // Header
        csv.append(String.join(",", ReportRow.FIELD_NAMES)).append('\n');

        // Rows
        for (PathMetrics m : metrics) {
            String[] cells = ReportRow.from(m).cells();
            for (int i = 0; i < cells.length; i++) {
                if (i > 0)
                    csv.append(',');
                csv.append(escape(cells[i]));
            }
            csv.append('\n');
        }
        return csv.toString();
    }

    /**
     * Reads a report produced by {@link #render(List)}.
     *
     * @throws IllegalArgumentException on a missing or unexpected header, or a short row
     */
    public List<ReportRow> parse(String csv) {
        List<String> lines = csv.lines().filter(line -> !line.isEmpty()).toList();
        if (lines.isEmpty() || !splitLine(lines.get(0)).equals(List.of(ReportRow.FIELD_NAMES))) {
            throw new IllegalArgumentException("Not a hotspot CSV report: missing header");
        }

        List<ReportRow> rows = new ArrayList<>();
        for (int i = 1; i < lines.size(); i++) {
            List<String> cells = splitLine(lines.get(i));
            if (cells.size() != ReportRow.FIELD_NAMES.length) {
                throw new IllegalArgumentException("Line " + (i + 1) + ": expected "
                        + ReportRow.FIELD_NAMES.length + " fields, got " + cells.size());
            }
            rows.add(new ReportRow(
                    cells.get(0),
                    PathKind.fromLabel(cells.get(1)),
                    ReportRow.parseNumber(cells.get(2)),
                    Integer.parseInt(cells.get(3).trim()),
                    Integer.parseInt(cells.get(4).trim()),
                    ReportRow.parseNumber(cells.get(5)),
                    ReportRow.parseNumber(cells.get(6)),
                    Integer.parseInt(cells.get(7).trim()),
                    ReportRow.parseNumber(cells.get(8))));
        }
        return rows;
    }

    private String escape(String s) {
        if (s == null)
            return "";
        // Quote fields holding separators or quotes, doubling embedded quotes
        if (s.contains(",") || s.contains("\"")) {
            return "\"" + s.replace("\"", "\"\"") + "\"";
        }
        return s;
    }

    private List<String> splitLine(String line) {
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else if (c == '"') {
                    quoted = false;
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                cells.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        cells.add(current.toString());
        return cells;
    }
}
