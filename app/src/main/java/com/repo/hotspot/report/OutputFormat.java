package com.repo.hotspot.report;

public enum OutputFormat {
    TABLE,
    CSV;

    public static OutputFormat fromName(String name) {
        return switch (name.toLowerCase()) {
            case "table", "markdown" -> TABLE;
            case "csv" -> CSV;
            default -> throw new IllegalArgumentException("Unknown output format: " + name + ". Use table or csv");
        };
    }
}
