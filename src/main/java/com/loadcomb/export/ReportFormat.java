package com.loadcomb.export;

/**
 * Supported report formats.
 */
public enum ReportFormat {
    CSV,
    JSON;

    public ReportWriter createWriter() {
        return switch (this) {
            case CSV -> new CsvReportWriter();
            case JSON -> new JsonReportWriter();
        };
    }
}
