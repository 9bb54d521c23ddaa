package com.maestro.core.model;

/**
 * Audit export formats.
 */
public enum ExportFormat {
    CSV,
    PDF;

    public static ExportFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return CSV;
        }
        return ExportFormat.valueOf(value.trim().toUpperCase());
    }
}
