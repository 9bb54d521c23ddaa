package com.maestro.core.audit;

import com.maestro.core.model.ExportFormat;

/**
 * Rendered audit export.
 *
 * @param executionId execution the records belong to
 * @param format      format of {@code content}
 * @param content     encoded document
 * @param recordCount number of audit records exported
 */
public record AuditExport(String executionId, ExportFormat format, byte[] content, int recordCount) {

    public String contentType() {
        return switch (format) {
            case CSV -> "text/csv";
            case PDF -> "application/pdf";
        };
    }

    public String fileName() {
        return "audit-" + executionId + "." + format.name().toLowerCase();
    }
}
