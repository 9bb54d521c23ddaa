package com.maestro.core.audit;

import com.maestro.core.model.AuditRecord;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes audit records as RFC 4180 CSV with the columns
 * {@code timestamp,agent,action,status,message}.
 */
final class CsvAuditExporter {

    static final String HEADER = "timestamp,agent,action,status,message";

    private CsvAuditExporter() {}

    static byte[] export(List<AuditRecord> records) {
        var sb = new StringBuilder(HEADER).append("\r\n");
        for (AuditRecord record : records) {
            sb.append(escape(record.timestamp() != null ? record.timestamp().toString() : "")).append(',')
              .append(escape(record.agentId())).append(',')
              .append(escape(record.action())).append(',')
              .append(escape(record.status())).append(',')
              .append(escape(record.message())).append("\r\n");
        }
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    static String escape(String value) {
        if (value == null) return "";
        boolean quote = value.indexOf(',') >= 0 || value.indexOf('"') >= 0
                || value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0;
        if (!quote) return value;
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }
}
