package com.maestro.core.audit;

import com.maestro.core.model.AuditRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvAuditExporterTest {

    @Test
    @DisplayName("plain values are written unquoted")
    void plainValues() {
        assertEquals("writer", CsvAuditExporter.escape("writer"));
        assertEquals("", CsvAuditExporter.escape(null));
    }

    @Test
    @DisplayName("commas, quotes and line breaks force quoting")
    void quoting() {
        assertEquals("\"a, b\"", CsvAuditExporter.escape("a, b"));
        assertEquals("\"say \"\"hi\"\"\"", CsvAuditExporter.escape("say \"hi\""));
        assertEquals("\"line1\nline2\"", CsvAuditExporter.escape("line1\nline2"));
    }

    @Test
    @DisplayName("agent-less records leave the agent column empty")
    void emptyAgent() {
        var record = new AuditRecord("AUD-1", 1, "E1", null, null, "execution_started", "running",
                "Execution started", Instant.parse("2026-01-01T00:00:00Z"));

        String csv = new String(CsvAuditExporter.export(List.of(record)), StandardCharsets.UTF_8);

        assertEquals(CsvAuditExporter.HEADER + "\r\n"
                + "2026-01-01T00:00:00Z,,execution_started,running,Execution started\r\n", csv);
    }
}
