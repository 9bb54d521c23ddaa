package com.maestro.core.model;

import java.util.List;

/**
 * Thrown for audit export formats that are unknown or declared but not implemented (PDF).
 * Callers treat this as an expected result, not a crash.
 */
public class UnsupportedExportFormatException extends MaestroException {

    private final boolean declared;
    private final List<String> supportedFormats;

    public UnsupportedExportFormatException(String message, boolean declared, List<String> supportedFormats) {
        super(message);
        this.declared = declared;
        this.supportedFormats = List.copyOf(supportedFormats);
    }

    /** True when the format is known but not implemented yet. */
    public boolean isDeclared() {
        return declared;
    }

    public List<String> getSupportedFormats() {
        return supportedFormats;
    }
}
