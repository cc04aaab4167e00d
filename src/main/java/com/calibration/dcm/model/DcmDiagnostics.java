package com.calibration.dcm.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Recoverable problems collected while reading one document.
 *
 * Pure structure only: no logging, no IO.
 */
@Getter
public class DcmDiagnostics {
    private final List<String> warnings = new ArrayList<>();

    public void addWarning(int lineNumber, String message) {
        warnings.add(prefix(lineNumber) + message);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    private static String prefix(int lineNumber) {
        return lineNumber > 0 ? "Line " + lineNumber + ": " : "";
    }
}
