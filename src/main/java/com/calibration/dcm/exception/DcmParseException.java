package com.calibration.dcm.exception;

/**
 * Fatal problem while reading a DCM file. Parsing stops at the first one and no
 * partial document is returned.
 */
public class DcmParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int lineNumber;

    public DcmParseException(String message, int lineNumber) {
        super(lineNumber > 0 ? "Line " + lineNumber + ": " + message : message);
        this.lineNumber = lineNumber;
    }

    public DcmParseException(String message, int lineNumber, Throwable cause) {
        super(lineNumber > 0 ? "Line " + lineNumber + ": " + message : message, cause);
        this.lineNumber = lineNumber;
    }

    /**
     * 1-based line of the offending input, or 0 when not tied to a line.
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
