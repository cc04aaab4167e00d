package com.calibration.dcm.exception;

/**
 * The first significant line is not a valid {@code KONSERVIERUNG_FORMAT} directive.
 */
public class MalformedHeaderException extends DcmParseException {

    private static final long serialVersionUID = 1L;

    public MalformedHeaderException(String found, int lineNumber) {
        super("Expected KONSERVIERUNG_FORMAT <major>.<minor> as first entry but found: " + found, lineNumber);
    }
}
