package com.calibration.dcm.exception;

/**
 * A token in a numeric field (WERT, ST/X, ST/Y, block dimensions) is not a number.
 */
public class NotNumericException extends DcmParseException {

    private static final long serialVersionUID = 1L;

    private final String token;

    public NotNumericException(String token) {
        this(token, 0);
    }

    public NotNumericException(String token, int lineNumber) {
        super("Cannot convert '" + token + "' from string to number", lineNumber);
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}
