package com.calibration.dcm.exception;

/**
 * A WERT or TEXT row inside a map block appeared before any ST/Y, so it has no row key.
 */
public class ValueBeforeCoordinateException extends DcmParseException {

    private static final long serialVersionUID = 1L;

    public ValueBeforeCoordinateException(String elementName, int lineNumber) {
        super("Values before ST/Y in " + elementName, lineNumber);
    }
}
