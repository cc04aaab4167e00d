package com.calibration.dcm.exception;

/**
 * Input ended inside a block, before its END line.
 */
public class UnexpectedEndOfInputException extends DcmParseException {

    private static final long serialVersionUID = 1L;

    public UnexpectedEndOfInputException(String blockName, int lineNumber) {
        super("Unexpected end of input, missing END for " + blockName, lineNumber);
    }
}
