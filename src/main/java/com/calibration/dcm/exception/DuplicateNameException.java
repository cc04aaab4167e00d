package com.calibration.dcm.exception;

/**
 * Two elements of one document share a name.
 */
public class DuplicateNameException extends DcmParseException {

    private static final long serialVersionUID = 1L;

    private final String elementName;

    public DuplicateNameException(String elementName, int lineNumber) {
        super("Duplicate element name: " + elementName, lineNumber);
        this.elementName = elementName;
    }

    public String getElementName() {
        return elementName;
    }
}
