package com.calibration.dcm.parser;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;

import com.calibration.dcm.exception.UnexpectedEndOfInputException;

/**
 * Forward-only cursor over the lines of a DCM input, shared by the document reader
 * and the block parser. Lines are returned trimmed.
 */
public class LineCursor {

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final BufferedReader reader;
    private int lineNumber = 0;

    public LineCursor(BufferedReader reader) {
        this.reader = reader;
    }

    /**
     * @return the next trimmed line, or null at end of input
     */
    public String next() {
        try {
            String line = reader.readLine();
            if (line == null) {
                return null;
            }
            lineNumber++;
            if (lineNumber == 1 && line.startsWith(BYTE_ORDER_MARK)) {
                line = line.substring(1);
            }
            return line.strip();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read line " + (lineNumber + 1), e);
        }
    }

    /**
     * Next line inside a block; running out of input there is fatal.
     */
    public String nextInBlock(String blockName) {
        String line = next();
        if (line == null) {
            throw new UnexpectedEndOfInputException(blockName, lineNumber);
        }
        return line;
    }

    /**
     * 1-based number of the line last returned.
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
