package com.calibration.dcm.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token of one DCM line.
 */
@Data
@AllArgsConstructor
public class DcmToken {
    private TokenType type;
    private String value;

    public enum TokenType {
        /**
         * Bare run of non-blank characters.
         */
        WORD,

        /**
         * Double-quoted text; the value excludes the quotes.
         */
        STRING_LITERAL
    }

    public boolean isQuoted() {
        return type == TokenType.STRING_LITERAL;
    }
}
