package com.calibration.dcm.parser;

import java.util.ArrayList;
import java.util.List;

import com.calibration.dcm.parser.DcmToken.TokenType;

/**
 * Splits one DCM line into whitespace separated tokens. A double-quoted run is a
 * single token even when it contains blanks; an unterminated quote runs to the end
 * of the line.
 */
public class DcmTokenizer {

    private final String source;
    private int pos = 0;

    public DcmTokenizer(String source) {
        this.source = source;
    }

    public static List<DcmToken> tokenize(String line) {
        return new DcmTokenizer(line).tokenize();
    }

    public List<DcmToken> tokenize() {
        List<DcmToken> tokens = new ArrayList<>();

        while (pos < source.length()) {
            skipWhitespace();

            if (pos >= source.length()) {
                break;
            }

            tokens.add(nextToken());
        }

        return tokens;
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private DcmToken nextToken() {
        if (source.charAt(pos) == '"') {
            return readStringLiteral();
        }
        return readWord();
    }

    private DcmToken readStringLiteral() {
        StringBuilder sb = new StringBuilder();
        pos++; // Skip opening quote

        while (pos < source.length()) {
            char c = source.charAt(pos);
            pos++;
            if (c == '"') {
                break;
            }
            sb.append(c);
        }

        return new DcmToken(TokenType.STRING_LITERAL, sb.toString());
    }

    private DcmToken readWord() {
        int start = pos;
        while (pos < source.length() && !Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
        return new DcmToken(TokenType.WORD, source.substring(start, pos));
    }
}
