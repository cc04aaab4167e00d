package com.calibration.dcm.parser;

import java.util.regex.Pattern;

import com.calibration.dcm.exception.NotNumericException;
import com.calibration.dcm.model.DcmValue;

import lombok.experimental.UtilityClass;

/**
 * Converts DCM text tokens to values.
 *
 * Numbers keep the integer/floating point distinction of their literal: a token
 * without a decimal point whose value is integral becomes a {@link Long}, every
 * other number a {@link Double}. The distinction shows in written output, where
 * integers print without a trailing ".0".
 */
@UtilityClass
public class DcmValueConverter {

    private static final Pattern DECIMAL_LITERAL = Pattern.compile(
            "[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private static final Pattern SPECIAL_LITERAL = Pattern.compile(
            "[+-]?(?:nan|inf|infinity)", Pattern.CASE_INSENSITIVE);

    private static final double LONG_LIMIT = 0x1p63;

    /**
     * @throws NotNumericException if the token is not a decimal floating point literal
     */
    public Number convertValue(String token) {
        if (token == null) {
            throw new NotNumericException("null");
        }
        String trimmed = token.trim();
        if (SPECIAL_LITERAL.matcher(trimmed).matches()) {
            return parseSpecial(trimmed);
        }
        if (!DECIMAL_LITERAL.matcher(trimmed).matches()) {
            throw new NotNumericException(token);
        }
        double value = Double.parseDouble(trimmed);
        if (trimmed.indexOf('.') < 0 && isIntegral(value)) {
            return (long) value;
        }
        return value;
    }

    /**
     * Right-hand side of a VAR line: a number when possible, otherwise the text
     * without surrounding blanks and double quotes.
     */
    public DcmValue convertVariant(String token) {
        try {
            return DcmValue.of(convertValue(token));
        } catch (NotNumericException e) {
            return DcmValue.ofText(stripQuotes(token));
        }
    }

    /**
     * Parses a block dimension, which must be a non-negative integer.
     */
    public int convertDimension(String token, int lineNumber) {
        try {
            int dimension = Integer.parseInt(token.trim());
            if (dimension < 0) {
                throw new NotNumericException(token, lineNumber);
            }
            return dimension;
        } catch (NumberFormatException e) {
            throw new NotNumericException(token, lineNumber);
        }
    }

    /**
     * Removes surrounding blanks and double quotes.
     */
    public String stripQuotes(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && isQuoteOrBlank(text.charAt(start))) {
            start++;
        }
        while (end > start && isQuoteOrBlank(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    private boolean isQuoteOrBlank(char c) {
        return c == '"' || Character.isWhitespace(c);
    }

    private boolean isIntegral(double value) {
        return !Double.isInfinite(value) && value == Math.rint(value)
                && value >= -LONG_LIMIT && value < LONG_LIMIT;
    }

    private Double parseSpecial(String token) {
        String lower = token.toLowerCase();
        if (lower.endsWith("nan")) {
            return Double.NaN;
        }
        return lower.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    }
}
