package com.calibration.dcm.model;

import java.util.Objects;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One cell of a value row: either a number (from WERT) or a text (from TEXT).
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DcmValue {
    Number number;
    String text;

    public static DcmValue of(Number number) {
        return new DcmValue(Objects.requireNonNull(number, "number"), null);
    }

    public static DcmValue ofText(String text) {
        return new DcmValue(null, Objects.requireNonNull(text, "text"));
    }

    public boolean isText() {
        return text != null;
    }

    @Override
    public String toString() {
        return isText() ? text : number.toString();
    }
}
