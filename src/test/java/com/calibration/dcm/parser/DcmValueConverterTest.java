package com.calibration.dcm.parser;

import com.calibration.dcm.exception.NotNumericException;
import com.calibration.dcm.model.DcmValue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DcmValueConverter.
 */
class DcmValueConverterTest {

    @ParameterizedTest
    @CsvSource({
            "3, 3",
            "-42, -42",
            "+7, 7",
            "1e3, 1000",
            "0, 0"
    })
    void testIntegralLiteralsBecomeLong(String token, long expected) {
        Number value = DcmValueConverter.convertValue(token);

        assertThat(value).isInstanceOf(Long.class);
        assertThat(value.longValue()).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "3.0, 3.0",
            "-0.25, -0.25",
            ".5, 0.5",
            "5., 5.0",
            "1.5e2, 150.0",
            "2.5E-1, 0.25"
    })
    void testLiteralsWithDecimalPointBecomeDouble(String token, double expected) {
        Number value = DcmValueConverter.convertValue(token);

        assertThat(value).isInstanceOf(Double.class);
        assertThat(value.doubleValue()).isEqualTo(expected);
    }

    @Test
    void testNonIntegralExponentLiteralStaysDouble() {
        assertThat(DcmValueConverter.convertValue("15e-1")).isEqualTo(1.5);
    }

    @Test
    void testSpecialLiterals() {
        assertThat(DcmValueConverter.convertValue("nan")).isEqualTo(Double.NaN);
        assertThat(DcmValueConverter.convertValue("-inf")).isEqualTo(Double.NEGATIVE_INFINITY);
        assertThat(DcmValueConverter.convertValue("Infinity")).isEqualTo(Double.POSITIVE_INFINITY);
    }

    @ParameterizedTest
    @ValueSource(strings = { "abc", "1d", "0x1p3", "1_000", "", "1.2.3", "--1" })
    void testRejectsNonDecimalLiterals(String token) {
        assertThatThrownBy(() -> DcmValueConverter.convertValue(token))
                .isInstanceOf(NotNumericException.class);
    }

    @Test
    void testVariantFallsBackToText() {
        DcmValue numeric = DcmValueConverter.convertVariant("27.5");
        DcmValue text = DcmValueConverter.convertVariant(" \"ParameterB\" ");

        assertThat(numeric.isText()).isFalse();
        assertThat(numeric.getNumber()).isEqualTo(27.5);
        assertThat(text.isText()).isTrue();
        assertThat(text.getText()).isEqualTo("ParameterB");
    }

    @Test
    void testDimensionMustBeNonNegativeInteger() {
        assertThat(DcmValueConverter.convertDimension("4", 1)).isEqualTo(4);
        assertThatThrownBy(() -> DcmValueConverter.convertDimension("x", 7))
                .isInstanceOf(NotNumericException.class)
                .hasMessageContaining("Line 7");
        assertThatThrownBy(() -> DcmValueConverter.convertDimension("-1", 7))
                .isInstanceOf(NotNumericException.class);
    }

    @Test
    void testStripQuotes() {
        assertThat(DcmValueConverter.stripQuotes("  \"Sample text\"  ")).isEqualTo("Sample text");
        assertThat(DcmValueConverter.stripQuotes("bare")).isEqualTo("bare");
        assertThat(DcmValueConverter.stripQuotes("\"\"")).isEmpty();
    }
}
