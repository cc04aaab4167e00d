package com.calibration.dcm.config;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import lombok.Builder;
import lombok.Value;

/**
 * Settings shared by the reader and the writer.
 */
@Value
@Builder(toBuilder = true)
public class DcmConfig {

    /**
     * Text encoding of DCM files.
     */
    @Builder.Default
    Charset charset = StandardCharsets.UTF_8;

    /**
     * Vectors longer than this are wrapped over several lines of the same keyword.
     */
    @Builder.Default
    int valuesPerLine = 6;

    /**
     * Write elements in document order instead of sorting them by function, description and name.
     */
    @Builder.Default
    boolean preserveOrder = false;

    public static DcmConfig defaults() {
        return DcmConfig.builder().build();
    }
}
