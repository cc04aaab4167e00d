package com.calibration.dcm.cli.model;

import java.nio.file.Path;

import com.calibration.dcm.config.DcmConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps DcmCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedDcmOptions {
	Path input;
	Path output;
	DcmConfig config;
}
