package com.calibration.dcm.cli.validation;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.calibration.dcm.cli.exception.OptionsValidationException;
import com.calibration.dcm.cli.model.DcmOptions;
import com.calibration.dcm.cli.model.ValidatedDcmOptions;
import com.calibration.dcm.config.DcmConfig;

public class DcmOptionsValidator {

	static final String DCM_EXTENSION = ".dcm";

	public ValidatedDcmOptions validate(DcmOptions o) {
		List<String> errors = new ArrayList<>();

		Path input = o.getInput();
		if (input == null) {
			errors.add("Input file is required.");
		} else {
			if (!hasDcmExtension(input)) {
				errors.add("Input file must have the .dcm extension: " + input);
			}
			if (!Files.isRegularFile(input)) {
				errors.add("Input file does not exist or is not a file: " + input);
			}
		}

		Path output = o.getOutput();
		if (output != null && !hasDcmExtension(output)) {
			errors.add("Output file must have the .dcm extension: " + output);
		}

		Charset charset = parseCharset(o.getEncoding(), errors);

		if (o.getValuesPerLine() < 1) {
			errors.add("Values per line must be >= 1. Got: " + o.getValuesPerLine());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		DcmConfig config = DcmConfig.builder()
				.charset(charset)
				.valuesPerLine(o.getValuesPerLine())
				.preserveOrder(o.isPreserveOrder())
				.build();
		return new ValidatedDcmOptions(input.toAbsolutePath().normalize(),
				output == null ? null : output.toAbsolutePath().normalize(), config);
	}

	private static boolean hasDcmExtension(Path p) {
		Path fileName = p.getFileName();
		return fileName != null && fileName.toString().toLowerCase(Locale.ROOT).endsWith(DCM_EXTENSION);
	}

	private static Charset parseCharset(String name, List<String> errors) {
		if (name == null || name.isBlank()) {
			errors.add("Encoding must not be blank.");
			return null;
		}
		try {
			return Charset.forName(name.trim());
		} catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
			errors.add("Unsupported encoding: " + name);
			return null;
		}
	}
}
