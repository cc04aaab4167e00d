package com.calibration.dcm.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calibration.dcm.cli.exception.OptionsValidationException;
import com.calibration.dcm.cli.model.DcmOptions;
import com.calibration.dcm.cli.model.ValidatedDcmOptions;
import com.calibration.dcm.cli.output.DcmSummaryPrinter;
import com.calibration.dcm.cli.validation.DcmOptionsValidator;
import com.calibration.dcm.exception.DcmParseException;
import com.calibration.dcm.model.DcmDocument;
import com.calibration.dcm.parser.DcmReader;
import com.calibration.dcm.writer.DcmWriter;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Reads a DCM file, prints a per-kind summary and its warnings, and optionally writes it back.
 */
@Command(name = "dcm-tool", mixinStandardHelpOptions = true, version = "dcm-tool 1.0.0",
		description = "Reads a DCM calibration file, reports its contents and optionally rewrites it in normalized form.")
public class DcmCommand implements Callable<Integer> {

	private static final Logger log = LoggerFactory.getLogger(DcmCommand.class);

	static final int EXIT_OK = 0;
	static final int EXIT_FAILURE = 1;
	static final int EXIT_WARNINGS = 2;

	@Mixin
	private DcmOptions options = new DcmOptions();

	private final DcmOptionsValidator validator = new DcmOptionsValidator();
	private final DcmSummaryPrinter printer = new DcmSummaryPrinter();

	@Override
	public Integer call() {
		ValidatedDcmOptions validated;
		try {
			validated = validator.validate(options);
		} catch (OptionsValidationException e) {
			e.getErrors().forEach(err -> log.error("{}", err));
			return EXIT_FAILURE;
		}

		printer.printBanner(validated);

		try {
			DcmDocument document = new DcmReader(validated.getConfig()).read(validated.getInput());
			printer.printSummary(document);

			if (validated.getOutput() != null) {
				new DcmWriter(validated.getConfig()).write(document, validated.getOutput());
				printer.printWritten(validated.getOutput());
			}

			if (options.isStrict() && document.getDiagnostics().hasWarnings()) {
				log.error("{} warning(s) reported in strict mode", document.getDiagnostics().getWarnings().size());
				return EXIT_WARNINGS;
			}
			return EXIT_OK;
		} catch (DcmParseException e) {
			log.error("Failed to parse {}: {}", validated.getInput(), e.getMessage());
			return EXIT_FAILURE;
		} catch (Exception e) {
			log.error("dcm-tool failed with exception", e);
			return EXIT_FAILURE;
		}
	}
}
