package com.calibration.dcm.cli.output;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calibration.dcm.cli.model.ValidatedDcmOptions;
import com.calibration.dcm.model.DcmDocument;
import com.calibration.dcm.model.ElementKind;

/**
 * Responsible only for printing CLI output of dcm-tool.
 * No validation, no execution.
 */
public class DcmSummaryPrinter {

	private static final Logger log = LoggerFactory.getLogger(DcmSummaryPrinter.class);

	public void printBanner(ValidatedDcmOptions v) {
		log.info("=================================================");
		log.info("DCM Tool");
		log.info("=================================================");
		log.info("Input: {}", v.getInput());
		log.info("Encoding: {}", v.getConfig().getCharset().name());
		log.info("Output: {}", v.getOutput() != null ? v.getOutput() : "None");
		log.info("=================================================");
	}

	public void printSummary(DcmDocument document) {
		log.info("Format Version: {}", document.getFormatVersion());
		log.info("Functions: {}", document.getFunctions().size());
		for (ElementKind kind : ElementKind.values()) {
			log.info("{}: {}", kind.getKeyword(), document.getElements(kind).size());
		}
		log.info("Total Elements: {}", document.getElements().size());

		if (document.getDiagnostics().hasWarnings()) {
			log.info("");
			log.info("Warnings ({}):", document.getDiagnostics().getWarnings().size());
			document.getDiagnostics().getWarnings().forEach(w -> log.info("  {}", w));
		}
	}

	public void printWritten(Path output) {
		log.info("");
		log.info("Written: {}", output);
	}
}
