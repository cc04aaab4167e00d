package com.calibration.dcm.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options of dcm-tool. No validation, no execution logic, no printing.
 */
@Getter
public class DcmOptions {

	@Parameters(index = "0", paramLabel = "<file.dcm>", description = "DCM file to read")
	private Path input;

	@Option(names = { "--encoding", "-e" }, defaultValue = "UTF-8", description = "Character encoding of input and output (default: UTF-8)")
	private String encoding;

	@Option(names = { "--output", "-o" }, description = "Write the document back to this .dcm file")
	private Path output;

	@Option(names = { "--preserve-order" }, description = "Keep document order instead of sorting elements on output")
	private boolean preserveOrder;

	@Option(names = { "--values-per-line" }, defaultValue = "6", description = "Values per WERT/ST line on output (default: 6)")
	private int valuesPerLine;

	@Option(names = { "--strict" }, description = "Exit with code 2 when warnings were reported")
	private boolean strict;
}
