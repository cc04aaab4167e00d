package com.calibration.dcm;

import com.calibration.dcm.cli.DcmCommand;
import picocli.CommandLine;

/**
 * Main entry point of the dcm-tool command line.
 * Reads a DCM calibration file, reports its contents and optionally writes it back in normalized form.
 */
public class DcmToolApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DcmCommand()).execute(args);
        System.exit(exitCode);
    }
}
