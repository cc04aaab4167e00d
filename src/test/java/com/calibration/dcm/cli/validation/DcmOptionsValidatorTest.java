package com.calibration.dcm.cli.validation;

import com.calibration.dcm.cli.exception.OptionsValidationException;
import com.calibration.dcm.cli.model.DcmOptions;
import com.calibration.dcm.cli.model.ValidatedDcmOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DcmOptionsValidator.
 */
class DcmOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final DcmOptionsValidator validator = new DcmOptionsValidator();

    @Test
    void testValidOptionsBuildConfig() throws IOException {
        Path input = Files.writeString(tempDir.resolve("in.DCM"), "KONSERVIERUNG_FORMAT 2.0\n");

        ValidatedDcmOptions validated = validator.validate(options(input.toString(),
                "--encoding", "ISO-8859-1", "--values-per-line", "4", "--preserve-order"));

        assertThat(validated.getInput()).isEqualTo(input.toAbsolutePath().normalize());
        assertThat(validated.getOutput()).isNull();
        assertThat(validated.getConfig().getCharset()).isEqualTo(StandardCharsets.ISO_8859_1);
        assertThat(validated.getConfig().getValuesPerLine()).isEqualTo(4);
        assertThat(validated.getConfig().isPreserveOrder()).isTrue();
    }

    @Test
    void testCollectsAllErrors() {
        OptionsValidationException e = catchThrowableOfType(() -> validator.validate(options(
                tempDir.resolve("missing.txt").toString(),
                "--output", "out.txt", "--encoding", "no-such-charset", "--values-per-line", "0")),
                OptionsValidationException.class);

        assertThat(e.getErrors()).hasSize(5);
        assertThat(e.getErrors()).anyMatch(err -> err.startsWith("Input file must have the .dcm extension"));
        assertThat(e.getErrors()).anyMatch(err -> err.startsWith("Unsupported encoding"));
        assertThat(e.getErrors()).anyMatch(err -> err.startsWith("Values per line must be >= 1"));
    }

    private static DcmOptions options(String... args) {
        DcmOptions options = new DcmOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }
}
