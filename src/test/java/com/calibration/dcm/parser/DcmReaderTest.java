package com.calibration.dcm.parser;

import com.calibration.dcm.exception.DuplicateNameException;
import com.calibration.dcm.exception.MalformedHeaderException;
import com.calibration.dcm.exception.UnexpectedEndOfInputException;
import com.calibration.dcm.model.CharacteristicLine;
import com.calibration.dcm.model.CharacteristicMap;
import com.calibration.dcm.model.DcmDocument;
import com.calibration.dcm.model.DcmFunction;
import com.calibration.dcm.model.DcmValue;
import com.calibration.dcm.model.ElementKind;
import com.calibration.dcm.model.ParameterBlock;
import com.calibration.dcm.model.ScalarParameter;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DcmReader.
 */
class DcmReaderTest {

    private final DcmReader reader = new DcmReader();

    @Test
    void testHeaderCommentsAreAccumulated() {
        DcmDocument document = reader.parse("""
                * line1

                ! line2
                KONSERVIERUNG_FORMAT 2.0
                """);

        assertThat(document.getHeader()).isEqualTo("line1\nline2\n");
        assertThat(document.getFormatVersion()).isEqualTo("2.0");
        assertThat(document.getElements()).isEmpty();
    }

    @Test
    void testMissingFormatDirectiveIsFatal() {
        assertThatThrownBy(() -> reader.parse("""
                * header
                FESTWERT p
                  WERT 1
                END
                """))
                .isInstanceOf(MalformedHeaderException.class)
                .hasMessageContaining("Line 2");
    }

    @Test
    void testFormatDirectiveNeedsVersion() {
        assertThatThrownBy(() -> reader.parse("KONSERVIERUNG_FORMAT\n"))
                .isInstanceOf(MalformedHeaderException.class);
        assertThatThrownBy(() -> reader.parse(""))
                .isInstanceOf(MalformedHeaderException.class);
    }

    @Test
    void testFunctionsList() {
        DcmDocument document = reader.parse(List.of(
                "KONSERVIERUNG_FORMAT 2.0",
                "FUNKTIONEN",
                "  FKT Alpha \"1.0\" \"First function\"",
                "  FKT Beta \"2.1\"",
                "  FKT Gamma",
                "  broken entry",
                "END"));

        assertThat(document.getFunctions()).containsExactly(
                new DcmFunction("Alpha", "1.0", "First function"),
                new DcmFunction("Beta", "2.1", null),
                new DcmFunction("Gamma", null, null));
        assertThat(document.getDiagnostics().getWarnings()).hasSize(1);
        assertThat(document.getDiagnostics().getWarnings().get(0)).startsWith("Line 6:");
    }

    @Test
    void testBlockKeywordsMatchWholeTokens() {
        DcmDocument document = reader.parse("""
                KONSERVIERUNG_FORMAT 2.0
                FESTWERTEBLOCK block 2
                  WERT 1 2
                END
                FESTWERT value
                  WERT 3
                END
                """);

        assertThat(document.getParameterBlocks()).extracting(ParameterBlock::getName).containsExactly("block");
        assertThat(document.getParameters()).extracting(ScalarParameter::getName).containsExactly("value");
    }

    @Test
    void testUnknownTopLevelLineWarns() {
        DcmDocument document = reader.parse("""
                KONSERVIERUNG_FORMAT 2.0
                SOMETHING else
                * a later comment is ignored
                FESTWERT p
                  WERT 1
                END
                """);

        assertThat(document.getElements()).hasSize(1);
        assertThat(document.getDiagnostics().getWarnings()).containsExactly("Line 2: Unknown line: SOMETHING else");
    }

    @Test
    void testDuplicateNameIsFatal() {
        assertThatThrownBy(() -> reader.parse("""
                KONSERVIERUNG_FORMAT 2.0
                FESTWERT p
                  WERT 1
                END
                FESTWERTEBLOCK p 1
                  WERT 2
                END
                """))
                .isInstanceOf(DuplicateNameException.class)
                .hasMessageContaining("Line 5");
    }

    @Test
    void testTruncatedBlockIsFatal() {
        assertThatThrownBy(() -> reader.parse("""
                KONSERVIERUNG_FORMAT 2.0
                KENNLINIE l 2
                  ST/X 1 2
                """))
                .isInstanceOf(UnexpectedEndOfInputException.class);
    }

    @Test
    void testByteOrderMarkIsIgnored() {
        DcmDocument document = reader.parse("\uFEFFKONSERVIERUNG_FORMAT 2.0\n");

        assertThat(document.getFormatVersion()).isEqualTo("2.0");
    }

    @Test
    void testReadSampleFile() throws IOException, URISyntaxException {
        DcmDocument document = reader.read(samplePath());

        assertThat(document.getHeader()).isEqualTo("Sample calibration data\nGenerated for reader tests\n");
        assertThat(document.getFunctions()).hasSize(9);
        assertThat(document.getParameters()).hasSize(2);
        assertThat(document.getParameterBlocks()).hasSize(2);
        assertThat(document.getCharacteristicLines()).hasSize(1);
        assertThat(document.getFixedCharacteristicLines()).hasSize(1);
        assertThat(document.getGroupCharacteristicLines()).hasSize(1);
        assertThat(document.getCharacteristicMaps()).hasSize(1);
        assertThat(document.getFixedCharacteristicMaps()).hasSize(1);
        assertThat(document.getGroupCharacteristicMaps()).hasSize(1);
        assertThat(document.getDistributions()).hasSize(1);
        assertThat(document.getDiagnostics().hasWarnings()).isFalse();
    }

    @Test
    void testSampleValueParameter() throws IOException, URISyntaxException {
        DcmDocument document = reader.read(samplePath());
        ScalarParameter valueParameter = document.getParameters().get(0);

        assertThat(valueParameter.getName()).isEqualTo("valueParameter");
        assertThat(valueParameter.getDescription()).isEqualTo("Sample value parameter");
        assertThat(valueParameter.getFunction()).isEqualTo("ParameterFunction");
        assertThat(valueParameter.getUnitsValue()).isEqualTo("°C");
        assertThat(valueParameter.getValue()).isEqualTo(25.0);
        assertThat(valueParameter.getVariants().get("VariantA")).isEqualTo(DcmValue.of(27.5));
        assertThat(valueParameter.getText()).isNull();
        assertThat(valueParameter.getComment()).isEqualTo("Sample comment\nSecond comment line");
        assertThat(valueParameter.getSourceLine()).isEqualTo(18);

        ScalarParameter textParameter = document.getParameters().get(1);
        assertThat(textParameter.getText()).isEqualTo("ParameterA");
        assertThat(textParameter.getValue()).isNull();
        assertThat(textParameter.getVariants().get("VariantA")).isEqualTo(DcmValue.ofText("ParameterB"));
    }

    @Test
    void testSampleLinesAndMaps() throws IOException, URISyntaxException {
        DcmDocument document = reader.read(samplePath());

        CharacteristicLine line = document.getCharacteristicLines().get(0);
        assertThat(line.getXDimension()).isEqualTo(8);
        assertThat(line.getValues()).hasSize(8);
        assertThat(line.valueAt(7.0)).contains(DcmValue.of(340.0));
        assertThat(line.getXMapping()).isEqualTo("DISTRIBUTION X");
        assertThat(line.getUnitsX()).isEqualTo("s");

        CharacteristicMap map = document.getGroupCharacteristicMaps().get(0);
        assertThat(map.getXMapping()).isEqualTo("DISTRIBUTION X");
        assertThat(map.getYMapping()).isEqualTo("DISTRIBUTION Y");
        assertThat(map.valueAt(2L, 1L)).contains(DcmValue.of(3.5));

        assertThat(document.findElement("distribution"))
                .hasValueSatisfying(e -> assertThat(e.getKind()).isEqualTo(ElementKind.DISTRIBUTION));
    }

    private static Path samplePath() throws URISyntaxException {
        return Path.of(DcmReaderTest.class.getResource("/sample.dcm").toURI());
    }
}
