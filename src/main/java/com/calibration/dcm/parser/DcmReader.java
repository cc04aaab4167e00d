package com.calibration.dcm.parser;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calibration.dcm.config.DcmConfig;
import com.calibration.dcm.exception.MalformedHeaderException;
import com.calibration.dcm.model.DcmDiagnostics;
import com.calibration.dcm.model.DcmDocument;
import com.calibration.dcm.model.DcmElement;
import com.calibration.dcm.model.DcmFunction;
import com.calibration.dcm.model.ElementKind;

/**
 * Reads DCM text into a {@link DcmDocument}.
 *
 * Reading only:
 * - Collects the header comments and checks the format directive
 * - Reads the FUNKTIONEN list
 * - Hands every element block to a {@link BlockParser}
 * - Reports recoverable problems as diagnostics
 *
 * Instances keep only their configuration and can be reused.
 */
public class DcmReader {
    private static final Logger log = LoggerFactory.getLogger(DcmReader.class);

    static final String FORMAT_KEYWORD = "KONSERVIERUNG_FORMAT";
    static final String FUNCTIONS_KEYWORD = "FUNKTIONEN";

    private static final Pattern FORMAT_PATTERN = Pattern.compile(FORMAT_KEYWORD + "\\s+(\\d+\\.\\d+)");
    private static final Pattern FUNCTION_PATTERN = Pattern.compile(
            "FKT\\s+(\\S+)(?:\\s+\"(.*?)\"(?:\\s+\"(.*?)\")?)?");

    private final DcmConfig config;

    public DcmReader() {
        this(DcmConfig.defaults());
    }

    public DcmReader(DcmConfig config) {
        this.config = config;
    }

    public DcmDocument read(Path path) throws IOException {
        return read(path, config.getCharset());
    }

    public DcmDocument read(Path path, Charset charset) throws IOException {
        log.debug("Reading {} as {}", path, charset);
        try (BufferedReader reader = Files.newBufferedReader(path, charset)) {
            return read(reader);
        }
    }

    /**
     * Reads from an open reader. The reader is not closed; I/O failures surface as
     * {@link java.io.UncheckedIOException}.
     */
    public DcmDocument read(Reader reader) {
        BufferedReader buffered = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        return new DocumentReading(new LineCursor(buffered)).run();
    }

    public DcmDocument parse(String content) {
        return read(new StringReader(content));
    }

    public DcmDocument parse(List<String> lines) {
        return parse(String.join("\n", lines));
    }

    /**
     * State of one read call.
     */
    private static final class DocumentReading {
        private final LineCursor cursor;
        private final DcmDiagnostics diagnostics = new DcmDiagnostics();
        private final DcmDocument document = new DcmDocument();
        private final BlockParser blockParser;

        DocumentReading(LineCursor cursor) {
            this.cursor = cursor;
            this.blockParser = new BlockParser(cursor, diagnostics);
        }

        DcmDocument run() {
            String line = readHeader();
            parseFormat(line);

            while ((line = cursor.next()) != null) {
                if (line.isEmpty() || BlockParser.isComment(line)) {
                    continue;
                }
                String keyword = line.split("\\s+", 2)[0];
                if (FUNCTIONS_KEYWORD.equals(keyword)) {
                    parseFunctions();
                    continue;
                }
                Optional<ElementKind> kind = ElementKind.fromKeyword(keyword);
                if (kind.isPresent()) {
                    DcmElement element = blockParser.parse(kind.get(), line);
                    document.addElement(element);
                } else {
                    warn("Unknown line: " + line);
                }
            }

            document.setDiagnostics(diagnostics);
            log.debug("Read {} functions and {} elements with {} warnings",
                    document.getFunctions().size(), document.getElements().size(), diagnostics.getWarnings().size());
            return document;
        }

        /**
         * Collects leading comment lines and returns the first significant line, or null.
         */
        private String readHeader() {
            StringBuilder header = new StringBuilder();
            String line;
            while ((line = cursor.next()) != null) {
                if (line.isEmpty()) {
                    continue;
                }
                if (!BlockParser.isComment(line)) {
                    break;
                }
                header.append(line.substring(1).strip()).append('\n');
            }
            document.setHeader(header.toString());
            return line;
        }

        private void parseFormat(String line) {
            if (line == null) {
                throw new MalformedHeaderException("end of input", cursor.getLineNumber());
            }
            Matcher matcher = FORMAT_PATTERN.matcher(line);
            if (!matcher.matches()) {
                throw new MalformedHeaderException(line, cursor.getLineNumber());
            }
            document.setFormatVersion(matcher.group(1));
        }

        private void parseFunctions() {
            String line;
            while (!BlockParser.END.equals(line = cursor.nextInBlock(FUNCTIONS_KEYWORD))) {
                if (line.isEmpty() || BlockParser.isComment(line)) {
                    continue;
                }
                Matcher matcher = FUNCTION_PATTERN.matcher(line);
                if (!matcher.matches()) {
                    warn("Malformed function entry: " + line);
                    continue;
                }
                document.addFunction(new DcmFunction(matcher.group(1), matcher.group(2), matcher.group(3)));
            }
        }

        private void warn(String message) {
            log.warn("Line {}: {}", cursor.getLineNumber(), message);
            diagnostics.addWarning(cursor.getLineNumber(), message);
        }
    }
}
