package com.calibration.dcm.writer;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calibration.dcm.config.DcmConfig;
import com.calibration.dcm.model.DcmDocument;
import com.calibration.dcm.model.DcmElement;
import com.calibration.dcm.model.DcmFunction;
import com.calibration.dcm.util.FileWriteUtil;

/**
 * Writes a {@link DcmDocument} back to DCM text.
 *
 * Output is deterministic: functions are sorted by name, version and description;
 * elements by function, description and name unless {@link DcmConfig#isPreserveOrder()}
 * keeps document order.
 */
public class DcmWriter {
    private static final Logger log = LoggerFactory.getLogger(DcmWriter.class);

    static final Comparator<DcmFunction> FUNCTION_ORDER = Comparator
            .comparing((DcmFunction f) -> nullToEmpty(f.getName()))
            .thenComparing(f -> nullToEmpty(f.getVersion()))
            .thenComparing(f -> nullToEmpty(f.getDescription()));

    static final Comparator<DcmElement> ELEMENT_ORDER = Comparator
            .comparing((DcmElement e) -> nullToEmpty(e.getFunction()))
            .thenComparing(e -> nullToEmpty(e.getDescription()))
            .thenComparing(e -> nullToEmpty(e.getName()));

    private final DcmConfig config;

    public DcmWriter() {
        this(DcmConfig.defaults());
    }

    public DcmWriter(DcmConfig config) {
        if (config.getValuesPerLine() < 1) {
            throw new IllegalArgumentException("valuesPerLine must be positive: " + config.getValuesPerLine());
        }
        this.config = config;
    }

    /**
     * Writes the document to a file, creating parent directories if needed.
     */
    public void write(DcmDocument document, Path path) throws IOException {
        FileWriteUtil.safeWriteString(path, toDcmString(document), config.getCharset());
        log.debug("Wrote {} elements to {}", document.getElements().size(), path);
    }

    /**
     * Writes the document to an open writer. The writer is flushed but not closed.
     */
    public void write(DcmDocument document, Writer writer) throws IOException {
        writer.write(toDcmString(document));
        writer.flush();
    }

    public String toDcmString(DcmDocument document) {
        Objects.requireNonNull(document, "document");
        StringBuilder out = new StringBuilder();

        writeHeader(document, out);
        out.append("KONSERVIERUNG_FORMAT ").append(document.getFormatVersion()).append(DcmElementFormatter.NEWLINE)
                .append(DcmElementFormatter.NEWLINE);
        writeFunctions(document.getFunctions(), out);

        DcmElementFormatter formatter = new DcmElementFormatter(out, config.getValuesPerLine());
        for (DcmElement element : orderedElements(document)) {
            formatter.format(element);
            out.append(DcmElementFormatter.NEWLINE);
        }
        return out.toString();
    }

    private List<DcmElement> orderedElements(DcmDocument document) {
        if (config.isPreserveOrder()) {
            return document.getElements();
        }
        return document.getElements().stream().sorted(ELEMENT_ORDER).toList();
    }

    private void writeHeader(DcmDocument document, StringBuilder out) {
        String header = document.getHeader();
        if (header.isEmpty()) {
            return;
        }
        String body = header.endsWith("\n") ? header.substring(0, header.length() - 1) : header;
        for (String line : body.split("\n", -1)) {
            out.append(line.isEmpty() ? "*" : "* " + line).append(DcmElementFormatter.NEWLINE);
        }
        out.append(DcmElementFormatter.NEWLINE);
    }

    private void writeFunctions(List<DcmFunction> functions, StringBuilder out) {
        if (functions.isEmpty()) {
            return;
        }
        out.append("FUNKTIONEN").append(DcmElementFormatter.NEWLINE);
        functions.stream().sorted(FUNCTION_ORDER).forEach(f -> {
            out.append("  FKT ").append(f.getName());
            if (f.getVersion() != null || f.getDescription() != null) {
                out.append(' ').append(DcmElementFormatter.quote(nullToEmpty(f.getVersion())));
            }
            if (f.getDescription() != null) {
                out.append(' ').append(DcmElementFormatter.quote(f.getDescription()));
            }
            out.append(DcmElementFormatter.NEWLINE);
        });
        out.append("END").append(DcmElementFormatter.NEWLINE).append(DcmElementFormatter.NEWLINE);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
