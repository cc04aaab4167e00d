package com.calibration.dcm.writer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.calibration.dcm.model.CharacteristicLine;
import com.calibration.dcm.model.CharacteristicMap;
import com.calibration.dcm.model.DcmElement;
import com.calibration.dcm.model.DcmElementVisitor;
import com.calibration.dcm.model.DcmValue;
import com.calibration.dcm.model.Distribution;
import com.calibration.dcm.model.ParameterBlock;
import com.calibration.dcm.model.ScalarParameter;
import com.calibration.dcm.parser.CommentDirective;

/**
 * Renders one element block, from its opening keyword line to END, into a shared buffer.
 */
class DcmElementFormatter implements DcmElementVisitor {

    static final String NEWLINE = "\n";

    private static final String FIELD_FORMAT = "  %-13s %s";

    private final StringBuilder out;
    private final int valuesPerLine;

    DcmElementFormatter(StringBuilder out, int valuesPerLine) {
        this.out = out;
        this.valuesPerLine = valuesPerLine;
    }

    void format(DcmElement element) {
        element.accept(this);
    }

    @Override
    public void visit(ScalarParameter parameter) {
        writeOpening(parameter.getKind().getKeyword() + " " + parameter.getName());
        writeAttributes(parameter);
        if (parameter.isTextValued()) {
            field("TEXT", quote(parameter.getText()));
        } else if (parameter.getValue() != null) {
            field("WERT", formatNumber(parameter.getValue()));
        }
        writeClosing(parameter);
    }

    @Override
    public void visit(ParameterBlock block) {
        String opening = block.getKind().getKeyword() + " " + block.getName() + " " + block.getXDimension();
        if (block.getYDimension() > 1) {
            opening += " @ " + block.getYDimension();
        }
        writeOpening(opening);
        writeAttributes(block);
        for (List<DcmValue> row : block.getValues()) {
            writeValueRow(row);
        }
        writeClosing(block);
    }

    @Override
    public void visit(CharacteristicLine line) {
        writeOpening(line.getKind().getKeyword() + " " + line.getName() + " " + line.getXDimension());
        writeAttributes(line);
        writeNumbers("ST/X", line.getXCoordinates());
        writeValueRow(new ArrayList<>(line.getValues().values()));
        writeClosing(line);
    }

    @Override
    public void visit(CharacteristicMap map) {
        writeOpening(map.getKind().getKeyword() + " " + map.getName() + " "
                + map.getXDimension() + " " + map.getYDimension());
        writeAttributes(map);
        writeNumbers("ST/X", map.getXCoordinates());
        for (Map.Entry<Number, Map<Number, DcmValue>> row : map.getValues().entrySet()) {
            field("ST/Y", formatNumber(row.getKey()));
            writeValueRow(new ArrayList<>(row.getValue().values()));
        }
        writeClosing(map);
    }

    @Override
    public void visit(Distribution distribution) {
        writeOpening(distribution.getKind().getKeyword() + " " + distribution.getName() + " "
                + distribution.getXDimension());
        writeAttributes(distribution);
        writeNumbers("ST/X", distribution.getValues());
        writeClosing(distribution);
    }

    private void writeOpening(String opening) {
        out.append(opening).append(NEWLINE);
    }

    private void writeAttributes(DcmElement element) {
        if (element.getComment() != null) {
            for (String line : element.getComment().split("\n", -1)) {
                out.append(line.isEmpty() ? "*" : "* " + line).append(NEWLINE);
            }
        }
        for (CommentDirective directive : CommentDirective.values()) {
            String argument = directive.valueOf(element);
            if (argument != null) {
                out.append('*').append(directive.getKeyword()).append(' ').append(argument).append(NEWLINE);
            }
        }
        optionalField("LANGNAME", element.getDescription(), true);
        optionalField("FUNKTION", element.getFunction(), true);
        optionalField("DISPLAYNAME", element.getDisplayName(), false);
        optionalField("EINHEIT_X", element.getUnitsX(), true);
        optionalField("EINHEIT_Y", element.getUnitsY(), true);
        optionalField("EINHEIT_W", element.getUnitsValue(), true);
    }

    private void writeClosing(DcmElement element) {
        for (Map.Entry<String, DcmValue> variant : element.getVariants().entrySet()) {
            out.append("  VAR ").append(variant.getKey()).append('=')
                    .append(formatValue(variant.getValue())).append(NEWLINE);
        }
        out.append("END").append(NEWLINE);
    }

    private void optionalField(String keyword, String value, boolean quoted) {
        if (value != null) {
            field(keyword, quoted ? quote(value) : value);
        }
    }

    /**
     * WERT when every cell is numeric, TEXT otherwise.
     */
    private void writeValueRow(List<DcmValue> row) {
        boolean text = row.stream().anyMatch(DcmValue::isText);
        List<String> cells = row.stream()
                .map(v -> text ? quote(v.toString()) : formatNumber(v.getNumber()))
                .toList();
        writeChunked(text ? "TEXT" : "WERT", cells);
    }

    private void writeNumbers(String keyword, List<Number> numbers) {
        writeChunked(keyword, numbers.stream().map(DcmElementFormatter::formatNumber).toList());
    }

    private void writeChunked(String keyword, List<String> cells) {
        for (int start = 0; start < cells.size(); start += valuesPerLine) {
            List<String> chunk = cells.subList(start, Math.min(start + valuesPerLine, cells.size()));
            field(keyword, String.join(" ", chunk));
        }
    }

    private void field(String keyword, String value) {
        out.append(String.format(FIELD_FORMAT, keyword, value)).append(NEWLINE);
    }

    static String formatValue(DcmValue value) {
        return value.isText() ? quote(value.getText()) : formatNumber(value.getNumber());
    }

    /**
     * Integers print without a fraction, everything else in {@link Double#toString(double)} form.
     */
    static String formatNumber(Number number) {
        if (number instanceof Double || number instanceof Float) {
            return Double.toString(number.doubleValue());
        }
        return number.toString();
    }

    static String quote(String text) {
        return "\"" + text + "\"";
    }
}
