package com.calibration.dcm.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calibration.dcm.exception.DcmParseException;
import com.calibration.dcm.exception.NotNumericException;
import com.calibration.dcm.exception.ValueBeforeCoordinateException;
import com.calibration.dcm.model.CharacteristicLine;
import com.calibration.dcm.model.CharacteristicMap;
import com.calibration.dcm.model.DcmDiagnostics;
import com.calibration.dcm.model.DcmElement;
import com.calibration.dcm.model.DcmValue;
import com.calibration.dcm.model.Distribution;
import com.calibration.dcm.model.ElementKind;
import com.calibration.dcm.model.ParameterBlock;
import com.calibration.dcm.model.ScalarParameter;

/**
 * Parser for one element block, from its opening keyword line to END.
 *
 * Body lines are dispatched on their first token through {@link BlockKeyword};
 * comment lines go through {@link CommentDirective}. Coordinates and values are
 * collected in a {@link BlockContent} and turned into the element payload when END
 * is reached, where dimension mismatches are reported as warnings.
 */
public class BlockParser {
    private static final Logger log = LoggerFactory.getLogger(BlockParser.class);

    static final String END = "END";
    static final String COMMENT_MARKERS = "!*.";

    private static final Pattern VARIANT_PATTERN = Pattern.compile("VAR\\s+(.*?)=(.*)");
    private static final String DIMENSION_SEPARATOR = "@";

    private final LineCursor cursor;
    private final DcmDiagnostics diagnostics;

    public BlockParser(LineCursor cursor, DcmDiagnostics diagnostics) {
        this.cursor = cursor;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses the block whose opening line was just read from the cursor.
     *
     * @param kind       kind selected by the opening keyword
     * @param headerLine the opening line, trimmed
     */
    public DcmElement parse(ElementKind kind, String headerLine) {
        int startLine = cursor.getLineNumber();
        BlockContent content = parseHeader(kind, DcmTokenizer.tokenize(headerLine), startLine);
        DcmElement element = content.getElement();
        element.setSourceLine(startLine);

        while (true) {
            String line = cursor.nextInBlock(element.getName());
            if (line.isEmpty()) {
                continue;
            }
            if (isComment(line)) {
                parseComment(element, line);
                continue;
            }

            List<DcmToken> tokens = DcmTokenizer.tokenize(line);
            String keyword = tokens.get(0).getValue();
            if (END.equals(keyword)) {
                break;
            }

            Optional<BlockKeyword> field = BlockKeyword.fromToken(keyword);
            if (field.isEmpty() || !field.get().isAllowedIn(kind.getShape())) {
                warn("Unknown field in " + kind.getKeyword() + " " + element.getName() + ": " + line);
                continue;
            }
            parseField(field.get(), content, line, tokens);
        }

        finish(content);
        log.debug("Parsed {} {} at line {}", kind.getKeyword(), element.getName(), startLine);
        return element;
    }

    static boolean isComment(String line) {
        return !line.isEmpty() && COMMENT_MARKERS.indexOf(line.charAt(0)) >= 0;
    }

    private BlockContent parseHeader(ElementKind kind, List<DcmToken> tokens, int lineNumber) {
        if (tokens.size() < 2) {
            throw new DcmParseException("Missing name in " + kind.getKeyword() + " header", lineNumber);
        }
        String name = tokens.get(1).getValue();
        List<String> dimensions = tokens.subList(2, tokens.size()).stream()
                .map(DcmToken::getValue)
                .filter(v -> !DIMENSION_SEPARATOR.equals(v))
                .toList();

        return switch (kind.getShape()) {
            case SCALAR -> new BlockContent(new ScalarParameter(name), 0, 0);
            case BLOCK -> {
                int x = dimension(kind, name, dimensions, 0, lineNumber);
                int y = dimensions.size() > 1 ? DcmValueConverter.convertDimension(dimensions.get(1), lineNumber) : 1;
                ParameterBlock block = new ParameterBlock(name);
                block.setXDimension(x);
                block.setYDimension(y);
                yield new BlockContent(block, x, y);
            }
            case LINE -> {
                int x = dimension(kind, name, dimensions, 0, lineNumber);
                CharacteristicLine line = new CharacteristicLine(kind, name);
                line.setXDimension(x);
                yield new BlockContent(line, x, 0);
            }
            case MAP -> {
                int x = dimension(kind, name, dimensions, 0, lineNumber);
                int y = dimension(kind, name, dimensions, 1, lineNumber);
                CharacteristicMap map = new CharacteristicMap(kind, name);
                map.setXDimension(x);
                map.setYDimension(y);
                yield new BlockContent(map, x, y);
            }
            case DISTRIBUTION -> {
                int x = dimension(kind, name, dimensions, 0, lineNumber);
                Distribution distribution = new Distribution(name);
                distribution.setXDimension(x);
                yield new BlockContent(distribution, x, 0);
            }
        };
    }

    private int dimension(ElementKind kind, String name, List<String> dimensions, int index, int lineNumber) {
        if (dimensions.size() <= index) {
            throw new DcmParseException("Missing dimension in " + kind.getKeyword() + " " + name + " header",
                    lineNumber);
        }
        return DcmValueConverter.convertDimension(dimensions.get(index), lineNumber);
    }

    private void parseComment(DcmElement element, String line) {
        String text = line.substring(1).strip();
        Optional<CommentDirective> directive = CommentDirective.match(text);
        if (directive.isPresent()) {
            directive.get().apply(element, directive.get().argumentOf(text));
        } else {
            element.appendComment(text);
        }
    }

    private void parseField(BlockKeyword field, BlockContent content, String line, List<DcmToken> tokens) {
        DcmElement element = content.getElement();
        switch (field) {
            case LANGNAME -> element.setDescription(parseString(line));
            case DISPLAYNAME -> element.setDisplayName(parseString(line));
            case FUNKTION -> element.setFunction(parseString(line));
            case EINHEIT_W -> element.setUnitsValue(parseString(line));
            case EINHEIT_X -> element.setUnitsX(parseString(line));
            case EINHEIT_Y -> element.setUnitsY(parseString(line));
            case VAR -> parseVariant(element, line);
            case ST_X -> content.getXCoordinates().addAll(parseNumbers(tokens));
            case ST_Y -> content.setCurrentY(parseSingleNumber(element, tokens));
            case WERT -> parseValues(content, parseNumbers(tokens).stream().map(DcmValue::of).toList(), line);
            case TEXT -> parseValues(content, parseTexts(tokens), line);
        }
    }

    private void parseValues(BlockContent content, List<DcmValue> values, String line) {
        DcmElement element = content.getElement();
        switch (element.getKind().getShape()) {
            case SCALAR -> parseScalar((ScalarParameter) element, values, line);
            case BLOCK -> content.appendToGrid(values);
            case LINE -> content.appendToVector(values);
            case MAP -> {
                if (content.getCurrentY() == null) {
                    throw new ValueBeforeCoordinateException(element.getName(), cursor.getLineNumber());
                }
                content.appendToCurrentY(values);
            }
            case DISTRIBUTION -> warn("Values not expected in distribution " + element.getName());
        }
    }

    private void parseScalar(ScalarParameter parameter, List<DcmValue> values, String line) {
        if (line.startsWith(BlockKeyword.TEXT.getToken())) {
            parameter.setText(parseString(line));
            return;
        }
        if (values.isEmpty()) {
            throw new NotNumericException("", cursor.getLineNumber());
        }
        if (values.size() > 1) {
            warn("Expected a single value in " + parameter.getName() + ", using the first of " + values.size());
        }
        parameter.setValue(values.get(0).getNumber());
    }

    private void parseVariant(DcmElement element, String line) {
        Matcher matcher = VARIANT_PATTERN.matcher(line);
        if (!matcher.matches()) {
            warn("Malformed variant in " + element.getName() + ": " + line);
            return;
        }
        element.addVariant(matcher.group(1).strip(), DcmValueConverter.convertVariant(matcher.group(2).strip()));
    }

    /**
     * Text after the keyword, without surrounding blanks and double quotes.
     */
    static String parseString(String line) {
        String[] parts = line.split("\\s+", 2);
        return parts.length < 2 ? "" : DcmValueConverter.stripQuotes(parts[1]);
    }

    private List<Number> parseNumbers(List<DcmToken> tokens) {
        List<Number> numbers = new ArrayList<>(tokens.size() - 1);
        for (DcmToken token : tokens.subList(1, tokens.size())) {
            if (token.isQuoted()) {
                throw new NotNumericException('"' + token.getValue() + '"', cursor.getLineNumber());
            }
            try {
                numbers.add(DcmValueConverter.convertValue(token.getValue()));
            } catch (NotNumericException e) {
                throw new NotNumericException(token.getValue(), cursor.getLineNumber());
            }
        }
        return numbers;
    }

    private Number parseSingleNumber(DcmElement element, List<DcmToken> tokens) {
        List<Number> numbers = parseNumbers(tokens);
        if (numbers.isEmpty()) {
            throw new NotNumericException("", cursor.getLineNumber());
        }
        if (numbers.size() > 1) {
            warn("Expected a single ST/Y value in " + element.getName() + ", using the first of " + numbers.size());
        }
        return numbers.get(0);
    }

    private List<DcmValue> parseTexts(List<DcmToken> tokens) {
        return tokens.subList(1, tokens.size()).stream()
                .map(t -> DcmValue.ofText(t.getValue()))
                .toList();
    }

    private void finish(BlockContent content) {
        DcmElement element = content.getElement();
        switch (element.getKind().getShape()) {
            case SCALAR -> {
                // value and text are set while reading
            }
            case BLOCK -> finishBlock((ParameterBlock) element, content);
            case LINE -> finishLine((CharacteristicLine) element, content);
            case MAP -> finishMap((CharacteristicMap) element, content);
            case DISTRIBUTION -> finishDistribution((Distribution) element, content);
        }
    }

    private void finishBlock(ParameterBlock block, BlockContent content) {
        List<List<DcmValue>> rows = content.getRows();
        if (rows.size() != content.getYDimension()) {
            warn(String.format("Y dimension in %s does not match description: expected %d rows, found %d",
                    block.getName(), content.getYDimension(), rows.size()));
        }
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i).size() != content.getXDimension()) {
                warn(String.format("X dimension in %s does not match description: row %d has %d values, expected %d",
                        block.getName(), i, rows.get(i).size(), content.getXDimension()));
            }
            block.addRow(rows.get(i));
        }
    }

    private void finishLine(CharacteristicLine line, BlockContent content) {
        List<Number> xs = content.getXCoordinates();
        List<DcmValue> values = content.vector();
        checkXCoordinates(line, xs, content.getXDimension());
        if (values.size() != content.getXDimension()) {
            warn(String.format("Values dimension in %s does not match description: expected %d, found %d",
                    line.getName(), content.getXDimension(), values.size()));
        }
        line.setValues(zip(line, xs, values));
    }

    private void finishMap(CharacteristicMap map, BlockContent content) {
        List<Number> xs = content.getXCoordinates();
        checkXCoordinates(map, xs, content.getXDimension());
        Map<Number, List<DcmValue>> rows = content.getRowsByY();
        if (rows.size() != content.getYDimension()) {
            warn(String.format("Y dimension in %s does not match description: expected %d rows, found %d",
                    map.getName(), content.getYDimension(), rows.size()));
        }
        Map<Number, Map<Number, DcmValue>> values = new LinkedHashMap<>();
        for (Map.Entry<Number, List<DcmValue>> row : rows.entrySet()) {
            if (row.getValue().size() != content.getXDimension()) {
                warn(String.format("Values dimension in %s does not match description: row ST/Y %s has %d values, expected %d",
                        map.getName(), row.getKey(), row.getValue().size(), content.getXDimension()));
            }
            values.put(row.getKey(), zip(map, xs, row.getValue()));
        }
        map.setValues(values);
    }

    private void finishDistribution(Distribution distribution, BlockContent content) {
        checkXCoordinates(distribution, content.getXCoordinates(), content.getXDimension());
        distribution.setValues(new ArrayList<>(content.getXCoordinates()));
    }

    private void checkXCoordinates(DcmElement element, List<Number> xs, int xDimension) {
        if (xs.size() != xDimension) {
            warn(String.format("X dimension in %s does not match description: expected %d, found %d",
                    element.getName(), xDimension, xs.size()));
        }
    }

    /**
     * Pairs coordinates with values position by position; extra entries on either side are dropped.
     */
    private Map<Number, DcmValue> zip(DcmElement element, List<Number> xs, List<DcmValue> values) {
        Map<Number, DcmValue> zipped = new LinkedHashMap<>();
        int n = Math.min(xs.size(), values.size());
        for (int i = 0; i < n; i++) {
            if (zipped.put(xs.get(i), values.get(i)) != null) {
                warn("Duplicate ST/X coordinate " + xs.get(i) + " in " + element.getName());
            }
        }
        return zipped;
    }

    private void warn(String message) {
        int line = cursor.getLineNumber();
        log.warn("Line {}: {}", line, message);
        diagnostics.addWarning(line, message);
    }
}
