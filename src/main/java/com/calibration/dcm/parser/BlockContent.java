package com.calibration.dcm.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.calibration.dcm.model.DcmElement;
import com.calibration.dcm.model.DcmValue;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Setter;

/**
 * Raw coordinates and value rows of one block, collected until its END line.
 */
@Getter
@RequiredArgsConstructor
class BlockContent {
    private final DcmElement element;
    private final int xDimension;
    private final int yDimension;

    private final List<Number> xCoordinates = new ArrayList<>();
    private final List<List<DcmValue>> rows = new ArrayList<>();
    private final Map<Number, List<DcmValue>> rowsByY = new LinkedHashMap<>();
    @Setter
    private Number currentY;

    /**
     * Appends the values of one line as a row. The line continues the open row only
     * when that row is still short of {@code xDimension} cells and the line fits in
     * the remainder, so a row wrapped over several lines stays one row.
     */
    void appendToGrid(List<DcmValue> values) {
        if (rows.isEmpty() || !fitsOpenRow(rows.get(rows.size() - 1), values)) {
            rows.add(new ArrayList<>());
        }
        rows.get(rows.size() - 1).addAll(values);
    }

    private boolean fitsOpenRow(List<DcmValue> openRow, List<DcmValue> values) {
        return openRow.size() < xDimension && openRow.size() + values.size() <= xDimension;
    }

    /**
     * Appends the values of one line to the single value vector of a line element.
     */
    void appendToVector(List<DcmValue> values) {
        if (rows.isEmpty()) {
            rows.add(new ArrayList<>());
        }
        rows.get(0).addAll(values);
    }

    void appendToCurrentY(List<DcmValue> values) {
        rowsByY.computeIfAbsent(currentY, y -> new ArrayList<>()).addAll(values);
    }

    List<DcmValue> vector() {
        return rows.isEmpty() ? List.of() : rows.get(0);
    }
}
