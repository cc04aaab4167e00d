package com.calibration.dcm.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * FESTWERTEBLOCK: a grid of values indexed [y][x] without coordinates.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ParameterBlock extends DcmElement {
    private int xDimension;
    private int yDimension = 1;
    private List<List<DcmValue>> values = new ArrayList<>();

    public ParameterBlock(String name) {
        super(ElementKind.PARAMETER_BLOCK, name);
    }

    public DcmValue getValue(int y, int x) {
        return values.get(y).get(x);
    }

    public void addRow(List<DcmValue> row) {
        values.add(row);
    }

    public boolean isTextValued() {
        return values.stream().flatMap(List::stream).anyMatch(DcmValue::isText);
    }

    @Override
    public void accept(DcmElementVisitor visitor) {
        visitor.visit(this);
    }
}
