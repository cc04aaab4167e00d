package com.calibration.dcm.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * KENNFELD, FESTKENNFELD and GRUPPENKENNFELD: rows keyed by ST/Y, each row keyed by ST/X.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class CharacteristicMap extends DcmElement {
    private int xDimension;
    private int yDimension;
    private Map<Number, Map<Number, DcmValue>> values = new LinkedHashMap<>();

    public CharacteristicMap(ElementKind kind, String name) {
        super(kind, name);
        requireShape(ElementShape.MAP);
    }

    public CharacteristicMap(String name) {
        this(ElementKind.CHARACTERISTIC_MAP, name);
    }

    public List<Number> getYCoordinates() {
        return new ArrayList<>(values.keySet());
    }

    /**
     * X coordinates of the first row; all rows share them in a well-formed map.
     */
    public List<Number> getXCoordinates() {
        return values.values().stream()
                .findFirst()
                .<List<Number>>map(row -> new ArrayList<>(row.keySet()))
                .orElseGet(ArrayList::new);
    }

    public Optional<DcmValue> valueAt(Number y, Number x) {
        Map<Number, DcmValue> row = NumericKeys.lookup(values, y);
        return row == null ? Optional.empty() : Optional.ofNullable(NumericKeys.lookup(row, x));
    }

    @Override
    public void accept(DcmElementVisitor visitor) {
        visitor.visit(this);
    }
}
