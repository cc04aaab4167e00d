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
 * KENNLINIE, FESTKENNLINIE and GRUPPENKENNLINIE: values keyed by their ST/X coordinate.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class CharacteristicLine extends DcmElement {
    private int xDimension;
    private Map<Number, DcmValue> values = new LinkedHashMap<>();

    public CharacteristicLine(ElementKind kind, String name) {
        super(kind, name);
        requireShape(ElementShape.LINE);
    }

    public CharacteristicLine(String name) {
        this(ElementKind.CHARACTERISTIC_LINE, name);
    }

    public List<Number> getXCoordinates() {
        return new ArrayList<>(values.keySet());
    }

    /**
     * Looks up a value by coordinate, comparing numerically so that 1 and 1.0 match.
     */
    public Optional<DcmValue> valueAt(Number x) {
        return Optional.ofNullable(NumericKeys.lookup(values, x));
    }

    @Override
    public void accept(DcmElementVisitor visitor) {
        visitor.visit(this);
    }
}
