package com.calibration.dcm.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * STUETZSTELLENVERTEILUNG: a named coordinate vector that lines and maps refer to
 * through their SSTX/SSTY mapping.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Distribution extends DcmElement {
    private int xDimension;
    private List<Number> values = new ArrayList<>();

    public Distribution(String name) {
        super(ElementKind.DISTRIBUTION, name);
    }

    @Override
    public void accept(DcmElementVisitor visitor) {
        visitor.visit(this);
    }
}
