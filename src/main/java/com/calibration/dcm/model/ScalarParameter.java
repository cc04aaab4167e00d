package com.calibration.dcm.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * FESTWERT: a single numeric value, or a text when the block uses TEXT.
 * The two are mutually exclusive; setting one clears the other.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ScalarParameter extends DcmElement {
    private Number value;
    private String text;

    public ScalarParameter(String name) {
        super(ElementKind.PARAMETER, name);
    }

    public void setValue(Number value) {
        this.value = value;
        if (value != null) {
            this.text = null;
        }
    }

    public void setText(String text) {
        this.text = text;
        if (text != null) {
            this.value = null;
        }
    }

    public boolean isTextValued() {
        return text != null;
    }

    @Override
    public void accept(DcmElementVisitor visitor) {
        visitor.visit(this);
    }
}
