package com.calibration.dcm.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import lombok.AccessLevel;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.Setter;
import lombok.ToString;

/**
 * Base class for all named calibration elements of a DCM document.
 *
 * Holds the attributes every block kind may carry. Subclasses add the payload
 * for their {@link ElementShape}; {@link #kind} selects the keyword written back.
 */
@Data
public abstract class DcmElement {
    @Setter(AccessLevel.NONE)
    protected ElementKind kind;
    protected String name;
    protected String description;
    protected String displayName;
    protected String function;
    protected String unitsValue;
    protected String unitsX;
    protected String unitsY;
    protected Map<String, DcmValue> variants = new LinkedHashMap<>();
    protected String comment;
    protected String xMapping;
    protected String yMapping;
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    protected int sourceLine;

    protected DcmElement(ElementKind kind, String name) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = name;
    }

    protected void requireShape(ElementShape expected) {
        if (kind.getShape() != expected) {
            throw new IllegalArgumentException(kind + " is not a " + expected + " kind");
        }
    }

    public abstract void accept(DcmElementVisitor visitor);

    public void addVariant(String variantName, DcmValue value) {
        variants.put(variantName, value);
    }

    /**
     * Appends one comment line; lines are joined with '\n'.
     */
    public void appendComment(String line) {
        comment = comment == null ? line : comment + "\n" + line;
    }
}
