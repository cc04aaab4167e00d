package com.calibration.dcm.model;

/**
 * Visitor over the element payload shapes.
 */
public interface DcmElementVisitor {
    void visit(ScalarParameter parameter);
    void visit(ParameterBlock block);
    void visit(CharacteristicLine line);
    void visit(CharacteristicMap map);
    void visit(Distribution distribution);
}
