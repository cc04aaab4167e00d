package com.calibration.dcm.model;

/**
 * Payload layout shared by one or more block kinds.
 */
public enum ElementShape {
    /**
     * Single value or text (FESTWERT).
     */
    SCALAR,

    /**
     * 1-D or 2-D grid without coordinates (FESTWERTEBLOCK).
     */
    BLOCK,

    /**
     * Values over one coordinate axis.
     */
    LINE,

    /**
     * Values over two coordinate axes.
     */
    MAP,

    /**
     * Coordinate vector only (STUETZSTELLENVERTEILUNG).
     */
    DISTRIBUTION
}
