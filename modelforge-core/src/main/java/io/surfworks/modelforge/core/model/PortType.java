package io.surfworks.modelforge.core.model;

/**
 * Value type tag carried by output ports and port elements.
 */
public enum PortType {
    /** 32-bit floating point */
    SMALL_REAL,
    /** 64-bit floating point */
    REAL,
    /** 32-bit integer */
    INTEGER,
    /** 64-bit integer */
    BIG_INTEGER,
    /** Category index */
    CATEGORICAL,
    BOOLEAN;

    public boolean isFloatingPoint() {
        return this == SMALL_REAL || this == REAL;
    }
}
