package com.ethnicthv.enumset.core;

/**
 * Thrown when a mapping hands out an ordinal that does not fit a 32-bit mask.
 * This is a defect in the mapping, not a recoverable condition: generated mappings
 * never produce it, hand-written ones that claim too many values do.
 */
public class OrdinalOutOfRangeException extends RuntimeException {
    private final transient Object value;
    private final int ordinal;

    public OrdinalOutOfRangeException(Object value, int ordinal) {
        super("Ordinal " + ordinal + " of " + value + " is out of range: EnumBitSet only supports ordinals 0.."
                + (Integer.SIZE - 1) + " (at most " + Integer.SIZE + " values)");
        this.value = value;
        this.ordinal = ordinal;
    }

    public Object getValue() {
        return value;
    }

    public int getOrdinal() {
        return ordinal;
    }
}
