package com.ethnicthv.enumset.core.mapping;

import com.ethnicthv.enumset.core.api.IOrdinalMapping;

/**
 * Hand-written mapping used by the core tests, registered through the test service file.
 */
public final class ColorMapping implements IOrdinalMapping<Color> {
    public static final ColorMapping INSTANCE = new ColorMapping();

    @Override
    public Class<Color> type() {
        return Color.class;
    }

    @Override
    public int toOrdinal(Color value) {
        return value.ordinal();
    }

    @Override
    public Color fromOrdinal(int ordinal) {
        return Color.values()[ordinal];
    }
}
