package com.ethnicthv.enumset.set;

import com.ethnicthv.enumset.Wide;
import com.ethnicthv.enumset.WideOrdinalMapping;
import com.ethnicthv.enumset.core.set.EnumBitSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * A 32-constant enum uses every bit of the mask, including the sign bit.
 */
@DisplayName("Full-width masks")
public class BoundaryTest {

    @Test
    @DisplayName("the highest ordinal is stored in the sign bit")
    void highestOrdinal() {
        EnumBitSet<Wide> set = EnumBitSet.noneOf(WideOrdinalMapping.INSTANCE);
        assertTrue(set.add(Wide.V31));
        assertTrue(set.contains(Wide.V31));
        assertEquals(1, set.size());
        assertEquals(Integer.MIN_VALUE, set.bits());
        assertEquals(List.of(Wide.V31), new ArrayList<>(set.stream().toList()));
        assertEquals("{V31}", set.toString());
    }

    @Test
    @DisplayName("every constant at once")
    void fullSet() {
        EnumBitSet<Wide> full = EnumBitSet.copyOf(WideOrdinalMapping.INSTANCE, Arrays.asList(Wide.values()));
        assertEquals(32, full.size());
        assertEquals(-1, full.bits());
        assertEquals(Arrays.asList(Wide.values()), full.stream().toList());
        assertEquals(32, full.iterator().remaining());

        assertTrue(full.remove(Wide.V31));
        assertEquals(Integer.MAX_VALUE, full.bits());
        assertFalse(full.contains(Wide.V31));
    }

    @Test
    @DisplayName("ordering treats masks as unsigned")
    void unsignedOrdering() {
        EnumBitSet<Wide> high = EnumBitSet.of(WideOrdinalMapping.INSTANCE, Wide.V31);
        EnumBitSet<Wide> lowFull = EnumBitSet.copyOf(WideOrdinalMapping.INSTANCE,
                Arrays.asList(Wide.values()).subList(0, 31));
        assertTrue(high.compareTo(lowFull) > 0);
        assertTrue(lowFull.compareTo(high) < 0);
        assertEquals(0, high.compareTo(high.copy()));
    }

    @Test
    void algebraAcrossTheSignBit() {
        EnumBitSet<Wide> a = EnumBitSet.of(WideOrdinalMapping.INSTANCE, Wide.V00, Wide.V31);
        EnumBitSet<Wide> b = EnumBitSet.of(WideOrdinalMapping.INSTANCE, Wide.V31, Wide.V30);
        assertEquals(List.of(Wide.V31), a.intersection(b).stream().toList());
        assertEquals(List.of(Wide.V00, Wide.V30), a.symmetricDifference(b).stream().toList());
        assertEquals(List.of(Wide.V00), a.difference(b).stream().toList());
    }
}
