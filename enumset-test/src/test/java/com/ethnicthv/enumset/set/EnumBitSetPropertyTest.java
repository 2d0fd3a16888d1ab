package com.ethnicthv.enumset.set;

import com.ethnicthv.enumset.Foo;
import com.ethnicthv.enumset.FooOrdinalMapping;
import com.ethnicthv.enumset.Wide;
import com.ethnicthv.enumset.WideOrdinalMapping;
import com.ethnicthv.enumset.core.set.EnumBitSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Set laws checked exhaustively over every pair of {@link Foo} subsets, and random
 * operation sequences over {@link Wide} checked against a {@link TreeSet} of ordinals.
 */
@DisplayName("EnumBitSet laws")
public class EnumBitSetPropertyTest {

    private static final Foo[] FOOS = Foo.values();
    private static final Wide[] WIDES = Wide.values();

    private static List<EnumBitSet<Foo>> allFooSubsets() {
        List<EnumBitSet<Foo>> subsets = new ArrayList<>();
        for (int m = 0; m < (1 << FOOS.length); m++) {
            EnumBitSet<Foo> s = EnumBitSet.noneOf(FooOrdinalMapping.INSTANCE);
            for (int i = 0; i < FOOS.length; i++) if ((m & (1 << i)) != 0) s.add(FOOS[i]);
            subsets.add(s);
        }
        return subsets;
    }

    @Test
    @DisplayName("union and intersection commute, difference and xor decompose")
    void algebraLaws() {
        List<EnumBitSet<Foo>> subsets = allFooSubsets();
        for (EnumBitSet<Foo> a : subsets) {
            for (EnumBitSet<Foo> b : subsets) {
                String ctx = a + " / " + b;
                assertEquals(a.union(b), b.union(a), ctx);
                assertEquals(a.intersection(b), b.intersection(a), ctx);
                assertEquals(a.difference(b), a.minus(a.and(b)), ctx);
                assertEquals(a.xor(b), a.minus(b).or(b.minus(a)), ctx);
                assertEquals(a.xor(b), a.or(b).minus(a.and(b)), ctx);
                assertEquals(a.isSubsetOf(b), b.isSupersetOf(a), ctx);
                assertEquals(a.isDisjoint(b), a.and(b).isEmpty(), ctx);
                assertEquals(a.equals(b), a.compareTo(b) == 0, ctx);
            }
        }
    }

    @Test
    @DisplayName("size matches iteration, iteration is ascending and complete")
    void cardinalityAndOrder() {
        for (EnumBitSet<Foo> s : allFooSubsets()) {
            List<Foo> seen = new ArrayList<>();
            s.forEach(seen::add);
            assertEquals(s.size(), seen.size(), s::toString);
            assertEquals(s.isEmpty(), s.size() == 0, s::toString);
            for (int i = 1; i < seen.size(); i++) assertTrue(seen.get(i - 1).ordinal() < seen.get(i).ordinal());
            for (Foo f : FOOS) assertEquals(s.contains(f), seen.contains(f), s::toString);
        }
    }

    @ParameterizedTest(name = "seed {0}")
    @ValueSource(longs = {1L, 7L, 42L, 2024L, 0xC0FFEEL})
    @DisplayName("random operation sequences agree with a reference model")
    void randomOperations(long seed) {
        Random random = new Random(seed);
        EnumBitSet<Wide> a = EnumBitSet.noneOf(WideOrdinalMapping.INSTANCE);
        EnumBitSet<Wide> b = EnumBitSet.noneOf(WideOrdinalMapping.INSTANCE);
        TreeSet<Integer> modelA = new TreeSet<>();
        TreeSet<Integer> modelB = new TreeSet<>();

        for (int step = 0; step < 2_000; step++) {
            Wide w = WIDES[random.nextInt(WIDES.length)];
            int o = w.ordinal();
            switch (random.nextInt(8)) {
                case 0 -> assertEquals(modelA.add(o), a.add(w));
                case 1 -> assertEquals(modelA.remove(o), a.remove(w));
                case 2 -> assertEquals(modelB.add(o), b.add(w));
                case 3 -> assertEquals(modelB.remove(o), b.remove(w));
                case 4 -> {
                    a = a.union(b);
                    modelA.addAll(modelB);
                }
                case 5 -> {
                    a = a.intersection(b);
                    modelA.retainAll(modelB);
                }
                case 6 -> {
                    b = b.symmetricDifference(a);
                    TreeSet<Integer> both = new TreeSet<>(modelB);
                    both.retainAll(modelA);
                    modelB.addAll(modelA);
                    modelB.removeAll(both);
                }
                default -> {
                    if (random.nextInt(10) == 0) {
                        a.clear();
                        modelA.clear();
                    } else {
                        a = a.difference(b);
                        modelA.removeAll(modelB);
                    }
                }
            }
            assertMatches(modelA, a);
            assertMatches(modelB, b);
        }
    }

    private static void assertMatches(TreeSet<Integer> model, EnumBitSet<Wide> set) {
        List<Integer> ordinals = new ArrayList<>();
        set.forEach(w -> ordinals.add(w.ordinal()));
        assertEquals(new ArrayList<>(model), ordinals);
        assertEquals(model.size(), set.size());
        int expectedBits = 0;
        for (int o : model) expectedBits |= 1 << o;
        assertEquals(expectedBits, set.bits());
    }
}
