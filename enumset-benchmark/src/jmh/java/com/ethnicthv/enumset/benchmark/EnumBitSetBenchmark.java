package com.ethnicthv.enumset.benchmark;

import com.ethnicthv.enumset.core.set.EnumBitSet;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.EnumSet;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * EnumBitSet against java.util.EnumSet for the operations a flag set sees most:
 * membership updates, set algebra and iteration.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Fork(value = 1, jvmArgs = {"-Xms1G", "-Xmx1G"})
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@State(Scope.Thread)
public class EnumBitSetBenchmark {

    @Param({"4", "12", "24"})
    public int populated;

    private Flag[] values;
    private EnumBitSet<Flag> bitsA;
    private EnumBitSet<Flag> bitsB;
    private EnumSet<Flag> jdkA;
    private EnumSet<Flag> jdkB;

    @Setup(Level.Trial)
    public void setup() {
        Flag[] all = Flag.values();
        Random random = new Random(17);
        values = new Flag[populated];
        bitsA = EnumBitSet.noneOf(FlagOrdinalMapping.INSTANCE);
        bitsB = EnumBitSet.noneOf(FlagOrdinalMapping.INSTANCE);
        jdkA = EnumSet.noneOf(Flag.class);
        jdkB = EnumSet.noneOf(Flag.class);
        for (int i = 0; i < populated; i++) {
            values[i] = all[random.nextInt(all.length)];
            Flag other = all[random.nextInt(all.length)];
            bitsA.add(values[i]);
            jdkA.add(values[i]);
            bitsB.add(other);
            jdkB.add(other);
        }
    }

    @Benchmark
    public int addRemoveBits() {
        EnumBitSet<Flag> s = EnumBitSet.noneOf(FlagOrdinalMapping.INSTANCE);
        for (Flag f : values) s.add(f);
        for (Flag f : values) s.remove(f);
        return s.bits();
    }

    @Benchmark
    public int addRemoveJdk() {
        EnumSet<Flag> s = EnumSet.noneOf(Flag.class);
        for (Flag f : values) s.add(f);
        for (Flag f : values) s.remove(f);
        return s.size();
    }

    @Benchmark
    public EnumBitSet<Flag> symmetricDifferenceBits() {
        return bitsA.symmetricDifference(bitsB);
    }

    @Benchmark
    public EnumSet<Flag> symmetricDifferenceJdk() {
        EnumSet<Flag> union = EnumSet.copyOf(jdkA);
        union.addAll(jdkB);
        EnumSet<Flag> both = EnumSet.copyOf(jdkA);
        both.retainAll(jdkB);
        union.removeAll(both);
        return union;
    }

    @Benchmark
    public void iterateBits(Blackhole bh) {
        for (Flag f : bitsA) bh.consume(f);
    }

    @Benchmark
    public void iterateJdk(Blackhole bh) {
        for (Flag f : jdkA) bh.consume(f);
    }
}
