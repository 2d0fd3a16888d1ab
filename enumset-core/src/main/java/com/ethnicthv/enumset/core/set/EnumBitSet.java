package com.ethnicthv.enumset.core.set;

import com.ethnicthv.enumset.core.OrdinalOutOfRangeException;
import com.ethnicthv.enumset.core.api.IOrdinalMapping;
import com.ethnicthv.enumset.core.mapping.OrdinalMappings;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.StringJoiner;
import java.util.function.Consumer;
import java.util.stream.Collector;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A set of values of a small enumeration, stored as one 32-bit mask.
 * <p>
 * Bit {@code i} of the mask is set iff the value with ordinal {@code i} is a member.
 * Membership tests, updates and the set algebra are single bit operations; iteration
 * walks the set bits in ascending ordinal order. Only bits produced by the set's
 * {@link IOrdinalMapping} are ever set, which is what makes converting a bit back into
 * a value during iteration safe.
 * <p>
 * Instances behave like plain values: equality, hashing and ordering depend on the
 * element type and the mask only. They are mutable and not synchronized; use
 * {@link #copy()} to hand out an independent instance.
 *
 * @param <E> the element type
 */
public final class EnumBitSet<E> implements Iterable<E>, Comparable<EnumBitSet<E>> {
    private final IOrdinalMapping<E> mapping;
    private int bits;

    private EnumBitSet(IOrdinalMapping<E> mapping, int bits) {
        this.mapping = mapping;
        this.bits = bits;
    }

    // ---------------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------------

    /**
     * Empty set over the values of {@code mapping}.
     */
    public static <E> EnumBitSet<E> noneOf(IOrdinalMapping<E> mapping) {
        return new EnumBitSet<>(Objects.requireNonNull(mapping, "mapping"), 0);
    }

    /**
     * Empty set over {@code type}, using the mapping registered for it.
     *
     * @throws IllegalArgumentException if no mapping is registered for {@code type}
     */
    public static <E> EnumBitSet<E> noneOf(Class<E> type) {
        return noneOf(OrdinalMappings.forType(type));
    }

    @SafeVarargs
    public static <E> EnumBitSet<E> of(IOrdinalMapping<E> mapping, E... values) {
        EnumBitSet<E> set = noneOf(mapping);
        for (E value : values) set.add(value);
        return set;
    }

    /**
     * Set holding every value of {@code values}; duplicates collapse and order is irrelevant.
     */
    public static <E> EnumBitSet<E> copyOf(IOrdinalMapping<E> mapping, Iterable<? extends E> values) {
        EnumBitSet<E> set = noneOf(mapping);
        set.addAll(values);
        return set;
    }

    /**
     * Collector building an {@code EnumBitSet} from a stream.
     */
    public static <E> Collector<E, ?, EnumBitSet<E>> toEnumBitSet(IOrdinalMapping<E> mapping) {
        Objects.requireNonNull(mapping, "mapping");
        return Collector.of(
                () -> noneOf(mapping),
                EnumBitSet::add,
                EnumBitSet::union,
                Collector.Characteristics.UNORDERED,
                Collector.Characteristics.IDENTITY_FINISH);
    }

    public EnumBitSet<E> copy() {
        return new EnumBitSet<>(mapping, bits);
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public IOrdinalMapping<E> mapping() {
        return mapping;
    }

    /**
     * The raw membership mask. Bit {@code i} stands for the value with ordinal {@code i}.
     */
    public int bits() {
        return bits;
    }

    public int size() {
        return Integer.bitCount(bits);
    }

    public boolean isEmpty() {
        return bits == 0;
    }

    public boolean contains(E value) {
        return (bits & bit(value)) != 0;
    }

    /**
     * True if the two sets share no value.
     */
    public boolean isDisjoint(EnumBitSet<E> other) {
        return (bits & sameType(other).bits) == 0;
    }

    /**
     * True if every value of {@code other} is in this set.
     */
    public boolean isSupersetOf(EnumBitSet<E> other) {
        int otherBits = sameType(other).bits;
        return (bits & otherBits) == otherBits;
    }

    /**
     * True if every value of this set is in {@code other}.
     */
    public boolean isSubsetOf(EnumBitSet<E> other) {
        return other.isSupersetOf(this);
    }

    // ---------------------------------------------------------------------
    // Mutators
    // ---------------------------------------------------------------------

    /**
     * Add {@code value}.
     *
     * @return true if the value was not already present
     */
    public boolean add(E value) {
        int b = bit(value);
        boolean added = (bits & b) == 0;
        bits |= b;
        return added;
    }

    /**
     * Remove {@code value}.
     *
     * @return true if the value was present
     */
    public boolean remove(E value) {
        int b = bit(value);
        boolean removed = (bits & b) != 0;
        bits &= ~b;
        return removed;
    }

    /**
     * Add every value of {@code values}.
     *
     * @return true if the set changed
     */
    public boolean addAll(Iterable<? extends E> values) {
        int before = bits;
        for (E value : values) add(value);
        return bits != before;
    }

    public void clear() {
        bits = 0;
    }

    // ---------------------------------------------------------------------
    // Set algebra; every result is a new set
    // ---------------------------------------------------------------------

    public EnumBitSet<E> union(EnumBitSet<E> other) {
        return new EnumBitSet<>(mapping, bits | sameType(other).bits);
    }

    public EnumBitSet<E> intersection(EnumBitSet<E> other) {
        return new EnumBitSet<>(mapping, bits & sameType(other).bits);
    }

    public EnumBitSet<E> difference(EnumBitSet<E> other) {
        return new EnumBitSet<>(mapping, bits & ~sameType(other).bits);
    }

    public EnumBitSet<E> symmetricDifference(EnumBitSet<E> other) {
        return new EnumBitSet<>(mapping, bits ^ sameType(other).bits);
    }

    /** Same as {@link #union}. */
    public EnumBitSet<E> or(EnumBitSet<E> other) {
        return union(other);
    }

    /** Same as {@link #intersection}. */
    public EnumBitSet<E> and(EnumBitSet<E> other) {
        return intersection(other);
    }

    /** Same as {@link #difference}. */
    public EnumBitSet<E> minus(EnumBitSet<E> other) {
        return difference(other);
    }

    /** Same as {@link #symmetricDifference}. */
    public EnumBitSet<E> xor(EnumBitSet<E> other) {
        return symmetricDifference(other);
    }

    // ---------------------------------------------------------------------
    // Iteration
    // ---------------------------------------------------------------------

    /**
     * Iterator over a snapshot of the current members, in ascending ordinal order.
     * Later changes to this set are not visible to it.
     */
    @Override
    public Iter<E> iterator() {
        return new Iter<>(mapping, 0, bits);
    }

    @Override
    public Spliterator<E> spliterator() {
        return Spliterators.spliterator(iterator(), size(),
                Spliterator.DISTINCT | Spliterator.ORDERED | Spliterator.NONNULL);
    }

    public Stream<E> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    // ---------------------------------------------------------------------
    // Object
    // ---------------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EnumBitSet<?> that = (EnumBitSet<?>) o;
        return bits == that.bits && mapping.type() == that.mapping.type();
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(bits);
    }

    /**
     * Orders sets by their masks read as unsigned integers.
     */
    @Override
    public int compareTo(EnumBitSet<E> other) {
        return Integer.compareUnsigned(bits, sameType(other).bits);
    }

    /**
     * Renders the members as {@code {A, C}} in ascending ordinal order.
     */
    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "{", "}");
        for (E value : this) joiner.add(String.valueOf(value));
        return joiner.toString();
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private int bit(E value) {
        Objects.requireNonNull(value, "value");
        int ordinal = mapping.toOrdinal(value);
        if (ordinal < 0 || ordinal >= Integer.SIZE) {
            throw new OrdinalOutOfRangeException(value, ordinal);
        }
        return 1 << ordinal;
    }

    private EnumBitSet<E> sameType(EnumBitSet<E> other) {
        Objects.requireNonNull(other, "other");
        if (other.mapping.type() != mapping.type()) {
            throw new IllegalArgumentException("Element type mismatch: " + mapping.type().getName()
                    + " vs " + other.mapping.type().getName());
        }
        return other;
    }

    /**
     * Cursor over a snapshot of a set's mask.
     * <p>
     * Holds the index of the next candidate bit and the bits not yet returned; it keeps no
     * reference to the originating set. Forward-only; {@link #copy()} forks an independent
     * cursor at the current position.
     */
    public static final class Iter<E> implements Iterator<E> {
        private final IOrdinalMapping<E> mapping;
        private int index;
        private int remaining;

        Iter(IOrdinalMapping<E> mapping, int index, int remaining) {
            this.mapping = mapping;
            this.index = index;
            this.remaining = remaining;
        }

        @Override
        public boolean hasNext() {
            return remaining != 0;
        }

        @Override
        public E next() {
            if (remaining == 0) throw new NoSuchElementException();
            int skip = Integer.numberOfTrailingZeros(remaining);
            index += skip;
            remaining >>>= skip;
            // every remaining bit was set through the mapping, so index is a real ordinal
            E value = mapping.fromOrdinal(index);
            index++;
            remaining >>>= 1;
            return value;
        }

        @Override
        public void forEachRemaining(Consumer<? super E> action) {
            Objects.requireNonNull(action);
            while (remaining != 0) action.accept(next());
        }

        /**
         * Exact number of values still to be returned.
         */
        public int remaining() {
            return Integer.bitCount(remaining);
        }

        /**
         * Independent cursor resuming from the same position.
         */
        public Iter<E> copy() {
            return new Iter<>(mapping, index, remaining);
        }
    }
}
