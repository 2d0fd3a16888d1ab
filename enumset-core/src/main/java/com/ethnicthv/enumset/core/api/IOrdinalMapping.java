package com.ethnicthv.enumset.core.api;

/**
 * Conversion between the values of a small, fixed enumeration and their ordinals.
 * <p>
 * An ordinal is the bit index a value occupies in an
 * {@link com.ethnicthv.enumset.core.set.EnumBitSet} mask, so every ordinal returned
 * by {@link #toOrdinal(Object)} must lie in {@code [0, 32)}. Mappings are normally
 * generated for enums annotated with {@link com.ethnicthv.enumset.core.annotation.CLike};
 * a hand-written mapping can be checked with
 * {@link com.ethnicthv.enumset.core.mapping.OrdinalMappings#verify(IOrdinalMapping, Iterable)}.
 * <p>
 * Implementations must satisfy {@code fromOrdinal(toOrdinal(e)) == e} for every value {@code e}.
 *
 * @param <E> the element type
 */
public interface IOrdinalMapping<E> {

    /**
     * The element type this mapping serves.
     */
    Class<E> type();

    /**
     * Ordinal of {@code value}. Generated mappings return the declaration position.
     */
    int toOrdinal(E value);

    /**
     * Value whose ordinal is {@code ordinal}.
     * <p>
     * Only defined for ordinals previously returned by {@link #toOrdinal(Object)}.
     * Passing anything else is a contract violation; implementations are free to
     * fail in any way, callers must never rely on the outcome.
     */
    E fromOrdinal(int ordinal);
}
