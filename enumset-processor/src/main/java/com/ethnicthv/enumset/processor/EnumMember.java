package com.ethnicthv.enumset.processor;

import java.util.Objects;

/**
 * One declared member of a candidate enumeration, with the eligibility facts the
 * generator needs about it.
 */
public final class EnumMember {
    private final String name;
    private final boolean hasData;
    private final boolean hasExplicitDiscriminant;

    public EnumMember(String name, boolean hasData, boolean hasExplicitDiscriminant) {
        this.name = Objects.requireNonNull(name, "name");
        this.hasData = hasData;
        this.hasExplicitDiscriminant = hasExplicitDiscriminant;
    }

    /** A plain, data-free member. */
    public static EnumMember unit(String name) {
        return new EnumMember(name, false, false);
    }

    public String name() {
        return name;
    }

    /** The member carries its own state or behaviour (a constant-specific class body). */
    public boolean hasData() {
        return hasData;
    }

    /** The member assigns itself a value (constructor arguments on the constant). */
    public boolean hasExplicitDiscriminant() {
        return hasExplicitDiscriminant;
    }

    @Override
    public String toString() {
        return name;
    }
}
