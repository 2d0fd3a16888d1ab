package com.ethnicthv.enumset.processor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Definition-time description of a type that asks for an ordinal mapping: where it lives,
 * whether it is an enum at all and its members in declaration order.
 * <p>
 * {@code simpleNames} holds the enclosing type names from outermost to the type itself,
 * so {@code Outer.Inner} in package {@code p} is {@code ("p", ["Outer", "Inner"])}.
 */
public final class EnumModel {
    private final String packageName;
    private final List<String> simpleNames;
    private final boolean isEnum;
    private final List<EnumMember> members;

    public EnumModel(String packageName, List<String> simpleNames, boolean isEnum, List<EnumMember> members) {
        this.packageName = Objects.requireNonNull(packageName, "packageName");
        if (simpleNames.isEmpty()) throw new IllegalArgumentException("simpleNames must not be empty");
        this.simpleNames = List.copyOf(simpleNames);
        this.isEnum = isEnum;
        this.members = List.copyOf(members);
    }

    /** Top-level enum with plain members. */
    public static EnumModel ofEnum(String packageName, String simpleName, String... memberNames) {
        List<EnumMember> members = new ArrayList<>(memberNames.length);
        for (String n : memberNames) members.add(EnumMember.unit(n));
        return new EnumModel(packageName, Collections.singletonList(simpleName), true, members);
    }

    public String packageName() {
        return packageName;
    }

    public List<String> simpleNames() {
        return simpleNames;
    }

    public boolean isEnum() {
        return isEnum;
    }

    public List<EnumMember> members() {
        return members;
    }

    /** Source-level name, e.g. {@code p.Outer.Inner}. */
    public String canonicalName() {
        String nested = String.join(".", simpleNames);
        return packageName.isEmpty() ? nested : packageName + "." + nested;
    }

    /** Name fragment for generated types, e.g. {@code Outer_Inner}. */
    public String flatName() {
        return String.join("_", simpleNames);
    }
}
