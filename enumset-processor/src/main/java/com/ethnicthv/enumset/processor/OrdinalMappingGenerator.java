package com.ethnicthv.enumset.processor;

import java.util.List;
import java.util.Objects;

/**
 * Validates an {@link EnumModel} and emits the source of its
 * {@code com.ethnicthv.enumset.core.api.IOrdinalMapping} implementation.
 * <p>
 * Ordinals are declaration positions: {@code toOrdinal} returns the member's position,
 * {@code fromOrdinal} switches over every position and treats anything else as unreachable.
 * Validation runs before any text is produced; a rejected model yields no source at all.
 */
public final class OrdinalMappingGenerator {
    public static final int MAX_MEMBERS = Integer.SIZE;
    public static final String DEFAULT_SUFFIX = "OrdinalMapping";

    private static final String MAPPING_IFACE = "com.ethnicthv.enumset.core.api.IOrdinalMapping";

    private final String suffix;
    private final String generatorName;

    public OrdinalMappingGenerator() {
        this(DEFAULT_SUFFIX, OrdinalMappingGenerator.class.getName());
    }

    /**
     * @param suffix        appended to the flattened enum name to form the class name
     * @param generatorName recorded in the {@code @Generated} annotation
     */
    public OrdinalMappingGenerator(String suffix, String generatorName) {
        this.suffix = Objects.requireNonNull(suffix, "suffix");
        this.generatorName = Objects.requireNonNull(generatorName, "generatorName");
        if (suffix.isEmpty()) throw new IllegalArgumentException("suffix must not be empty");
    }

    // ---------------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------------

    /**
     * Check every eligibility rule, first violation wins.
     *
     * @throws IneligibleEnumException if the model may not get a mapping
     */
    public void validate(EnumModel model) {
        String typeName = model.canonicalName();
        if (!model.isEnum()) throw new IneligibleEnumException(EligibilityRule.NOT_AN_ENUM, typeName, null);
        List<EnumMember> members = model.members();
        for (int i = 0; i < members.size(); i++) {
            EnumMember m = members.get(i);
            if (i == MAX_MEMBERS) throw new IneligibleEnumException(EligibilityRule.TOO_MANY_MEMBERS, typeName, m.name());
            if (m.hasData()) throw new IneligibleEnumException(EligibilityRule.MEMBER_WITH_DATA, typeName, m.name());
            if (m.hasExplicitDiscriminant()) throw new IneligibleEnumException(EligibilityRule.EXPLICIT_DISCRIMINANT, typeName, m.name());
        }
    }

    // ---------------------------------------------------------------------
    // Emission
    // ---------------------------------------------------------------------

    /** Name of the class that {@link #generate} produces for {@code model}. */
    public String mappingClassName(EnumModel model) {
        String simple = model.flatName() + suffix;
        return model.packageName().isEmpty() ? simple : model.packageName() + "." + simple;
    }

    /**
     * Validate {@code model} and emit its mapping class.
     *
     * @throws IneligibleEnumException if the model may not get a mapping
     */
    public GeneratedSource generate(EnumModel model) {
        validate(model);
        String pkg = model.packageName();
        String enumType = model.canonicalName();
        String name = model.flatName() + suffix;
        List<EnumMember> members = model.members();

        StringBuilder w = new StringBuilder(512 + members.size() * 48);
        if (!pkg.isEmpty()) w.append("package ").append(pkg).append(";\n\n");
        w.append("/**\n");
        w.append(" * Ordinal mapping for {@link ").append(enumType).append("}: ordinals are declaration positions.\n");
        w.append(" */\n");
        w.append("@javax.annotation.processing.Generated(\"").append(generatorName).append("\")\n");
        w.append("public final class ").append(name).append(" implements ").append(MAPPING_IFACE)
                .append('<').append(enumType).append("> {\n");
        w.append("  public static final ").append(name).append(" INSTANCE = new ").append(name).append("();\n\n");
        w.append("  public ").append(name).append("() {}\n\n");

        w.append("  @Override\n");
        w.append("  public Class<").append(enumType).append("> type() {\n");
        w.append("    return ").append(enumType).append(".class;\n");
        w.append("  }\n\n");

        w.append("  @Override\n");
        w.append("  public int toOrdinal(").append(enumType).append(" value) {\n");
        if (members.isEmpty()) {
            // no instance can exist
            w.append("    throw new AssertionError(\"").append(enumType).append(" has no members\");\n");
        } else {
            w.append("    switch (value) {\n");
            for (int i = 0; i < members.size(); i++) {
                w.append("      case ").append(members.get(i).name()).append(": return ").append(i).append(";\n");
            }
            w.append("      default: throw new AssertionError(value);\n");
            w.append("    }\n");
        }
        w.append("  }\n\n");

        w.append("  @Override\n");
        w.append("  public ").append(enumType).append(" fromOrdinal(int ordinal) {\n");
        w.append("    switch (ordinal) {\n");
        for (int i = 0; i < members.size(); i++) {
            w.append("      case ").append(i).append(": return ").append(enumType).append('.')
                    .append(members.get(i).name()).append(";\n");
        }
        w.append("      default: throw new AssertionError(\"unreachable ordinal \" + ordinal + \" for ")
                .append(enumType).append("\");\n");
        w.append("    }\n");
        w.append("  }\n");
        w.append("}\n");
        return new GeneratedSource(mappingClassName(model), w.toString());
    }
}
