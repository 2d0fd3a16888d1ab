package com.ethnicthv.enumset.processor;

/**
 * The rules a type must pass before an ordinal mapping is generated for it.
 */
public enum EligibilityRule {
    NOT_AN_ENUM("@CLike is only defined for enums"),
    TOO_MANY_MEMBERS("@CLike supports at most " + OrdinalMappingGenerator.MAX_MEMBERS + " members"),
    MEMBER_WITH_DATA("@CLike requires a C-style enum: constants must not carry a class body"),
    EXPLICIT_DISCRIMINANT("@CLike does not support explicit values: constants must not pass constructor arguments");

    private final String description;

    EligibilityRule(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
