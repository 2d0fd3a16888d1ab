package com.ethnicthv.enumset.processor;

/**
 * Raised by {@link OrdinalMappingGenerator} when a type breaks an {@link EligibilityRule}.
 * No source is produced for the type.
 */
public class IneligibleEnumException extends RuntimeException {
    private final EligibilityRule rule;
    private final String memberName;

    public IneligibleEnumException(EligibilityRule rule, String typeName, String memberName) {
        super(message(rule, typeName, memberName));
        this.rule = rule;
        this.memberName = memberName;
    }

    private static String message(EligibilityRule rule, String typeName, String memberName) {
        StringBuilder sb = new StringBuilder(rule.description()).append(" (").append(typeName);
        if (memberName != null) sb.append('.').append(memberName);
        return sb.append(')').toString();
    }

    public EligibilityRule getRule() {
        return rule;
    }

    /** Offending member, or {@code null} when the rule concerns the type as a whole. */
    public String getMemberName() {
        return memberName;
    }
}
