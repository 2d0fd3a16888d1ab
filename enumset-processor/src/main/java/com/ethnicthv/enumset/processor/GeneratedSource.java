package com.ethnicthv.enumset.processor;

/**
 * A generated compilation unit: the binary name of its top-level class and its text.
 */
public final class GeneratedSource {
    private final String qualifiedName;
    private final String code;

    public GeneratedSource(String qualifiedName, String code) {
        this.qualifiedName = qualifiedName;
        this.code = code;
    }

    public String qualifiedName() {
        return qualifiedName;
    }

    public String code() {
        return code;
    }
}
