package com.ethnicthv.enumset.processor;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.ProcessingEnvironment;
import javax.lang.model.element.*;
import javax.lang.model.util.Elements;
import javax.tools.Diagnostic;
import java.util.*;

/**
 * Shared base annotation processor: compiler messaging, {@code -A} option access and
 * element helpers.
 */
public abstract class BaseProcessor extends AbstractProcessor {
    protected Elements elementUtils;
    private boolean verbose;

    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        super.init(processingEnv);
        this.elementUtils = processingEnv.getElementUtils();
        this.verbose = booleanOption(verboseOption(), false);
    }

    /** Name of the option that enables {@link #note} output. */
    protected abstract String verboseOption();

    // ---------------------------------------------------------------------
    // Messaging helpers
    // ---------------------------------------------------------------------
    protected void error(Element e, String fmt, Object... args) {
        processingEnv.getMessager().printMessage(Diagnostic.Kind.ERROR,
                String.format(Locale.ROOT, fmt, args), e);
    }
    protected void error(String fmt, Object... args) {
        processingEnv.getMessager().printMessage(Diagnostic.Kind.ERROR,
                String.format(Locale.ROOT, fmt, args));
    }
    protected void warn(Element e, String fmt, Object... args) {
        processingEnv.getMessager().printMessage(Diagnostic.Kind.WARNING,
                String.format(Locale.ROOT, fmt, args), e);
    }
    protected void note(String fmt, Object... args) {
        if (!verbose) return;
        processingEnv.getMessager().printMessage(Diagnostic.Kind.NOTE,
                String.format(Locale.ROOT, fmt, args));
    }

    // ---------------------------------------------------------------------
    // Options
    // ---------------------------------------------------------------------
    protected String option(String name, String defaultValue) {
        String v = processingEnv.getOptions().get(name);
        return v == null || v.isBlank() ? defaultValue : v.trim();
    }
    protected boolean booleanOption(String name, boolean defaultValue) {
        String v = processingEnv.getOptions().get(name);
        // a bare -Aname counts as enabled
        if (v == null) return processingEnv.getOptions().containsKey(name) || defaultValue;
        return Boolean.parseBoolean(v.trim());
    }

    // ---------------------------------------------------------------------
    // Element helpers
    // ---------------------------------------------------------------------
    protected TypeElement getTypeElement(String fqn) {
        return elementUtils.getTypeElement(fqn);
    }

    protected String packageOf(TypeElement type) {
        return elementUtils.getPackageOf(type).getQualifiedName().toString();
    }

    /** Simple names from the outermost enclosing type down to {@code type}. */
    protected static List<String> nestedSimpleNames(TypeElement type) {
        Deque<String> names = new ArrayDeque<>();
        Element current = type;
        while (current != null && (current.getKind().isClass() || current.getKind().isInterface())) {
            names.addFirst(current.getSimpleName().toString());
            current = current.getEnclosingElement();
        }
        return new ArrayList<>(names);
    }

    /** First type, from {@code type} outwards, that other classes in its package cannot see. */
    protected static TypeElement firstInaccessible(TypeElement type) {
        Element current = type;
        while (current != null && (current.getKind().isClass() || current.getKind().isInterface())) {
            if (current.getModifiers().contains(Modifier.PRIVATE)) return (TypeElement) current;
            current = current.getEnclosingElement();
        }
        return null;
    }
}
