package com.ethnicthv.enumset.processor;

import com.google.auto.service.AutoService;
import com.sun.source.tree.NewClassTree;
import com.sun.source.tree.Tree;
import com.sun.source.tree.VariableTree;
import com.sun.source.util.Trees;

import javax.annotation.processing.*;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.*;
import javax.lang.model.util.ElementFilter;
import javax.tools.FileObject;
import javax.tools.JavaFileObject;
import javax.tools.StandardLocation;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Generates an {@code IOrdinalMapping} for every enum annotated with {@code @CLike}.
 * <p>
 * Each annotated type is read into an {@link EnumModel} and handed to
 * {@link OrdinalMappingGenerator}; rule violations become compiler errors on the offending
 * element. When processing is over, the generated mappings are registered in
 * {@code META-INF/services/com.ethnicthv.enumset.core.api.IOrdinalMapping}.
 * <p>
 * Options:
 * <ul>
 *   <li>{@code enumset.verbose} - print progress notes (default false)</li>
 *   <li>{@code enumset.services} - write the service registration (default true)</li>
 *   <li>{@code enumset.suffix} - generated class name suffix (default {@code OrdinalMapping})</li>
 * </ul>
 */
@SupportedAnnotationTypes({
        "com.ethnicthv.enumset.core.annotation.CLike"
})
@SupportedOptions({
        OrdinalMappingProcessor.OPT_VERBOSE,
        OrdinalMappingProcessor.OPT_SERVICES,
        OrdinalMappingProcessor.OPT_SUFFIX
})
@AutoService(Processor.class)
public class OrdinalMappingProcessor extends BaseProcessor {
    // ---------------------------------------------------------------------
    // Constants
    // ---------------------------------------------------------------------
    public static final String OPT_VERBOSE = "enumset.verbose";
    public static final String OPT_SERVICES = "enumset.services";
    public static final String OPT_SUFFIX = "enumset.suffix";

    static final String ANNO_CLIKE = "com.ethnicthv.enumset.core.annotation.CLike";
    static final String SERVICE_FILE = "META-INF/services/com.ethnicthv.enumset.core.api.IOrdinalMapping";

    private OrdinalMappingGenerator generator;
    private Trees trees;
    private boolean writeServices;
    // Generated mapping classes across rounds, for the service registration
    private final Set<String> generatedMappings = new LinkedHashSet<>();

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------
    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        super.init(processingEnv);
        this.generator = new OrdinalMappingGenerator(
                option(OPT_SUFFIX, OrdinalMappingGenerator.DEFAULT_SUFFIX), getClass().getName());
        this.writeServices = booleanOption(OPT_SERVICES, true);
        try {
            this.trees = Trees.instance(processingEnv);
        } catch (IllegalArgumentException ex) {
            // not running inside javac
            this.trees = null;
        }
        note("OrdinalMappingProcessor init (trees=%s, services=%s)", trees != null, writeServices);
    }

    @Override
    protected String verboseOption() {
        return OPT_VERBOSE;
    }

    @Override
    public SourceVersion getSupportedSourceVersion() {
        return SourceVersion.latestSupported();
    }

    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        note("Processing round: annotations=%d over=%s", annotations.size(), roundEnv.processingOver());
        TypeElement clike = getTypeElement(ANNO_CLIKE);
        if (clike != null) {
            for (TypeElement type : ElementFilter.typesIn(roundEnv.getElementsAnnotatedWith(clike))) {
                processType(type);
            }
        }
        if (roundEnv.processingOver() && writeServices && !generatedMappings.isEmpty()) {
            try { writeServiceFile(); } catch (IOException ex) { error("Failed to write %s: %s", SERVICE_FILE, ex.getMessage()); }
        }
        return false;
    }

    // ---------------------------------------------------------------------
    // Per-type pipeline
    // ---------------------------------------------------------------------
    private void processType(TypeElement type) {
        note("Processing @CLike type: %s", type.getQualifiedName());
        TypeElement hidden = firstInaccessible(type);
        if (hidden != null && type.getKind() == ElementKind.ENUM) {
            error(type, "@CLike type %s must not be private or nested in a private type (%s)",
                    type.getQualifiedName(), hidden.getSimpleName());
            return;
        }

        EnumModel model = readModel(type);
        GeneratedSource source;
        try {
            source = generator.generate(model);
        } catch (IneligibleEnumException ex) {
            error(offendingElement(type, ex.getMemberName()), "%s", ex.getMessage());
            return;
        }
        try {
            writeSource(source, type);
            generatedMappings.add(source.qualifiedName());
            note("Generated %s (%d members)", source.qualifiedName(), model.members().size());
        } catch (IOException ex) {
            error(type, "Failed to generate ordinal mapping for %s: %s", type.getQualifiedName(), ex.getMessage());
        }
    }

    private EnumModel readModel(TypeElement type) {
        boolean isEnum = type.getKind() == ElementKind.ENUM;
        List<EnumMember> members = new ArrayList<>();
        if (isEnum) {
            for (Element e : type.getEnclosedElements()) {
                if (e.getKind() != ElementKind.ENUM_CONSTANT) continue;
                members.add(readMember((VariableElement) e));
            }
        }
        return new EnumModel(packageOf(type), nestedSimpleNames(type), isEnum, members);
    }

    private EnumMember readMember(VariableElement constant) {
        boolean hasData = false;
        boolean hasDiscriminant = false;
        if (trees != null) {
            Tree tree = trees.getTree(constant);
            if (tree instanceof VariableTree vt && vt.getInitializer() instanceof NewClassTree init) {
                hasData = init.getClassBody() != null;
                hasDiscriminant = !init.getArguments().isEmpty();
            }
        } else {
            warn(constant, "Cannot inspect enum constant %s without the javac tree API; assuming a plain constant",
                    constant.getSimpleName());
        }
        return new EnumMember(constant.getSimpleName().toString(), hasData, hasDiscriminant);
    }

    private static Element offendingElement(TypeElement type, String memberName) {
        if (memberName == null) return type;
        for (Element e : type.getEnclosedElements()) {
            if (e.getKind() == ElementKind.ENUM_CONSTANT && e.getSimpleName().contentEquals(memberName)) return e;
        }
        return type;
    }

    // ---------------------------------------------------------------------
    // Output
    // ---------------------------------------------------------------------
    private void writeSource(GeneratedSource source, TypeElement origin) throws IOException {
        JavaFileObject file = processingEnv.getFiler().createSourceFile(source.qualifiedName(), origin);
        try (Writer w = file.openWriter()) {
            w.write(source.code());
        }
    }

    private void writeServiceFile() throws IOException {
        Filer filer = processingEnv.getFiler();
        // keep registrations already in the output, e.g. hand-written mappings copied from resources
        Set<String> providers = new LinkedHashSet<>(readExistingProviders(filer));
        int existing = providers.size();
        providers.addAll(generatedMappings);
        FileObject file = filer.createResource(StandardLocation.CLASS_OUTPUT, "", SERVICE_FILE);
        try (Writer w = file.openWriter()) {
            for (String fqn : providers) w.write(fqn + "\n");
        }
        note("Registered %d ordinal mappings in %s (%d kept)", providers.size(), SERVICE_FILE, existing);
    }

    private List<String> readExistingProviders(Filer filer) {
        List<String> providers = new ArrayList<>();
        try {
            FileObject existing = filer.getResource(StandardLocation.CLASS_OUTPUT, "", SERVICE_FILE);
            try (BufferedReader r = new BufferedReader(new InputStreamReader(existing.openInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = r.readLine()) != null) {
                    int comment = line.indexOf('#');
                    if (comment >= 0) line = line.substring(0, comment);
                    line = line.trim();
                    if (!line.isEmpty()) providers.add(line);
                }
            }
        } catch (IOException ex) {
            note("No existing %s to merge: %s", SERVICE_FILE, ex.getMessage());
        }
        return providers;
    }
}
