package com.ethnicthv.enumset.core.mapping;

import com.ethnicthv.enumset.core.api.IOrdinalMapping;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Lookup and verification helpers for {@link IOrdinalMapping} implementations.
 * <p>
 * Generated mappings are registered under
 * {@code META-INF/services/com.ethnicthv.enumset.core.api.IOrdinalMapping} and resolved
 * here through {@link ServiceLoader}, once per element type.
 */
public final class OrdinalMappings {
    private static final int MAX_ORDINALS = Integer.SIZE;

    private static final ClassValue<IOrdinalMapping<?>> REGISTRY = new ClassValue<>() {
        @Override
        protected IOrdinalMapping<?> computeValue(Class<?> type) {
            return load(type);
        }
    };

    private OrdinalMappings() {}

    /**
     * Resolve the registered mapping for {@code type}.
     *
     * Providers that fail to load are skipped; if {@code type} is then not found, the first
     * such failure is attached as the cause.
     *
     * @throws IllegalArgumentException if no mapping for {@code type} is registered
     */
    @SuppressWarnings("unchecked")
    public static <E> IOrdinalMapping<E> forType(Class<E> type) {
        Objects.requireNonNull(type, "type");
        return (IOrdinalMapping<E>) REGISTRY.get(type);
    }

    private static IOrdinalMapping<?> load(Class<?> type) {
        ClassLoader loader = type.getClassLoader();
        if (loader == null) loader = ClassLoader.getSystemClassLoader();
        @SuppressWarnings("rawtypes")
        Iterator<IOrdinalMapping> services = ServiceLoader.load(IOrdinalMapping.class, loader).iterator();
        ServiceConfigurationError firstFailure = null;
        while (true) {
            IOrdinalMapping<?> candidate;
            try {
                if (!services.hasNext()) break;
                candidate = services.next();
            } catch (ServiceConfigurationError err) {
                // the iterator moves past a provider that fails to load
                if (firstFailure == null) firstFailure = err;
                continue;
            }
            if (candidate.type() == type) return candidate;
        }
        throw new IllegalArgumentException("No ordinal mapping registered for " + type.getName()
                + "; annotate it with @CLike or pass a mapping explicitly", firstFailure);
    }

    /**
     * Check that {@code mapping} is a usable bijection over {@code values}:
     * every ordinal fits the 32-bit mask, no two values share an ordinal and
     * {@code fromOrdinal(toOrdinal(v))} gives back {@code v}.
     *
     * @throws IllegalStateException naming the first offending value
     */
    public static <E> void verify(IOrdinalMapping<E> mapping, Iterable<? extends E> values) {
        Objects.requireNonNull(mapping, "mapping");
        Map<Integer, E> seen = new HashMap<>();
        for (E value : values) {
            int ordinal = mapping.toOrdinal(value);
            if (ordinal < 0 || ordinal >= MAX_ORDINALS) {
                throw new IllegalStateException(String.format("%s maps %s to ordinal %d, outside [0, %d)",
                        mapping.type().getName(), value, ordinal, MAX_ORDINALS));
            }
            E previous = seen.putIfAbsent(ordinal, value);
            if (previous != null && !previous.equals(value)) {
                throw new IllegalStateException(String.format("%s maps both %s and %s to ordinal %d",
                        mapping.type().getName(), previous, value, ordinal));
            }
            E back = mapping.fromOrdinal(ordinal);
            if (!value.equals(back)) {
                throw new IllegalStateException(String.format("%s maps %s to ordinal %d but ordinal %d back to %s",
                        mapping.type().getName(), value, ordinal, ordinal, back));
            }
        }
    }
}
