package com.ethnicthv.enumset.core.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Requests a generated {@link com.ethnicthv.enumset.core.api.IOrdinalMapping} for an enum.
 * <p>
 * The enum must be C-like: at most 32 constants, no constant-specific class bodies and
 * no constructor arguments on its constants. Ordinals are assigned by declaration
 * position. Anything else fails compilation.
 * <p>
 * Example usage:
 * <pre>{@code
 * @CLike
 * public enum Permission { READ, WRITE, EXECUTE }
 *
 * EnumBitSet<Permission> granted = EnumBitSet.noneOf(PermissionOrdinalMapping.INSTANCE);
 * granted.add(Permission.READ);
 * }</pre>
 * The generated class is named after the enum (nested names joined with {@code _}) plus
 * {@code OrdinalMapping}, lives in the same package and is registered for
 * {@link java.util.ServiceLoader} so that {@code EnumBitSet.noneOf(Permission.class)} finds it.
 */
@Documented
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.TYPE)
public @interface CLike {
}
