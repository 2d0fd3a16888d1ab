package com.ethnicthv.enumset.demo;

import com.ethnicthv.enumset.core.set.EnumBitSet;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Role based permission checks on top of {@link EnumBitSet}.
 */
public class AccessControlDemo {
    private final Map<String, EnumBitSet<Permission>> roles = new LinkedHashMap<>();

    public AccessControlDemo() {
        roles.put("viewer", EnumBitSet.of(PermissionOrdinalMapping.INSTANCE, Permission.READ));
        roles.put("editor", EnumBitSet.of(PermissionOrdinalMapping.INSTANCE, Permission.READ, Permission.WRITE));
        roles.put("operator", EnumBitSet.of(PermissionOrdinalMapping.INSTANCE, Permission.READ, Permission.EXECUTE));
        roles.put("admin", EnumBitSet.of(PermissionOrdinalMapping.INSTANCE, Permission.values()));
    }

    /**
     * Union of the permissions of every named role; unknown roles grant nothing.
     */
    public EnumBitSet<Permission> grantedTo(String... roleNames) {
        EnumBitSet<Permission> granted = EnumBitSet.noneOf(Permission.class);
        for (String role : roleNames) {
            EnumBitSet<Permission> perms = roles.get(role);
            if (perms != null) granted = granted.union(perms);
        }
        return granted;
    }

    public boolean allows(EnumBitSet<Permission> granted, EnumBitSet<Permission> required) {
        return granted.isSupersetOf(required);
    }

    public static void main(String[] args) {
        AccessControlDemo demo = new AccessControlDemo();
        EnumBitSet<Permission> granted = demo.grantedTo("editor", "operator");
        EnumBitSet<Permission> required = EnumBitSet.of(PermissionOrdinalMapping.INSTANCE, Permission.WRITE, Permission.DELETE);
        System.out.println("=== Access Control Demo ===");
        System.out.println("granted:  " + granted);
        System.out.println("required: " + required);
        System.out.println("allowed:  " + demo.allows(granted, required));
        System.out.println("missing:  " + required.difference(granted));
    }
}
