package com.solrange.analyzer.types;

import java.math.BigInteger;

/**
 * A declared type resolved against the graph.
 *
 * @param handle     graph node of the type (builtin, dyn-builtin, user type or placeholder)
 * @param name       display name as written in source
 * @param domain     numeric view, null for types without one
 * @param upperBound tighter maximum than the domain's (enum member count - 1), or null
 * @param unresolved reason the type could not be resolved, or null
 */
public record VarType(int handle, String name, NumericDomain domain, BigInteger upperBound, String unresolved) {

    public static VarType numeric(int handle, String name, NumericDomain domain) {
        return new VarType(handle, name, domain, null, null);
    }

    public static VarType opaque(int handle, String name) {
        return new VarType(handle, name, null, null, null);
    }

    public static VarType unknown(int handle, String name) {
        return new VarType(handle, name, null, null, "unknown type " + name);
    }

    public boolean isNumeric() {
        return domain != null;
    }

    public boolean isResolved() {
        return unresolved == null;
    }

    @Override
    public String toString() {
        return name;
    }
}
