package com.solrange.analyzer.types;

import java.util.Optional;

/**
 * Fixed-size elementary type. Dynamic-size types (string, bytes, arrays, mappings)
 * are {@link DynBuiltin}s.
 */
public record Builtin(Kind kind, int size) {

    public enum Kind { UINT, INT, BYTES, ADDRESS, PAYABLE_ADDRESS, BOOL }

    public static final Builtin BOOL = new Builtin(Kind.BOOL, 0);
    public static final Builtin ADDRESS = new Builtin(Kind.ADDRESS, 0);
    public static final Builtin UINT256 = new Builtin(Kind.UINT, 256);

    /**
     * Parses an elementary type name ("uint", "int64", "bytes4", "address payable", ...).
     * Returns empty for dynamic or unknown names.
     */
    public static Optional<Builtin> tryFrom(String name) {
        if (name == null) return Optional.empty();
        String n = name.trim();
        switch (n) {
            case "bool":            return Optional.of(BOOL);
            case "address":         return Optional.of(ADDRESS);
            case "address payable": return Optional.of(new Builtin(Kind.PAYABLE_ADDRESS, 0));
            case "uint":            return Optional.of(UINT256);
            case "int":             return Optional.of(new Builtin(Kind.INT, 256));
            case "byte":            return Optional.of(new Builtin(Kind.BYTES, 1));
            default:                break;
        }
        if (n.startsWith("uint")) return sized(Kind.UINT, n.substring(4), 8, 256, 8);
        if (n.startsWith("int"))  return sized(Kind.INT, n.substring(3), 8, 256, 8);
        if (n.startsWith("bytes") && n.length() > 5) return sized(Kind.BYTES, n.substring(5), 1, 32, 1);
        return Optional.empty();
    }

    private static Optional<Builtin> sized(Kind kind, String digits, int min, int max, int step) {
        try {
            int size = Integer.parseInt(digits);
            if (size < min || size > max || size % step != 0) return Optional.empty();
            return Optional.of(new Builtin(kind, size));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /** Numeric view of the type; every fixed-size elementary type has one. */
    public NumericDomain domain() {
        return switch (kind) {
            case UINT -> NumericDomain.uint(size);
            case INT -> NumericDomain.sint(size);
            case BYTES -> NumericDomain.uint(size * 8);
            case ADDRESS, PAYABLE_ADDRESS -> NumericDomain.ADDRESS;
            case BOOL -> NumericDomain.BOOL;
        };
    }

    public String typeName() {
        return switch (kind) {
            case UINT -> "uint" + size;
            case INT -> "int" + size;
            case BYTES -> "bytes" + size;
            case ADDRESS -> "address";
            case PAYABLE_ADDRESS -> "address payable";
            case BOOL -> "bool";
        };
    }

    @Override
    public String toString() {
        return typeName();
    }
}
