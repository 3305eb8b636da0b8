package com.solrange.analyzer.types;

/**
 * Dynamic-size container type. Element and key types are graph handles so that a struct
 * may refer to itself through an array or mapping; {@code -1} marks an absent slot.
 */
public record DynBuiltin(Kind kind, int valueType, int keyType, int length) {

    public enum Kind { ARRAY, FIXED_ARRAY, MAPPING, STRING, BYTES }

    public static final DynBuiltin STRING = new DynBuiltin(Kind.STRING, -1, -1, -1);
    public static final DynBuiltin BYTES = new DynBuiltin(Kind.BYTES, -1, -1, -1);

    public static DynBuiltin array(int elementType) {
        return new DynBuiltin(Kind.ARRAY, elementType, -1, -1);
    }

    public static DynBuiltin fixedArray(int elementType, int length) {
        return new DynBuiltin(Kind.FIXED_ARRAY, elementType, -1, length);
    }

    public static DynBuiltin mapping(int keyType, int valueType) {
        return new DynBuiltin(Kind.MAPPING, valueType, keyType, -1);
    }

    /** True for containers indexed with {@code []} whose element is {@link #valueType()}. */
    public boolean isIndexable() {
        return kind == Kind.ARRAY || kind == Kind.FIXED_ARRAY || kind == Kind.MAPPING;
    }
}
