package com.solrange.analyzer.types;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * An exact compile-time value with its representation tag.
 * Numeric kinds keep their value in {@code number}; strings in {@code text}.
 */
public record Concrete(Kind kind, int width, BigInteger number, String text) {

    public enum Kind { UINT, BYTES, ADDRESS, STRING, BOOL }

    public static Concrete uint(int width, BigInteger value) {
        return new Concrete(Kind.UINT, width, value, null);
    }

    public static Concrete bytes(int width, BigInteger value) {
        return new Concrete(Kind.BYTES, width, value, null);
    }

    public static Concrete address(BigInteger value) {
        return new Concrete(Kind.ADDRESS, 160, value, null);
    }

    public static Concrete string(String value) {
        return new Concrete(Kind.STRING, value.getBytes(StandardCharsets.UTF_8).length, null, value);
    }

    public static Concrete bool(boolean value) {
        return new Concrete(Kind.BOOL, 1, value ? BigInteger.ONE : BigInteger.ZERO, null);
    }

    /** Domain the value lives in, empty for strings. */
    public Optional<NumericDomain> domain() {
        return switch (kind) {
            case UINT -> Optional.of(NumericDomain.uint(width));
            case BYTES -> Optional.of(NumericDomain.uint(width * 8));
            case ADDRESS -> Optional.of(NumericDomain.ADDRESS);
            case BOOL -> Optional.of(NumericDomain.BOOL);
            case STRING -> Optional.empty();
        };
    }

    public String asString() {
        return switch (kind) {
            case UINT -> number.toString();
            case BYTES, ADDRESS -> "0x" + number.toString(16);
            case BOOL -> number.signum() != 0 ? "true" : "false";
            case STRING -> text;
        };
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + (width > 0 && number != null ? String.valueOf(width) : "")
                + "(" + asString() + ")";
    }
}
