package com.solrange.analyzer.types;

import java.math.BigInteger;

/**
 * The value set of a fixed-width integer: bit width plus signedness.
 * Booleans are modelled as the 1-bit unsigned domain flagged {@code bool}.
 */
public record NumericDomain(int bits, boolean signed, boolean bool) {

    public static final NumericDomain BOOL = new NumericDomain(1, false, true);
    public static final NumericDomain UINT256 = uint(256);
    public static final NumericDomain INT256 = sint(256);
    public static final NumericDomain ADDRESS = uint(160);

    public NumericDomain {
        if (bits < 1 || bits > 256) {
            throw new IllegalArgumentException("Unsupported bit width: " + bits);
        }
    }

    public static NumericDomain uint(int bits) {
        return new NumericDomain(bits, false, false);
    }

    public static NumericDomain sint(int bits) {
        return new NumericDomain(bits, true, false);
    }

    public BigInteger min() {
        return signed ? BigInteger.ONE.shiftLeft(bits - 1).negate() : BigInteger.ZERO;
    }

    public BigInteger max() {
        return signed
                ? BigInteger.ONE.shiftLeft(bits - 1).subtract(BigInteger.ONE)
                : BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
    }

    public boolean contains(BigInteger value) {
        return value.compareTo(min()) >= 0 && value.compareTo(max()) <= 0;
    }

    /**
     * Domain of an arithmetic result over two operand domains: the wider width,
     * signed if either side is signed.
     */
    public static NumericDomain wider(NumericDomain a, NumericDomain b) {
        if (a.bool && b.bool) return a;
        if (a.bool) return b;
        if (b.bool) return a;
        return new NumericDomain(Math.max(a.bits, b.bits), a.signed || b.signed, false);
    }

    @Override
    public String toString() {
        if (bool) return "bool";
        return (signed ? "int" : "uint") + bits;
    }
}
