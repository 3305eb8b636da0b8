package com.solrange.analyzer.range;

import com.solrange.analyzer.ast.SolAst.BinaryOp;

import java.math.BigInteger;

public enum CompareOp {
    LT("<"), LE("<="), GT(">"), GE(">="), EQ("=="), NE("!=");

    private final String symbol;

    CompareOp(String symbol) { this.symbol = symbol; }

    public String symbol() { return symbol; }

    public static CompareOp from(BinaryOp op) {
        return switch (op) {
            case LT -> LT;
            case LE -> LE;
            case GT -> GT;
            case GE -> GE;
            case EQ -> EQ;
            case NE -> NE;
            default -> throw new IllegalArgumentException("Not a comparison: " + op.symbol());
        };
    }

    /** Logical negation: {@code !(a < b)} is {@code a >= b}. */
    public CompareOp negate() {
        return switch (this) {
            case LT -> GE;
            case LE -> GT;
            case GT -> LE;
            case GE -> LT;
            case EQ -> NE;
            case NE -> EQ;
        };
    }

    /** Operand swap: {@code a < b} is {@code b > a}. */
    public CompareOp flip() {
        return switch (this) {
            case LT -> GT;
            case LE -> GE;
            case GT -> LT;
            case GE -> LE;
            case EQ, NE -> this;
        };
    }

    public boolean test(BigInteger a, BigInteger b) {
        int c = a.compareTo(b);
        return switch (this) {
            case LT -> c < 0;
            case LE -> c <= 0;
            case GT -> c > 0;
            case GE -> c >= 0;
            case EQ -> c == 0;
            case NE -> c != 0;
        };
    }

    /** True when every pair drawn from the two (non-empty value) ranges satisfies the comparison. */
    public boolean holdsForAll(Range a, Range b) {
        return switch (this) {
            case LT -> a.max().compareTo(b.min()) < 0;
            case LE -> a.max().compareTo(b.min()) <= 0;
            case GT -> a.min().compareTo(b.max()) > 0;
            case GE -> a.min().compareTo(b.max()) >= 0;
            case EQ -> a.isExact() && b.isExact() && a.min().equals(b.min());
            case NE -> a.max().compareTo(b.min()) < 0 || a.min().compareTo(b.max()) > 0;
        };
    }
}
