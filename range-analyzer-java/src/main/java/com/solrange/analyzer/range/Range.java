package com.solrange.analyzer.range;

import com.solrange.analyzer.types.NumericDomain;
import com.solrange.analyzer.types.VarType;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Closed interval over a {@link NumericDomain}, an exact value, the empty range, or an
 * opaque range for values without a numeric view (strings, structs, unresolved types).
 *
 * Arithmetic never wraps: a result whose true endpoints leave the domain is saturated to the
 * domain and carries the {@code overflow} / {@code underflow} flag instead. Ranges are immutable.
 */
public final class Range {

    public enum Kind { VALUE, EMPTY, OPAQUE }

    private final Kind kind;
    private final NumericDomain domain;
    private final BigInteger min;
    private final BigInteger max;
    private final boolean literal;
    private final boolean overflow;
    private final boolean underflow;
    private final boolean divisionByZero;
    private final String reason;

    private Range(Kind kind, NumericDomain domain, BigInteger min, BigInteger max, boolean literal,
                  boolean overflow, boolean underflow, boolean divisionByZero, String reason) {
        this.kind = kind;
        this.domain = domain;
        this.min = min;
        this.max = max;
        this.literal = literal;
        this.overflow = overflow;
        this.underflow = underflow;
        this.divisionByZero = divisionByZero;
        this.reason = reason;
    }

    // --- Factories ---

    public static Range of(NumericDomain domain, BigInteger min, BigInteger max) {
        Objects.requireNonNull(domain, "domain");
        if (min.compareTo(max) > 0) {
            return empty(domain);
        }
        return new Range(Kind.VALUE, domain, min, max, false, false, false, false, null);
    }

    public static Range of(NumericDomain domain, long min, long max) {
        return of(domain, BigInteger.valueOf(min), BigInteger.valueOf(max));
    }

    public static Range exact(NumericDomain domain, BigInteger value) {
        return of(domain, value, value);
    }

    /** Exact range of a literal expression; literals adapt to the other operand's domain. */
    public static Range literal(NumericDomain domain, BigInteger value) {
        return new Range(Kind.VALUE, domain, value, value, true, false, false, false, null);
    }

    public static Range top(NumericDomain domain) {
        return of(domain, domain.min(), domain.max());
    }

    public static Range empty(NumericDomain domain) {
        return new Range(Kind.EMPTY, domain, null, null, false, false, false, false, null);
    }

    public static Range opaque(String reason) {
        return new Range(Kind.OPAQUE, null, null, null, false, false, false, false, reason);
    }

    /** Everything a variable of the declared type may hold. */
    public static Range top(VarType type) {
        if (!type.isNumeric()) {
            return opaque(type.isResolved() ? type.name() + " has no numeric range" : type.unresolved());
        }
        if (type.upperBound() != null) {
            return of(type.domain(), BigInteger.ZERO, type.upperBound());
        }
        return top(type.domain());
    }

    /** Default value of an uninitialised variable of the declared type. */
    public static Range zero(VarType type) {
        if (!type.isNumeric()) return top(type);
        return exact(type.domain(), BigInteger.ZERO);
    }

    public static Range bool(boolean value) {
        return exact(NumericDomain.BOOL, value ? BigInteger.ONE : BigInteger.ZERO);
    }

    public static Range boolTop() {
        return top(NumericDomain.BOOL);
    }

    // --- Accessors ---

    public Kind kind()              { return kind; }
    public NumericDomain domain()   { return domain; }
    public BigInteger min()         { return min; }
    public BigInteger max()         { return max; }
    public boolean isLiteral()      { return literal; }
    public boolean overflow()       { return overflow; }
    public boolean underflow()      { return underflow; }
    public boolean divisionByZero() { return divisionByZero; }
    public String reason()          { return reason; }

    public boolean isValue()  { return kind == Kind.VALUE; }
    public boolean isEmpty()  { return kind == Kind.EMPTY; }
    public boolean isOpaque() { return kind == Kind.OPAQUE; }

    public boolean isExact() {
        return kind == Kind.VALUE && min.equals(max);
    }

    public boolean isTop() {
        return kind == Kind.OPAQUE
                || (kind == Kind.VALUE && min.equals(domain.min()) && max.equals(domain.max()));
    }

    public boolean isExactBool(boolean value) {
        return isExact() && domain.bool() && (min.signum() != 0) == value;
    }

    /** True when arithmetic producing this range may have left its domain. */
    public boolean mayWrap() {
        return overflow || underflow;
    }

    public boolean contains(BigInteger value) {
        if (kind == Kind.OPAQUE) return true;
        if (kind == Kind.EMPTY) return false;
        return value.compareTo(min) >= 0 && value.compareTo(max) <= 0;
    }

    // --- Lattice operations ---

    /** Smallest interval covering both; flags of either side survive. */
    public Range union(Range other) {
        if (other == null) return this;
        if (kind == Kind.EMPTY) return other.orFlags(this);
        if (other.kind == Kind.EMPTY) return orFlags(other);
        if (kind == Kind.OPAQUE) return this;
        if (other.kind == Kind.OPAQUE) return other;
        NumericDomain d = domain.equals(other.domain) ? domain : NumericDomain.wider(domain, other.domain);
        return new Range(Kind.VALUE, d, min.min(other.min), max.max(other.max), false,
                overflow || other.overflow, underflow || other.underflow,
                divisionByZero || other.divisionByZero, null);
    }

    /** Values in both; keeps this range's domain and flags. Opaque acts as top. */
    public Range intersect(Range other) {
        if (other == null || other.kind == Kind.OPAQUE) return this;
        if (kind == Kind.OPAQUE) return other.withoutLiteral();
        if (kind == Kind.EMPTY) return this;
        if (other.kind == Kind.EMPTY) return empty(domain);
        BigInteger lo = min.max(other.min);
        BigInteger hi = max.min(other.max);
        if (lo.compareTo(hi) > 0) return empty(domain);
        return new Range(Kind.VALUE, domain, lo, hi, false, overflow, underflow, divisionByZero, null);
    }

    /**
     * Re-labels the range with the target's domain, as for an assignment: bounds are kept
     * and clamped to the target. Opaque becomes the target's top.
     */
    public Range retag(NumericDomain target) {
        if (target == null) return this;
        if (kind == Kind.OPAQUE) return top(target);
        if (kind == Kind.EMPTY) return empty(target);
        BigInteger lo = clamp(min, target);
        BigInteger hi = clamp(max, target);
        return new Range(Kind.VALUE, target, lo, hi, literal, overflow, underflow, divisionByZero, null);
    }

    /**
     * Explicit type conversion: values that fit keep their bounds, anything else may have
     * been truncated so the result is the target's top.
     */
    public Range convert(NumericDomain target) {
        if (kind == Kind.VALUE && target.contains(min) && target.contains(max)) {
            return new Range(Kind.VALUE, target, min, max, false, false, false, false, null);
        }
        if (kind == Kind.EMPTY) return empty(target);
        return top(target);
    }

    public Range withFlags(boolean overflow, boolean underflow, boolean divisionByZero) {
        return new Range(kind, domain, min, max, literal,
                this.overflow || overflow, this.underflow || underflow,
                this.divisionByZero || divisionByZero, reason);
    }

    public Range withoutLiteral() {
        if (!literal) return this;
        return new Range(kind, domain, min, max, false, overflow, underflow, divisionByZero, reason);
    }

    private Range orFlags(Range other) {
        return withFlags(other.overflow, other.underflow, other.divisionByZero);
    }

    private static BigInteger clamp(BigInteger v, NumericDomain d) {
        if (v.compareTo(d.min()) < 0) return d.min();
        if (v.compareTo(d.max()) > 0) return d.max();
        return v;
    }

    // --- Object ---

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Range r)) return false;
        return kind == r.kind
                && literal == r.literal
                && overflow == r.overflow
                && underflow == r.underflow
                && divisionByZero == r.divisionByZero
                && Objects.equals(domain, r.domain)
                && Objects.equals(min, r.min)
                && Objects.equals(max, r.max)
                && Objects.equals(reason, r.reason);
    }

    /** Same values regardless of flags and literal-ness. */
    public boolean sameBounds(Range r) {
        return r != null && kind == r.kind && Objects.equals(domain, r.domain)
                && Objects.equals(min, r.min) && Objects.equals(max, r.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, domain, min, max, literal, overflow, underflow, divisionByZero, reason);
    }

    /** Bounds only, e.g. {@code [0, 255]}, {@code 7}, {@code true}, {@code empty}. */
    public String describe() {
        return switch (kind) {
            case OPAQUE -> "unknown" + (reason != null ? " (" + reason + ")" : "");
            case EMPTY -> "empty";
            case VALUE -> {
                if (domain.bool()) {
                    yield isExact() ? String.valueOf(min.signum() != 0) : "{false, true}";
                }
                yield isExact() ? min.toString() : "[" + min + ", " + max + "]";
            }
        };
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(describe());
        if (domain != null) sb.append(" : ").append(domain);
        if (overflow) sb.append(" (may overflow)");
        if (underflow) sb.append(" (may underflow)");
        if (divisionByZero) sb.append(" (may divide by zero)");
        return sb.toString();
    }
}
