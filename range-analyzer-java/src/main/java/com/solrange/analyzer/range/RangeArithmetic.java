package com.solrange.analyzer.range;

import com.solrange.analyzer.ast.SolAst.BinaryOp;
import com.solrange.analyzer.ast.SolAst.UnaryOp;
import com.solrange.analyzer.types.NumericDomain;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Interval images of the binary and unary operators.
 *
 * Checked operators (+ - * / % **) compute the true mathematical endpoints, then saturate
 * to the result domain and set overflow/underflow when an endpoint combination leaves it.
 * Bitwise operators and shifts truncate at runtime, so they fall back to top rather than flag.
 */
public final class RangeArithmetic {

    private static final int MAX_EXACT_EXPONENT = 1024;

    private RangeArithmetic() {}

    /**
     * Domain of {@code a op b}: a literal takes the domain of the non-literal side,
     * otherwise the wider of the two.
     */
    public static NumericDomain resultDomain(Range a, Range b) {
        if (a.isLiteral() && !b.isLiteral()) return b.domain();
        if (b.isLiteral() && !a.isLiteral()) return a.domain();
        return NumericDomain.wider(a.domain(), b.domain());
    }

    public static Range apply(BinaryOp op, Range a, Range b) {
        if (op.isComparison()) return compare(op, a, b);
        if (op.isLogical()) return logical(op, a, b);

        if (a.isOpaque() && b.isOpaque()) {
            return Range.opaque("operands of " + op.symbol() + " have no numeric range");
        }
        if (a.isOpaque()) return Range.top(b.domain());
        if (b.isOpaque()) return Range.top(a.domain());
        NumericDomain domain = resultDomain(a, b);
        if (a.isEmpty() || b.isEmpty()) return Range.empty(domain);

        boolean literal = a.isLiteral() && b.isLiteral();
        return switch (op) {
            case ADD -> saturate(domain, a.min().add(b.min()), a.max().add(b.max()), literal, false);
            case SUB -> saturate(domain, a.min().subtract(b.max()), a.max().subtract(b.min()), literal, false);
            case MUL -> corners(domain, a, b, BigInteger::multiply, literal);
            case DIV -> divide(domain, a, b, literal);
            case MOD -> modulo(domain, a, b, literal);
            case POW -> power(domain, a, b, literal);
            case BIT_AND -> bitAnd(domain, a, b);
            case BIT_OR, BIT_XOR -> bitOr(domain, a, b);
            case SHL -> shiftLeft(domain, a, b);
            case SHR -> shiftRight(domain, a, b);
            default -> Range.top(domain);
        };
    }

    public static Range apply(UnaryOp op, Range a) {
        if (a.isOpaque() || a.isEmpty()) return a;
        NumericDomain d = a.domain();
        return switch (op) {
            case NEG -> {
                if (a.isLiteral()) {
                    BigInteger v = a.min().negate();
                    yield Range.literal(v.signum() < 0 ? NumericDomain.INT256 : d, v);
                }
                yield saturate(d, a.max().negate(), a.min().negate(), false, false);
            }
            case NOT -> {
                if (a.isExactBool(true)) yield Range.bool(false);
                if (a.isExactBool(false)) yield Range.bool(true);
                yield Range.boolTop();
            }
            case BIT_NOT -> d.signed()
                    ? Range.of(d, a.max().negate().subtract(BigInteger.ONE), a.min().negate().subtract(BigInteger.ONE))
                    : Range.of(d, d.max().subtract(a.max()), d.max().subtract(a.min()));
            case PRE_INC, POST_INC -> apply(BinaryOp.ADD, a, Range.literal(d, BigInteger.ONE));
            case PRE_DEC, POST_DEC -> apply(BinaryOp.SUB, a, Range.literal(d, BigInteger.ONE));
            case DELETE -> Range.exact(d, BigInteger.ZERO);
        };
    }

    /**
     * Truth value of a comparison: exact when the operand ranges decide it, {@code {false, true}}
     * otherwise.
     */
    public static Range compare(BinaryOp op, Range a, Range b) {
        if (!a.isValue() || !b.isValue()) {
            return a.isEmpty() || b.isEmpty() ? Range.empty(NumericDomain.BOOL) : Range.boolTop();
        }
        CompareOp cmp = CompareOp.from(op);
        if (cmp.holdsForAll(a, b)) return Range.bool(true);
        if (cmp.negate().holdsForAll(a, b)) return Range.bool(false);
        return Range.boolTop();
    }

    private static Range logical(BinaryOp op, Range a, Range b) {
        if (op == BinaryOp.AND) {
            if (a.isExactBool(false) || b.isExactBool(false)) return Range.bool(false);
            if (a.isExactBool(true) && b.isExactBool(true)) return Range.bool(true);
        } else {
            if (a.isExactBool(true) || b.isExactBool(true)) return Range.bool(true);
            if (a.isExactBool(false) && b.isExactBool(false)) return Range.bool(false);
        }
        return Range.boolTop();
    }

    /** Clamps true endpoints to the domain, flagging what fell outside. */
    static Range saturate(NumericDomain d, BigInteger lo, BigInteger hi, boolean literal, boolean divByZero) {
        boolean overflow = hi.compareTo(d.max()) > 0;
        boolean underflow = lo.compareTo(d.min()) < 0;
        if (literal && !overflow && !underflow && lo.equals(hi)) {
            return Range.literal(d, lo).withFlags(false, false, divByZero);
        }
        BigInteger clampedLo = lo.max(d.min()).min(d.max());
        BigInteger clampedHi = hi.min(d.max()).max(d.min());
        return Range.of(d, clampedLo, clampedHi).withFlags(overflow, underflow, divByZero);
    }

    private interface Op {
        BigInteger apply(BigInteger x, BigInteger y);
    }

    private static Range corners(NumericDomain d, Range a, Range b, Op op, boolean literal) {
        List<BigInteger> values = List.of(
                op.apply(a.min(), b.min()), op.apply(a.min(), b.max()),
                op.apply(a.max(), b.min()), op.apply(a.max(), b.max()));
        return saturate(d, Collections.min(values), Collections.max(values), literal, false);
    }

    /** Non-zero divisors worth trying: the endpoints, and -1 / 1 when they lie inside. */
    private static List<BigInteger> divisors(Range b) {
        List<BigInteger> out = new ArrayList<>();
        if (b.min().signum() != 0) out.add(b.min());
        if (b.max().signum() != 0) out.add(b.max());
        if (b.contains(BigInteger.ONE)) out.add(BigInteger.ONE);
        if (b.contains(BigInteger.ONE.negate())) out.add(BigInteger.ONE.negate());
        return out;
    }

    private static Range divide(NumericDomain d, Range a, Range b, boolean literal) {
        boolean divByZero = b.contains(BigInteger.ZERO);
        List<BigInteger> ds = divisors(b);
        if (ds.isEmpty()) {
            return Range.empty(d).withFlags(false, false, true);
        }
        List<BigInteger> values = new ArrayList<>();
        for (BigInteger divisor : ds) {
            // BigInteger.divide truncates toward zero, as the EVM does
            values.add(a.min().divide(divisor));
            values.add(a.max().divide(divisor));
        }
        return saturate(d, Collections.min(values), Collections.max(values), literal, divByZero);
    }

    private static Range modulo(NumericDomain d, Range a, Range b, boolean literal) {
        boolean divByZero = b.contains(BigInteger.ZERO);
        List<BigInteger> ds = divisors(b);
        if (ds.isEmpty()) {
            return Range.empty(d).withFlags(false, false, true);
        }
        if (a.isExact() && b.isExact()) {
            return saturate(d, a.min().remainder(b.min()), a.min().remainder(b.min()), literal, false);
        }
        BigInteger m = ds.stream().map(BigInteger::abs).max(BigInteger::compareTo).orElseThrow();
        BigInteger bound = m.subtract(BigInteger.ONE);
        BigInteger minAbsDivisor = ds.stream().map(BigInteger::abs).min(BigInteger::compareTo).orElseThrow();
        if (a.min().signum() >= 0 && a.max().compareTo(minAbsDivisor) < 0 && !b.contains(BigInteger.ZERO)
                && b.min().signum() > 0) {
            // every divisor exceeds every dividend
            return Range.of(d, a.min(), a.max()).withFlags(false, false, divByZero);
        }
        BigInteger lo = a.min().signum() >= 0 ? BigInteger.ZERO : a.min().max(bound.negate());
        BigInteger hi = a.max().signum() <= 0 ? BigInteger.ZERO : a.max().min(bound);
        return Range.of(d, lo, hi).withFlags(false, false, divByZero);
    }

    private static Range power(NumericDomain d, Range a, Range b, boolean literal) {
        if (a.min().signum() < 0 || b.min().signum() < 0) return Range.top(d);
        BigInteger beyond = d.max().add(BigInteger.ONE);
        List<BigInteger> values = new ArrayList<>();
        for (BigInteger base : List.of(a.min(), a.max())) {
            for (BigInteger exp : List.of(b.min(), b.max())) {
                values.add(pow(base, exp, beyond));
            }
        }
        return saturate(d, Collections.min(values), Collections.max(values), literal, false);
    }

    /** base^exp, or {@code beyond} when the result is certainly larger than the domain. */
    private static BigInteger pow(BigInteger base, BigInteger exp, BigInteger beyond) {
        if (base.signum() == 0) return exp.signum() == 0 ? BigInteger.ONE : BigInteger.ZERO;
        if (base.equals(BigInteger.ONE)) return BigInteger.ONE;
        if (exp.compareTo(BigInteger.valueOf(MAX_EXACT_EXPONENT)) > 0) return beyond;
        BigInteger result = base.pow(exp.intValueExact());
        return result.compareTo(beyond) > 0 ? beyond : result;
    }

    private static Range bitAnd(NumericDomain d, Range a, Range b) {
        if (d.signed() || a.min().signum() < 0 || b.min().signum() < 0) return Range.top(d);
        if (a.isExact() && b.isExact()) return Range.exact(d, a.min().and(b.min()));
        return Range.of(d, BigInteger.ZERO, a.max().min(b.max()));
    }

    private static Range bitOr(NumericDomain d, Range a, Range b) {
        if (d.signed() || a.min().signum() < 0 || b.min().signum() < 0) return Range.top(d);
        int bits = a.max().max(b.max()).bitLength();
        BigInteger hi = BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE).min(d.max());
        return Range.of(d, BigInteger.ZERO, hi);
    }

    private static Range shiftLeft(NumericDomain d, Range a, Range b) {
        if (d.signed() || a.min().signum() < 0 || b.min().signum() < 0 || !b.isExact()
                || b.min().compareTo(BigInteger.valueOf(d.bits())) >= 0) {
            return Range.top(d);
        }
        int shift = b.min().intValueExact();
        BigInteger hi = a.max().shiftLeft(shift);
        if (hi.compareTo(d.max()) > 0) return Range.top(d);
        return Range.of(d, a.min().shiftLeft(shift), hi);
    }

    private static Range shiftRight(NumericDomain d, Range a, Range b) {
        if (d.signed() || a.min().signum() < 0 || b.min().signum() < 0) return Range.top(d);
        int maxShift = b.max().min(BigInteger.valueOf(d.bits())).intValueExact();
        int minShift = b.min().min(BigInteger.valueOf(d.bits())).intValueExact();
        return Range.of(d, a.min().shiftRight(maxShift), a.max().shiftRight(minShift));
    }
}
