package com.solrange.analyzer.range;

import java.math.BigInteger;

/**
 * Restriction {@code variable op operand} derived from a branch predicate or an assertion.
 * The operand is the range of the other side of the comparison at the point it was evaluated.
 *
 * @param variable    source name being restricted
 * @param op          comparison with the variable on the left
 * @param operand     range of the right-hand side
 * @param operandText rendering of the right-hand side, for reports
 */
public record Constraint(String variable, CompareOp op, Range operand, String operandText) {

    public Constraint negate() {
        return new Constraint(variable, op.negate(), operand, operandText);
    }

    /**
     * Whether a concrete value of the variable satisfies the constraint for every value the
     * operand may take. With an exact operand this is the plain comparison.
     */
    public boolean admits(BigInteger value) {
        if (!operand.isValue()) return true;
        Range single = Range.exact(operand.domain(), value);
        return op.holdsForAll(single, operand);
    }

    /**
     * Narrows {@code current} to the values that can satisfy the constraint for some operand
     * value. An unsatisfiable constraint yields the empty range; an opaque operand restricts nothing.
     */
    public Range narrow(Range current) {
        if (!current.isValue() || !operand.isValue()) {
            return current;
        }
        BigInteger lo = current.min();
        BigInteger hi = current.max();
        switch (op) {
            case LT -> hi = hi.min(operand.max().subtract(BigInteger.ONE));
            case LE -> hi = hi.min(operand.max());
            case GT -> lo = lo.max(operand.min().add(BigInteger.ONE));
            case GE -> lo = lo.max(operand.min());
            case EQ -> {
                lo = lo.max(operand.min());
                hi = hi.min(operand.max());
            }
            case NE -> {
                if (operand.isExact()) {
                    if (lo.equals(operand.min())) lo = lo.add(BigInteger.ONE);
                    if (hi.equals(operand.min())) hi = hi.subtract(BigInteger.ONE);
                }
            }
        }
        if (lo.equals(current.min()) && hi.equals(current.max())) {
            return current;
        }
        if (lo.compareTo(hi) > 0) {
            return Range.empty(current.domain());
        }
        return Range.of(current.domain(), lo, hi)
                .withFlags(current.overflow(), current.underflow(), current.divisionByZero());
    }

    public String describe() {
        return variable + " " + op.symbol() + " " + operandText;
    }

    @Override
    public String toString() {
        return describe();
    }
}
