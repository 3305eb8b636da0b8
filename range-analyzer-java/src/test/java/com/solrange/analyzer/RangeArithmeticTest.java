package com.solrange.analyzer;

import com.solrange.analyzer.ast.SolAst.BinaryOp;
import com.solrange.analyzer.ast.SolAst.UnaryOp;
import com.solrange.analyzer.range.Range;
import com.solrange.analyzer.range.RangeArithmetic;
import com.solrange.analyzer.types.NumericDomain;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class RangeArithmeticTest {

    private static final NumericDomain U8 = NumericDomain.uint(8);

    private static Range lit(long v) {
        return Range.literal(NumericDomain.UINT256, BigInteger.valueOf(v));
    }

    @Test
    void additionPastDomainMaximumIsFlaggedAsOverflow() {
        Range r = RangeArithmetic.apply(BinaryOp.ADD, Range.of(U8, 250, 255), lit(10));
        assertTrue(r.overflow());
        assertEquals(U8, r.domain(), "literal takes the other operand's domain");
        assertEquals(BigInteger.valueOf(255), r.max());
    }

    @Test
    void smallLiteralStillFlagsWhenUpperBoundOverflows() {
        Range r = RangeArithmetic.apply(BinaryOp.ADD, Range.of(U8, 250, 255), lit(3));
        assertTrue(r.overflow());
        assertEquals(BigInteger.valueOf(253), r.min());
        assertEquals(BigInteger.valueOf(255), r.max());
    }

    @Test
    void additionStayingInDomainIsNotFlagged() {
        Range r = RangeArithmetic.apply(BinaryOp.ADD, Range.of(U8, 250, 252), lit(3));
        assertFalse(r.overflow());
        assertFalse(r.mayWrap());
        assertEquals(BigInteger.valueOf(253), r.min());
        assertEquals(BigInteger.valueOf(255), r.max());
    }

    @Test
    void subtractionBelowZeroIsFlaggedAsUnderflow() {
        Range r = RangeArithmetic.apply(BinaryOp.SUB, Range.of(U8, 0, 5), lit(1));
        assertTrue(r.underflow());
        assertFalse(r.overflow());
        assertEquals(BigInteger.ZERO, r.min());
        assertEquals(BigInteger.valueOf(4), r.max());
    }

    @Test
    void literalArithmeticStaysExactLiteral() {
        Range r = RangeArithmetic.apply(BinaryOp.MUL, lit(6), lit(7));
        assertTrue(r.isExact());
        assertTrue(r.isLiteral());
        assertEquals(BigInteger.valueOf(42), r.min());
    }

    @Test
    void resultDomainIsTheWiderOperand() {
        Range r = RangeArithmetic.apply(BinaryOp.ADD, Range.of(U8, 0, 1), Range.of(NumericDomain.uint(16), 0, 1));
        assertEquals(NumericDomain.uint(16), r.domain());
    }

    @Test
    void divisorRangeContainingZeroSetsFlag() {
        Range r = RangeArithmetic.apply(BinaryOp.DIV, Range.of(U8, 10, 20), Range.of(U8, 0, 2));
        assertTrue(r.divisionByZero());
        assertEquals(BigInteger.valueOf(5), r.min());
        assertEquals(BigInteger.valueOf(20), r.max());
    }

    @Test
    void moduloIsBoundedByDivisor() {
        Range r = RangeArithmetic.apply(BinaryOp.MOD, Range.of(U8, 0, 100), lit(10));
        assertEquals(BigInteger.ZERO, r.min());
        assertEquals(BigInteger.valueOf(9), r.max());
        assertFalse(r.divisionByZero());
    }

    @Test
    void comparisonIsExactWhenRangesDecideIt() {
        assertTrue(RangeArithmetic.compare(BinaryOp.LT, Range.of(U8, 0, 4), lit(5)).isExactBool(true));
        assertTrue(RangeArithmetic.compare(BinaryOp.GE, Range.of(U8, 0, 4), lit(5)).isExactBool(false));
        Range unknown = RangeArithmetic.compare(BinaryOp.LT, Range.of(U8, 0, 10), lit(5));
        assertFalse(unknown.isExact());
        assertTrue(unknown.domain().bool());
    }

    @Test
    void logicalOperatorsShortCircuitOnExactOperands() {
        assertTrue(RangeArithmetic.apply(BinaryOp.AND, Range.bool(false), Range.boolTop()).isExactBool(false));
        assertTrue(RangeArithmetic.apply(BinaryOp.OR, Range.bool(true), Range.boolTop()).isExactBool(true));
        assertFalse(RangeArithmetic.apply(BinaryOp.AND, Range.bool(true), Range.boolTop()).isExact());
    }

    @Test
    void bitwiseAndIsBoundedBySmallerMaximum() {
        Range r = RangeArithmetic.apply(BinaryOp.BIT_AND, Range.top(U8), Range.of(U8, 0, 15));
        assertEquals(BigInteger.ZERO, r.min());
        assertEquals(BigInteger.valueOf(15), r.max());
        assertFalse(r.mayWrap());
    }

    @Test
    void exactPowerIsComputed() {
        Range r = RangeArithmetic.apply(BinaryOp.POW, lit(2), lit(10));
        assertEquals(BigInteger.valueOf(1024), r.min());
        assertTrue(r.isExact());
    }

    @Test
    void opaqueOperandGivesTopOfOtherDomain() {
        Range r = RangeArithmetic.apply(BinaryOp.ADD, Range.opaque("external call"), Range.of(U8, 1, 2));
        assertTrue(r.isTop());
        assertEquals(U8, r.domain());
    }

    @Test
    void incrementAndNegation() {
        Range inc = RangeArithmetic.apply(UnaryOp.PRE_INC, Range.of(U8, 0, 9));
        assertEquals(BigInteger.ONE, inc.min());
        assertEquals(BigInteger.TEN, inc.max());

        Range neg = RangeArithmetic.apply(UnaryOp.NEG, lit(5));
        assertEquals(BigInteger.valueOf(-5), neg.min());
        assertTrue(neg.domain().signed());

        assertTrue(RangeArithmetic.apply(UnaryOp.NOT, Range.bool(true)).isExactBool(false));
    }
}
