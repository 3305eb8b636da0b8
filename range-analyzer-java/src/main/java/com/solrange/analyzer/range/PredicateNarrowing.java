package com.solrange.analyzer.range;

import com.solrange.analyzer.ast.AstNames;
import com.solrange.analyzer.ast.SolAst.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Turns a boolean predicate into per-variable constraints for its true and false outcomes.
 *
 * Only comparisons whose one side is a plain variable restrict anything; {@code &&} restricts
 * its true outcome and {@code ||} its false outcome, the other outcome of each being a
 * disjunction that no single interval captures. Operands mentioning an unstable name
 * (written inside the loop being entered) are skipped.
 */
public class PredicateNarrowing {

    /** Ranges the predicate's sub-expressions evaluated to. */
    public interface OperandRanges {
        Range rangeOf(Expression expression);
    }

    private final OperandRanges ranges;
    private final Set<String> unstable;

    public PredicateNarrowing(OperandRanges ranges) {
        this(ranges, Collections.emptySet());
    }

    public PredicateNarrowing(OperandRanges ranges, Set<String> unstable) {
        this.ranges = ranges;
        this.unstable = unstable;
    }

    public List<Constraint> whenTrue(Expression predicate) {
        List<Constraint> out = new ArrayList<>();
        derive(predicate, true, out);
        return out;
    }

    public List<Constraint> whenFalse(Expression predicate) {
        List<Constraint> out = new ArrayList<>();
        derive(predicate, false, out);
        return out;
    }

    private void derive(Expression e, boolean outcome, List<Constraint> out) {
        if (e == null) return;
        if (e instanceof Unary u && u.op() == UnaryOp.NOT) {
            derive(u.operand(), !outcome, out);
        } else if (e instanceof Binary b && b.op() == BinaryOp.AND) {
            if (outcome) {
                derive(b.left(), true, out);
                derive(b.right(), true, out);
            }
        } else if (e instanceof Binary b && b.op() == BinaryOp.OR) {
            if (!outcome) {
                derive(b.left(), false, out);
                derive(b.right(), false, out);
            }
        } else if (e instanceof Binary b && b.op().isComparison()) {
            CompareOp op = CompareOp.from(b.op());
            if (!outcome) op = op.negate();
            if (b.left() instanceof Variable v && isStable(b.right())) {
                out.add(new Constraint(v.name().name(), op, rangeOf(b.right()), AstNames.render(b.right())));
            }
            if (b.right() instanceof Variable v && isStable(b.left())) {
                out.add(new Constraint(v.name().name(), op.flip(), rangeOf(b.left()), AstNames.render(b.left())));
            }
        } else if (e instanceof Variable v) {
            Range current = rangeOf(v);
            if (current.isValue() && current.domain().bool()) {
                out.add(new Constraint(v.name().name(), outcome ? CompareOp.EQ : CompareOp.NE,
                        Range.bool(true), "true"));
            }
        }
    }

    private boolean isStable(Expression operand) {
        if (unstable.isEmpty()) return true;
        for (String name : AstNames.referencedNames(operand)) {
            if (unstable.contains(name)) return false;
        }
        return true;
    }

    private Range rangeOf(Expression e) {
        Range r = ranges.rangeOf(e);
        return r != null ? r : Range.opaque("not evaluated: " + AstNames.render(e));
    }
}
