package com.solrange.analyzer.range;

import com.solrange.analyzer.ast.SolAst.Loc;

/**
 * One application of a constraint to a variable, kept on the narrowed version so reports
 * can explain how a range was reached.
 */
public record NarrowingStep(Kind kind, String constraint, Range before, Range after, Loc loc) {

    public enum Kind {
        /** Arm of an if, ternary or loop entry. */
        BRANCH,
        /** require/assert in straight-line code. */
        ASSERTION,
        /** Negated loop condition applied after the loop. */
        LOOP_EXIT
    }

    public String describe() {
        return kind.name().toLowerCase() + " " + constraint + ": " + before.describe() + " -> " + after.describe()
                + (loc != null ? " @" + loc : "");
    }
}
