package com.solrange.analyzer.report;

import com.solrange.analyzer.graph.GraphModel.ContextKind;
import com.solrange.analyzer.graph.GraphModel.VarOrigin;
import com.solrange.analyzer.range.NarrowingStep;
import com.solrange.analyzer.range.Range;

import java.util.List;

/**
 * Bounds of one variable in one context.
 *
 * @param contextPath  dotted path of the context, e.g. {@code Storage.b5.fork0.true}
 * @param context      graph handle of the context
 * @param version      graph handle of the variable version reported
 * @param range        final range, null when bounds are not evaluated
 * @param initialRange range the chain of narrowings started from, null unless requested
 * @param derivation   symbolic description of where the range came from
 * @param steps        narrowings applied since the range was last set, oldest first
 */
public record BoundsReport(
        String contextPath,
        int context,
        ContextKind contextKind,
        String variable,
        int version,
        String type,
        VarOrigin origin,
        Range range,
        Range initialRange,
        String derivation,
        List<NarrowingStep> steps,
        boolean temporary
) {

    /** True if arithmetic producing the range may have overflowed or underflowed. */
    public boolean mayWrap() {
        return range != null && range.mayWrap();
    }
}
