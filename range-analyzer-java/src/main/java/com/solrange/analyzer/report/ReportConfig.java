package com.solrange.analyzer.report;

/**
 * What a bounds query reports.
 *
 * @param evalBounds        resolve ranges to concrete intervals; when false only the symbolic
 *                          derivation is reported
 * @param showTmps          include compiler-introduced temporaries
 * @param showConsts        include variables whose range is a single exact value
 * @param showSubctxs       descend into the contexts below the one queried
 * @param showInitialBounds report the range a variable started from next to the final one
 */
public record ReportConfig(
        boolean evalBounds,
        boolean showTmps,
        boolean showConsts,
        boolean showSubctxs,
        boolean showInitialBounds
) {

    public static ReportConfig defaults() {
        return new ReportConfig(true, false, true, true, true);
    }

    public ReportConfig withShowTmps(boolean value) {
        return new ReportConfig(evalBounds, value, showConsts, showSubctxs, showInitialBounds);
    }

    public ReportConfig withShowConsts(boolean value) {
        return new ReportConfig(evalBounds, showTmps, value, showSubctxs, showInitialBounds);
    }

    public ReportConfig withShowSubctxs(boolean value) {
        return new ReportConfig(evalBounds, showTmps, showConsts, value, showInitialBounds);
    }
}
