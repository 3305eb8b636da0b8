package com.solrange.analyzer.config;

import com.google.gson.annotations.SerializedName;
import com.solrange.analyzer.context.BuilderLimits;
import com.solrange.analyzer.report.ReportConfig;

/**
 * Deserialized form of {@code analyzer.json}. Every key is optional.
 */
public class AnalyzerConfig {

    @SerializedName("eval_bounds")
    private Boolean evalBounds;

    /** Report compiler-introduced temporaries (default: false). */
    @SerializedName("show_tmps")
    private Boolean showTmps;

    @SerializedName("show_consts")
    private Boolean showConsts;

    @SerializedName("show_subctxs")
    private Boolean showSubctxs;

    @SerializedName("show_initial_bounds")
    private Boolean showInitialBounds;

    /** Branch and loop nesting after which bodies are no longer forked (default: 32). */
    @SerializedName("max_fork_depth")
    private Integer maxForkDepth;

    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig();
    }

    public boolean isEvalBounds()        { return evalBounds == null || evalBounds; }
    public boolean isShowTmps()          { return showTmps != null && showTmps; }
    public boolean isShowConsts()        { return showConsts == null || showConsts; }
    public boolean isShowSubctxs()       { return showSubctxs == null || showSubctxs; }
    public boolean isShowInitialBounds() { return showInitialBounds == null || showInitialBounds; }
    public int getMaxForkDepth() {
        return maxForkDepth != null ? maxForkDepth : BuilderLimits.DEFAULT_MAX_FORK_DEPTH;
    }

    public ReportConfig toReportConfig() {
        return new ReportConfig(isEvalBounds(), isShowTmps(), isShowConsts(), isShowSubctxs(), isShowInitialBounds());
    }

    public BuilderLimits builderLimits() {
        return new BuilderLimits(getMaxForkDepth());
    }
}
