package com.solrange.analyzer.report;

import com.solrange.analyzer.graph.GraphModel.*;
import com.solrange.analyzer.graph.SemanticGraph;
import com.solrange.analyzer.range.NarrowingStep;
import com.solrange.analyzer.range.Range;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Answers range queries over a finished context tree. Read-only: it never adds nodes, so
 * queries on different contexts may run concurrently once building is over.
 */
public class BoundsAnalyzer {

    private final SemanticGraph graph;

    public BoundsAnalyzer(SemanticGraph graph) {
        this.graph = graph;
    }

    public List<BoundsReport> boundsFor(int context, String name) {
        return boundsFor(context, name, ReportConfig.defaults());
    }

    /**
     * One report per context (the given one and, with {@code showSubctxs}, every context below it
     * in pre-order) where {@code name} is live. Unknown names give an empty list.
     */
    public List<BoundsReport> boundsFor(int context, String name, ReportConfig config) {
        List<BoundsReport> out = new ArrayList<>();
        for (int ctx : contexts(context, config)) {
            Integer version = liveVersions(ctx).get(name);
            if (version == null) continue;
            BoundsReport r = report(ctx, version, config);
            if (r != null) out.add(r);
        }
        return out;
    }

    /** {@link #boundsFor} for every name live in each context, names in first-binding order. */
    public List<BoundsReport> boundsForAll(int context, ReportConfig config) {
        List<BoundsReport> out = new ArrayList<>();
        for (int ctx : contexts(context, config)) {
            for (int version : liveVersions(ctx).values()) {
                BoundsReport r = report(ctx, version, config);
                if (r != null) out.add(r);
            }
        }
        return out;
    }

    /** The context and its descendants in pre-order, minus unreachable and assertion-failure ones. */
    public List<Integer> subtree(int context) {
        graph.node(context, ContextNode.class);
        List<Integer> out = new ArrayList<>();
        collect(context, out);
        return out;
    }

    /** Direct children: arms under the context's forks, continuations and assertion failures. */
    public List<Integer> children(int context) {
        TreeSet<Integer> out = new TreeSet<>();
        for (int from : graph.incoming(context, EdgeKind.SUBCONTEXT)) {
            if (graph.findNode(from, ContextNode.class).isPresent()) out.add(from);
        }
        for (int fork : graph.incoming(context, EdgeKind.FORK)) {
            out.addAll(graph.incoming(fork, EdgeKind.SUBCONTEXT));
        }
        return new ArrayList<>(out);
    }

    /** Latest version of every name bound in the context, keyed in first-binding order. */
    public Map<String, Integer> liveVersions(int context) {
        List<Integer> versions = new ArrayList<>(graph.incoming(context, EdgeKind.CONTEXT_VAR));
        Collections.sort(versions);
        Map<String, Integer> live = new LinkedHashMap<>();
        for (int h : versions) {
            live.put(graph.node(h, ContextVarNode.class).name(), h);
        }
        return live;
    }

    private List<Integer> contexts(int context, ReportConfig config) {
        ContextNode root = graph.node(context, ContextNode.class);
        if (config.showSubctxs()) return subtree(context);
        return root.isExcluded() ? List.of() : List.of(context);
    }

    private void collect(int context, List<Integer> out) {
        ContextNode node = graph.node(context, ContextNode.class);
        if (node.isExcluded()) return;
        out.add(context);
        for (int child : children(context)) collect(child, out);
    }

    private BoundsReport report(int context, int version, ReportConfig config) {
        ContextVarNode v = graph.node(version, ContextVarNode.class);
        if (v.isTmp() && !config.showTmps()) return null;
        List<NarrowingStep> steps = steps(version);
        // a value pinned down by narrowing is a result, not a constant binding
        if (!config.showConsts() && v.range().isExact() && steps.isEmpty()) return null;
        ContextNode ctx = graph.node(context, ContextNode.class);
        return new BoundsReport(
                ctx.path(),
                context,
                ctx.kind(),
                v.name(),
                version,
                v.type() != null ? v.type().name() : "unknown",
                v.origin(),
                config.evalBounds() ? v.range() : null,
                config.evalBounds() && config.showInitialBounds() ? initialRange(version) : null,
                v.derivation(),
                steps,
                v.isTmp());
    }

    /** Narrowing steps along the predecessor chain back to where the range was last set. */
    private List<NarrowingStep> steps(int version) {
        List<NarrowingStep> steps = new ArrayList<>();
        int h = version;
        while (h >= 0) {
            ContextVarNode v = graph.node(h, ContextVarNode.class);
            if (v.step() != null) steps.add(0, v.step());
            if (v.origin().startsChain()) break;
            h = v.prev();
        }
        return Collections.unmodifiableList(steps);
    }

    private Range initialRange(int version) {
        int h = version;
        while (true) {
            ContextVarNode v = graph.node(h, ContextVarNode.class);
            if (v.origin().startsChain()) return v.range();
            if (v.prev() < 0) return v.step() != null ? v.step().before() : v.range();
            h = v.prev();
        }
    }
}
