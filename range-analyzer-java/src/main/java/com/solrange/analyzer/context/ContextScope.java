package com.solrange.analyzer.context;

import com.solrange.analyzer.ast.SolAst.Loc;
import com.solrange.analyzer.graph.GraphModel.*;
import com.solrange.analyzer.graph.SemanticGraph;
import com.solrange.analyzer.range.Constraint;
import com.solrange.analyzer.range.NarrowingStep;
import com.solrange.analyzer.range.Range;
import com.solrange.analyzer.types.VarType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bookkeeping for the contexts of one function while it is being walked: which context is
 * current, the live (latest) version of every name per context, and the creation of context,
 * fork and variable nodes with their edges.
 */
class ContextScope {

    private final SemanticGraph graph;
    private final int function;
    private final Map<Integer, LinkedHashMap<String, Integer>> live = new HashMap<>();
    private final Map<Integer, Integer> splitCounters = new HashMap<>();
    private final List<Integer> contexts = new ArrayList<>();
    private int tmpCounter;
    private int current = -1;

    ContextScope(SemanticGraph graph, int function) {
        this.graph = graph;
        this.function = function;
    }

    SemanticGraph graph() { return graph; }
    int function()        { return function; }
    int current()         { return current; }

    void moveTo(int context) {
        context(context);
        current = context;
    }

    ContextNode context(int handle) {
        return graph.node(handle, ContextNode.class);
    }

    ContextNode currentContext() {
        return context(current);
    }

    ContextVarNode var(int handle) {
        return graph.node(handle, ContextVarNode.class);
    }

    // --- Contexts ---

    int openEntry(String path, Loc loc) {
        int ctx = register(new ContextNode(path, ContextKind.ENTRY, function, 0, List.of(), loc));
        graph.addEdge(ctx, function, EdgeKind.CONTEXT);
        current = ctx;
        return ctx;
    }

    /** Next split number under {@code parent}, used to name forks and assertion children. */
    int nextSplit(int parent) {
        return splitCounters.merge(parent, 1, Integer::sum) - 1;
    }

    int fork(int parent, String reason, Loc loc) {
        int fork = graph.addNode(new ContextForkNode(parent, reason, loc));
        graph.addEdge(fork, parent, EdgeKind.FORK);
        return fork;
    }

    /** Child context hanging off a fork marker. */
    int openChild(int fork, int parent, ContextKind kind, String path, List<Constraint> conditions, Loc loc) {
        ContextNode p = context(parent);
        int ctx = register(new ContextNode(path, kind, function, p.depth() + 1, conditions, loc));
        graph.addEdge(ctx, fork, EdgeKind.SUBCONTEXT);
        return ctx;
    }

    /** Child context attached straight to its parent (continuations and assertion failures). */
    int openDirectChild(int parent, ContextKind kind, String path, List<Constraint> conditions, Loc loc) {
        ContextNode p = context(parent);
        int ctx = register(new ContextNode(path, kind, function, p.depth() + 1, conditions, loc));
        graph.addEdge(ctx, parent, EdgeKind.SUBCONTEXT);
        return ctx;
    }

    private int register(ContextNode node) {
        int ctx = graph.addNode(node);
        live.put(ctx, new LinkedHashMap<>());
        contexts.add(ctx);
        return ctx;
    }

    /** Freezes every context of the function. */
    void sealAll() {
        for (int ctx : contexts) context(ctx).seal();
    }

    // --- Versions ---

    Optional<Integer> binding(String name) {
        return binding(current, name);
    }

    Optional<Integer> binding(int context, String name) {
        LinkedHashMap<String, Integer> names = live.get(context);
        return names == null ? Optional.empty() : Optional.ofNullable(names.get(name));
    }

    /** Live versions of a context in first-binding order. */
    Map<String, Integer> liveIn(int context) {
        return Collections.unmodifiableMap(live.getOrDefault(context, new LinkedHashMap<>()));
    }

    /** New version of {@code name} in the current context, chained to the live one. */
    int bind(String name, VarOrigin origin, Range range, VarType type, NarrowingStep step, Loc loc, String derivation) {
        int prev = binding(name).orElse(-1);
        return addVersion(current, name, null, prev, origin, range, type, step, loc, derivation);
    }

    /** New version in {@code context} with an explicit predecessor (possibly in another context). */
    int bindIn(int context, String name, int prev, VarOrigin origin, Range range, VarType type,
               NarrowingStep step, Loc loc, String derivation) {
        return addVersion(context, name, null, prev, origin, range, type, step, loc, derivation);
    }

    int temporary(String rendered, Range range, VarType type, Loc loc) {
        String name = "tmp" + tmpCounter++;
        return addVersion(current, name, rendered, -1, VarOrigin.TEMPORARY, range, type, null, loc, rendered);
    }

    private int addVersion(int context, String name, String tmpOf, int prev, VarOrigin origin, Range range,
                           VarType type, NarrowingStep step, Loc loc, String derivation) {
        int h = graph.addNode(new ContextVarNode(name, context, tmpOf, prev, origin, range, type, step, loc, derivation));
        graph.addEdge(h, context, EdgeKind.CONTEXT_VAR);
        if (prev >= 0) graph.addEdge(h, prev, EdgeKind.PREV);
        live.get(context).put(name, h);
        return h;
    }
}
