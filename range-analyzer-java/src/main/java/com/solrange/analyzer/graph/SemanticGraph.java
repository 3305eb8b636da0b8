package com.solrange.analyzer.graph;

import com.solrange.analyzer.graph.GraphModel.*;
import com.solrange.analyzer.types.Builtin;
import com.solrange.analyzer.types.Concrete;
import com.solrange.analyzer.types.DynBuiltin;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Append-only store of every node and edge produced by one analysis.
 *
 * Handles are indexes into the node arena: assigned in creation order, never reused and never
 * invalidated. Nodes only refer to each other through handles, so cyclic relations need no
 * special care. Edges are kept twice, as outgoing and incoming adjacency lists.
 */
public class SemanticGraph {

    private final List<Node> nodes = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();
    private final List<List<Edge>> outgoing = new ArrayList<>();
    private final List<List<Edge>> incoming = new ArrayList<>();
    private final Map<Builtin, Integer> builtins = new HashMap<>();
    private final Map<DynBuiltin, Integer> dynBuiltins = new HashMap<>();
    private final Map<Concrete, Integer> concretes = new HashMap<>();

    public int addNode(Node node) {
        if (node == null) throw new IllegalArgumentException("node must not be null");
        nodes.add(node);
        outgoing.add(new ArrayList<>());
        incoming.add(new ArrayList<>());
        return nodes.size() - 1;
    }

    public Node node(int handle) {
        if (handle < 0 || handle >= nodes.size()) {
            throw new GraphException("No node with handle " + handle + " (graph has " + nodes.size() + ")");
        }
        return nodes.get(handle);
    }

    /**
     * Typed accessor.
     *
     * @throws NodeKindException if the node is not a {@code kind}
     */
    public <T extends Node> T node(int handle, Class<T> kind) {
        Node n = node(handle);
        if (!kind.isInstance(n)) {
            throw new NodeKindException(handle, kind, n.getClass());
        }
        return kind.cast(n);
    }

    /** Like {@link #node(int, Class)} but empty on a kind mismatch or stale handle. */
    public <T extends Node> Optional<T> findNode(int handle, Class<T> kind) {
        if (handle < 0 || handle >= nodes.size()) return Optional.empty();
        Node n = nodes.get(handle);
        return kind.isInstance(n) ? Optional.of(kind.cast(n)) : Optional.empty();
    }

    public boolean contains(int handle) {
        return handle >= 0 && handle < nodes.size();
    }

    public void addEdge(int from, int to, EdgeKind kind) {
        node(from);
        node(to);
        Edge e = new Edge(from, to, kind);
        edges.add(e);
        outgoing.get(from).add(e);
        incoming.get(to).add(e);
    }

    public List<Edge> outgoing(int handle) {
        node(handle);
        return Collections.unmodifiableList(outgoing.get(handle));
    }

    public List<Edge> incoming(int handle) {
        node(handle);
        return Collections.unmodifiableList(incoming.get(handle));
    }

    /** Targets of {@code handle}'s outgoing edges of one kind, in insertion order. */
    public List<Integer> outgoing(int handle, EdgeKind kind) {
        List<Integer> out = new ArrayList<>();
        for (Edge e : outgoing(handle)) {
            if (e.kind() == kind) out.add(e.to());
        }
        return out;
    }

    /** Sources of the edges of one kind pointing at {@code handle}, in insertion order. */
    public List<Integer> incoming(int handle, EdgeKind kind) {
        List<Integer> out = new ArrayList<>();
        for (Edge e : incoming(handle)) {
            if (e.kind() == kind) out.add(e.from());
        }
        return out;
    }

    /**
     * Every node below {@code root} (following incoming edges of any kind, transitively) whose
     * own edge into its parent is of {@code kind}. Sorted by handle.
     */
    public List<Integer> searchChildren(int root, EdgeKind kind) {
        node(root);
        TreeSet<Integer> found = new TreeSet<>();
        boolean[] seen = new boolean[nodes.size()];
        Deque<Integer> work = new ArrayDeque<>();
        work.push(root);
        seen[root] = true;
        while (!work.isEmpty()) {
            int current = work.pop();
            for (Edge e : incoming.get(current)) {
                if (e.kind() == kind) found.add(e.from());
                if (!seen[e.from()]) {
                    seen[e.from()] = true;
                    work.push(e.from());
                }
            }
        }
        return new ArrayList<>(found);
    }

    /** Builtin types are interned: one node per distinct builtin. */
    public int builtinOrAdd(Builtin builtin) {
        return builtins.computeIfAbsent(builtin, b -> addNode(new BuiltinNode(b)));
    }

    public int dynBuiltinOrAdd(DynBuiltin dynBuiltin) {
        return dynBuiltins.computeIfAbsent(dynBuiltin, d -> addNode(new DynBuiltinNode(d)));
    }

    public int concreteOrAdd(Concrete value) {
        return concretes.computeIfAbsent(value, c -> addNode(new ConcreteNode(c)));
    }

    public int size() {
        return nodes.size();
    }

    public List<Edge> edges() {
        return Collections.unmodifiableList(edges);
    }
}
