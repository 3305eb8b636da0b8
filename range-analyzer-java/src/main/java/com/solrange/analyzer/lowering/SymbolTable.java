package com.solrange.analyzer.lowering;

import com.solrange.analyzer.ast.SolAst.Loc;
import com.solrange.analyzer.graph.GraphModel.UnresolvedNode;
import com.solrange.analyzer.graph.SemanticGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Name table for one analysis, filled in two phases.
 *
 * References to names not yet declared get an {@link UnresolvedNode} placeholder and an
 * obligation {@code (scope, name, placeholder)}. When the declaration arrives the obligation is
 * discharged by an indirection {@code placeholder -> declaration}; the placeholder node itself is
 * never touched, so edges pointing at it stay valid and {@link #resolve(int)} yields the final
 * handle. Scopes are contract names, {@code null} being file level. A contract scope also sees
 * its base contracts and then the file level.
 */
public class SymbolTable {

    /** Pending reference to a name that had no declaration when first seen. */
    public record Obligation(String scope, String name, int placeholder) {}

    private final SemanticGraph graph;
    private final Map<String, Map<String, Integer>> scopes = new HashMap<>();
    private final Map<String, List<String>> bases = new HashMap<>();
    private final Map<Integer, Integer> indirections = new HashMap<>();
    private final List<Obligation> obligations = new ArrayList<>();

    public SymbolTable(SemanticGraph graph) {
        this.graph = graph;
    }

    /**
     * Registers a declaration and discharges every obligation it satisfies: those raised in the
     * same scope, and for file-level declarations those raised anywhere.
     */
    public void declare(String scope, String name, int handle) {
        scopes.computeIfAbsent(key(scope), k -> new LinkedHashMap<>()).put(name, handle);
        var it = obligations.iterator();
        while (it.hasNext()) {
            Obligation o = it.next();
            if (!o.name().equals(name)) continue;
            if (scope == null || scope.equals(o.scope()) || inherits(o.scope(), scope)) {
                indirections.put(o.placeholder(), handle);
                it.remove();
            }
        }
    }

    public void setBases(String contract, List<String> baseNames) {
        bases.put(contract, List.copyOf(baseNames));
    }

    /** Declared handle for {@code name} as seen from {@code scope}, without creating anything. */
    public Optional<Integer> lookup(String scope, String name) {
        if (scope != null) {
            Optional<Integer> found = lookupInContract(scope, name, new ArrayList<>());
            if (found.isPresent()) return found;
        }
        return Optional.ofNullable(scopes.getOrDefault(key(null), Map.of()).get(name));
    }

    /**
     * Handle to use for a reference: the declaration when known, otherwise a placeholder
     * (reused for repeated references from the same scope).
     */
    public int reference(String scope, String name, Loc loc) {
        Optional<Integer> declared = lookup(scope, name);
        if (declared.isPresent()) return declared.get();
        for (Obligation o : obligations) {
            if (o.name().equals(name) && Objects.equals(o.scope(), scope)) {
                return o.placeholder();
            }
        }
        int placeholder = graph.addNode(new UnresolvedNode(name, loc));
        obligations.add(new Obligation(scope, name, placeholder));
        return placeholder;
    }

    /** Follows placeholder indirections to the final handle; other handles map to themselves. */
    public int resolve(int handle) {
        int current = handle;
        for (int hops = 0; hops <= indirections.size(); hops++) {
            Integer next = indirections.get(current);
            if (next == null) return current;
            current = next;
        }
        throw new IllegalStateException("Cyclic symbol indirection at handle " + handle);
    }

    public boolean isResolved(int handle) {
        return graph.findNode(resolve(handle), UnresolvedNode.class).isEmpty();
    }

    /** Obligations no declaration has discharged (yet). */
    public List<Obligation> unresolved() {
        return Collections.unmodifiableList(obligations);
    }

    /** Names declared directly in a scope, in declaration order. */
    public Map<String, Integer> declaredIn(String scope) {
        return Collections.unmodifiableMap(scopes.getOrDefault(key(scope), Map.of()));
    }

    private Optional<Integer> lookupInContract(String contract, String name, List<String> visited) {
        if (visited.contains(contract)) return Optional.empty();
        visited.add(contract);
        Integer h = scopes.getOrDefault(key(contract), Map.of()).get(name);
        if (h != null) return Optional.of(h);
        // most derived base first
        List<String> baseNames = bases.getOrDefault(contract, List.of());
        for (int i = baseNames.size() - 1; i >= 0; i--) {
            Optional<Integer> found = lookupInContract(baseNames.get(i), name, visited);
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }

    private boolean inherits(String contract, String base) {
        if (contract == null) return false;
        List<String> pending = new ArrayList<>(bases.getOrDefault(contract, List.of()));
        List<String> visited = new ArrayList<>();
        while (!pending.isEmpty()) {
            String b = pending.remove(pending.size() - 1);
            if (b.equals(base)) return true;
            if (visited.contains(b)) continue;
            visited.add(b);
            pending.addAll(bases.getOrDefault(b, List.of()));
        }
        return false;
    }

    private static String key(String scope) {
        return scope == null ? "" : scope;
    }
}
