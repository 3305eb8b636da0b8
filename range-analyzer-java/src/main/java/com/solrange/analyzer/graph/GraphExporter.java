package com.solrange.analyzer.graph;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.annotations.SerializedName;
import com.solrange.analyzer.graph.GraphModel.ContextVarNode;
import com.solrange.analyzer.graph.GraphModel.Edge;
import com.solrange.analyzer.graph.GraphModel.Node;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Debug dump of a {@link SemanticGraph}: every node with its kind and label, every edge.
 * Nodes are listed by handle and edges by (from, to, kind), so equal graphs dump identically.
 */
public class GraphExporter {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public static class GraphDump {
        @SerializedName("node_count") public int nodeCount;
        @SerializedName("nodes")      public List<NodeEntry> nodes;
        @SerializedName("edges")      public List<EdgeEntry> edges;
    }

    public static class NodeEntry {
        @SerializedName("handle") public int handle;
        @SerializedName("kind")   public String kind;
        @SerializedName("label")  public String label;
    }

    public static class EdgeEntry {
        @SerializedName("from") public int from;
        @SerializedName("to")   public int to;
        @SerializedName("kind") public String kind;
    }

    /**
     * @param showTmps when false, temporaries and every edge touching one are left out
     */
    public GraphDump export(SemanticGraph graph, boolean showTmps) {
        Set<Integer> elided = new HashSet<>();
        GraphDump dump = new GraphDump();
        dump.nodeCount = graph.size();
        dump.nodes = new ArrayList<>();
        for (int h = 0; h < graph.size(); h++) {
            Node n = graph.node(h);
            if (!showTmps && n instanceof ContextVarNode v && v.isTmp()) {
                elided.add(h);
                continue;
            }
            NodeEntry entry = new NodeEntry();
            entry.handle = h;
            entry.kind = n.getClass().getSimpleName();
            entry.label = n.label();
            dump.nodes.add(entry);
        }

        dump.edges = new ArrayList<>();
        for (Edge e : graph.edges()) {
            if (elided.contains(e.from()) || elided.contains(e.to())) continue;
            EdgeEntry entry = new EdgeEntry();
            entry.from = e.from();
            entry.to = e.to();
            entry.kind = e.kind().name();
            dump.edges.add(entry);
        }
        dump.edges.sort(Comparator.comparingInt((EdgeEntry e) -> e.from)
                .thenComparingInt(e -> e.to)
                .thenComparing(e -> e.kind));
        return dump;
    }

    public String toJson(SemanticGraph graph, boolean showTmps) {
        return GSON.toJson(export(graph, showTmps));
    }
}
