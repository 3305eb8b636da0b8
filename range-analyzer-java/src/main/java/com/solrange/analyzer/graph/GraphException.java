package com.solrange.analyzer.graph;

/**
 * Raised for handles that do not name a node of the graph.
 */
public class GraphException extends RuntimeException {
    public GraphException(String message) { super(message); }
}
