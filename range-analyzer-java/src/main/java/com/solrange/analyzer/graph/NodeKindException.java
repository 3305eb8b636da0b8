package com.solrange.analyzer.graph;

/**
 * A handle was dereferenced as a node kind it does not hold. Recoverable: callers that can
 * degrade (skip the node, warn) catch it; everybody else lets it abort the analysis.
 */
public class NodeKindException extends GraphException {

    private final int handle;
    private final Class<?> expected;
    private final Class<?> actual;

    public NodeKindException(int handle, Class<?> expected, Class<?> actual) {
        super("Node " + handle + " is a " + actual.getSimpleName() + ", expected " + expected.getSimpleName());
        this.handle = handle;
        this.expected = expected;
        this.actual = actual;
    }

    public int handle()          { return handle; }
    public Class<?> expected()   { return expected; }
    public Class<?> actual()     { return actual; }
}
