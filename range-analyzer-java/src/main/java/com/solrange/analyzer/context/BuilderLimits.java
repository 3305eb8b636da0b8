package com.solrange.analyzer.context;

/**
 * Bounds on how far the context builder forks.
 *
 * @param maxForkDepth nesting of branches and loops beyond which control flow is no longer
 *                     forked; names written inside are widened to their type's top instead
 */
public record BuilderLimits(int maxForkDepth) {

    public static final int DEFAULT_MAX_FORK_DEPTH = 32;

    public BuilderLimits {
        if (maxForkDepth < 0) {
            throw new IllegalArgumentException("maxForkDepth must not be negative: " + maxForkDepth);
        }
    }

    public static BuilderLimits defaults() {
        return new BuilderLimits(DEFAULT_MAX_FORK_DEPTH);
    }
}
