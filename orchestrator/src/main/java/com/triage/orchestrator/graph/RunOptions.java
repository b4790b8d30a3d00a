package com.triage.orchestrator.graph;

import java.time.Duration;

/**
 * Per-invocation execution policy.
 *
 * @param maxIterations repeat visits allowed per node; a node runs at most {@code maxIterations + 1} times
 * @param nodeTimeout   wall-clock limit for each node invocation, or null for none
 * @param cancellation  flag checked between nodes
 */
public record RunOptions(int maxIterations, Duration nodeTimeout, CancellationToken cancellation) {

    public static final int DEFAULT_MAX_ITERATIONS = 5;

    public RunOptions {
        if (maxIterations < 0) {
            throw new IllegalArgumentException("maxIterations must be >= 0, got " + maxIterations);
        }
        if (nodeTimeout != null && (nodeTimeout.isNegative() || nodeTimeout.isZero())) {
            throw new IllegalArgumentException("nodeTimeout must be positive, got " + nodeTimeout);
        }
        if (cancellation == null) cancellation = new CancellationToken();
    }

    public static RunOptions defaults() {
        return new RunOptions(DEFAULT_MAX_ITERATIONS, null, null);
    }

    public RunOptions withMaxIterations(int max)            { return new RunOptions(max, nodeTimeout, cancellation); }
    public RunOptions withNodeTimeout(Duration timeout)     { return new RunOptions(maxIterations, timeout, cancellation); }
    public RunOptions withCancellation(CancellationToken t) { return new RunOptions(maxIterations, nodeTimeout, t); }
}
