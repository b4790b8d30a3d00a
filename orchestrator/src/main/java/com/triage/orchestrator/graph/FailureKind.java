package com.triage.orchestrator.graph;

/** Why a run ended in {@link RunResult.Failed}. */
public enum FailureKind {
    /** The node threw or exceeded its timeout. */
    NODE_EXECUTION,
    /** A node was about to run more often than {@link RunOptions#maxIterations()} allows. */
    ITERATION_LIMIT_EXCEEDED,
    /** A router threw or returned an outcome its edge does not declare. */
    ROUTING_ERROR,
    /** A node's update named an unknown field, repeated a field, or had a wrong-typed value. */
    INVALID_UPDATE,
    CANCELLED
}
