package com.triage.orchestrator.graph;

/**
 * What a node hands back to the executor: a partial update and, for
 * checkpointing nodes, an optional request to pause the run here.
 */
public record NodeResult(StateUpdate update, SuspendRequest suspension) {

    public NodeResult {
        if (update == null) update = StateUpdate.empty();
    }

    public static NodeResult of(StateUpdate update) {
        return new NodeResult(update, null);
    }

    public static NodeResult suspend(StateUpdate update, SuspendRequest request) {
        if (request == null) throw new IllegalArgumentException("Suspension request must not be null");
        return new NodeResult(update, request);
    }

    public boolean suspends() {
        return suspension != null;
    }
}
