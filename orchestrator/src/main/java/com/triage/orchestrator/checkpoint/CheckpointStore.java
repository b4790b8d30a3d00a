package com.triage.orchestrator.checkpoint;

import com.triage.orchestrator.graph.Checkpoint;

import java.util.Optional;

/**
 * Process-wide table of suspended runs, keyed by run id.
 *
 * A checkpoint is consumed exactly once: {@link #take} removes it atomically,
 * so two callers resuming the same run concurrently cannot both get it.
 */
public interface CheckpointStore {

    void save(Checkpoint checkpoint);

    /** Look at a pending checkpoint without consuming it. */
    Optional<Checkpoint> find(String runId);

    /** Remove and return the pending checkpoint, if any. */
    Optional<Checkpoint> take(String runId);

    /** @return true if a checkpoint was removed */
    boolean discard(String runId);
}
