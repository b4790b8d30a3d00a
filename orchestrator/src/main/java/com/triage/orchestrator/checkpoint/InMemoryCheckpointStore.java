package com.triage.orchestrator.checkpoint;

import com.triage.orchestrator.graph.Checkpoint;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Checkpoints held in memory; lost on restart. */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, Checkpoint> checkpoints = new ConcurrentHashMap<>();

    @Override
    public void save(Checkpoint checkpoint) {
        checkpoints.put(checkpoint.runId(), checkpoint);
    }

    @Override
    public Optional<Checkpoint> find(String runId) {
        return Optional.ofNullable(checkpoints.get(runId));
    }

    @Override
    public Optional<Checkpoint> take(String runId) {
        return Optional.ofNullable(checkpoints.remove(runId));
    }

    @Override
    public boolean discard(String runId) {
        return checkpoints.remove(runId) != null;
    }
}
