package com.triage.orchestrator.api.dto;

import com.triage.orchestrator.graph.Checkpoint;

import java.time.Instant;
import java.util.Map;

/**
 * The decision a suspended run is waiting for.
 */
public record CheckpointResponse(
        String              runId,
        String              nodeName,
        String              reason,
        String              description,
        Map<String, Object> impact,
        Instant             createdAt
) {
    public static CheckpointResponse from(Checkpoint c) {
        return new CheckpointResponse(
                c.runId(),
                c.nodeName(),
                c.reason(),
                c.description(),
                c.impact(),
                c.createdAt()
        );
    }
}
