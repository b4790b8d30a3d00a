package com.triage.orchestrator.api.dto;

import com.triage.orchestrator.graph.RunResult;

import java.util.List;
import java.util.Map;

/**
 * Response body for POST /runs and POST /runs/{id}/resume.
 *
 * Exactly one of {@code pendingDecision} (SUSPENDED) and {@code failure}
 * (FAILED) is set for those statuses; {@code report} is set for COMPLETED.
 */
public record RunResponse(
        String              runId,
        String              status,
        List<String>        trace,
        Map<String, Object> state,
        CheckpointResponse  pendingDecision,
        Failure             failure,
        String              report
) {
    public record Failure(String kind, String node, String message) {}

    /** @param report rendered report for a completed run, otherwise ignored */
    public static RunResponse from(RunResult result, String report) {
        return switch (result.status()) {
            case COMPLETED -> {
                RunResult.Completed c = (RunResult.Completed) result;
                yield new RunResponse(c.runId(), c.status().name(), c.trace(),
                        c.finalState().asMap(), null, null, report);
            }
            case SUSPENDED -> {
                RunResult.Suspended s = (RunResult.Suspended) result;
                yield new RunResponse(s.runId(), s.status().name(), s.trace(),
                        s.checkpoint().state(), CheckpointResponse.from(s.checkpoint()), null, null);
            }
            case FAILED -> {
                RunResult.Failed f = (RunResult.Failed) result;
                yield new RunResponse(f.runId(), f.status().name(), f.trace(),
                        f.lastState() == null ? Map.of() : f.lastState().asMap(), null,
                        new Failure(f.kind().name(), f.nodeName(), f.message()), null);
            }
        };
    }
}
