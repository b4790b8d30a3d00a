package com.triage.orchestrator.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything needed to continue a suspended run, possibly in another process.
 *
 * {@code state} is the full snapshot after the suspending node's update was
 * merged; {@code iterationCounters} records how often each node has been
 * repeated so the loop bound still holds after resume.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Checkpoint(String runId,
                         String nodeName,
                         Map<String, Object> state,
                         Map<String, Integer> iterationCounters,
                         String reason,
                         String description,
                         Map<String, Object> impact,
                         Instant createdAt) {

    public Checkpoint {
        state             = unmodifiableCopy(state);
        iterationCounters = unmodifiableCopy(iterationCounters);
        impact            = unmodifiableCopy(impact);
    }

    static Checkpoint capture(String runId, String nodeName, AgentState state,
                              Map<String, Integer> counters, SuspendRequest request) {
        return new Checkpoint(runId, nodeName, state.asMap(), counters,
                request.reason(), request.description(), request.impact(), Instant.now());
    }

    // Values may be null, which rules out Map.copyOf.
    private static <V> Map<String, V> unmodifiableCopy(Map<String, V> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
