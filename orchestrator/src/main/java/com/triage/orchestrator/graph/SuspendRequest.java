package com.triage.orchestrator.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Describes the decision a paused run is waiting for.
 *
 * @param reason      short machine-readable code, e.g. {@code AWAITING_APPROVAL}
 * @param description human-readable summary of the pending action
 * @param impact      machine-readable risk/impact summary shown to whoever decides
 */
public record SuspendRequest(String reason, String description, Map<String, Object> impact) {

    public SuspendRequest {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Suspension reason must not be blank");
        }
        impact = impact == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(impact));
    }
}
