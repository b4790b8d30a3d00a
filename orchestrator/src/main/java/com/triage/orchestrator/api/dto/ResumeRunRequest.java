package com.triage.orchestrator.api.dto;

import com.triage.orchestrator.responder.IncidentState;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request body for POST /runs/{id}/resume.
 *
 * {@code approved} is the usual decision; {@code fields} may override any other
 * state field (e.g. an edited {@code pending_action}) at the same time.
 */
public record ResumeRunRequest(Boolean approved, Map<String, Object> fields) {

    /** The decision as state fields; {@code approved} wins over the same key in {@code fields}. */
    public Map<String, Object> decision() {
        Map<String, Object> decision = new LinkedHashMap<>();
        if (fields != null) decision.putAll(fields);
        if (approved != null) decision.put(IncidentState.APPROVED, approved);
        return decision;
    }
}
