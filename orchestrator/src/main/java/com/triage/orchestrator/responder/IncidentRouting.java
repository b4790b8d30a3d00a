package com.triage.orchestrator.responder;

import com.triage.orchestrator.graph.AgentState;

import static com.triage.orchestrator.responder.IncidentState.*;

/**
 * Routers for the two conditional edges of the incident graph.
 *
 * The refine threshold is supplied per instance, so graphs with different
 * policies can run side by side.
 */
public class IncidentRouting {

    public static final String RESEARCH = "research";
    public static final String AUDIT    = "audit";
    public static final String REFINE   = "refine";
    public static final String APPROVE  = "approve";
    public static final String END      = "end";

    public static final double DEFAULT_REFINE_THRESHOLD = 0.3;

    private final double refineThreshold;

    public IncidentRouting(double refineThreshold) {
        if (refineThreshold < 0.0 || refineThreshold > 1.0) {
            throw new IllegalArgumentException("refineThreshold must be within [0, 1], got " + refineThreshold);
        }
        this.refineThreshold = refineThreshold;
    }

    public double refineThreshold() { return refineThreshold; }

    /** After research: loop while still researching and budget remains. */
    public String continueResearch(AgentState state) {
        if (STATUS_RESEARCHING.equals(state.getText(STATUS)) && budgetLeft(state)) {
            return RESEARCH;
        }
        return AUDIT;
    }

    /** After solving: refine a weak answer, ask for approval, or finish. */
    public String solutionConfidence(AgentState state) {
        Double confidence = state.getNumber(SOLUTION_CONFIDENCE);
        if ((confidence == null ? 0.0 : confidence) < refineThreshold && budgetLeft(state)) {
            return REFINE;
        }
        if (Boolean.TRUE.equals(state.getBoolean(NEEDS_HUMAN_APPROVAL))) {
            return APPROVE;
        }
        return END;
    }

    private static boolean budgetLeft(AgentState state) {
        return state.getInt(ITERATIONS) < state.getInt(MAX_ITERATIONS);
    }
}
