package com.triage.orchestrator.responder;

import com.triage.orchestrator.graph.AgentState;
import com.triage.orchestrator.graph.StateSchema;

import java.util.ArrayList;
import java.util.List;

/**
 * Field names and schema of an incident investigation.
 *
 * Status moves through investigating, researching, auditing, solving and then
 * complete or awaiting_approval; an approval decision ends in approved or rejected.
 */
public final class IncidentState {

    public static final String ERROR_LOG            = "error_log";
    public static final String ERROR_TYPE           = "error_type";
    public static final String ERROR_SUMMARY        = "error_summary";
    public static final String AFFECTED_COMPONENTS  = "affected_components";
    public static final String SEARCH_QUERIES       = "search_queries";
    public static final String RESEARCH_FINDINGS    = "research_findings";
    public static final String RELEVANT_DOCS        = "relevant_docs";
    public static final String FILES_TO_CHECK       = "files_to_check";
    public static final String CODE_CONTEXT         = "code_context";
    public static final String PROPOSED_SOLUTION    = "proposed_solution";
    public static final String SOLUTION_CONFIDENCE  = "solution_confidence";
    public static final String SOLUTION_STEPS       = "solution_steps";
    public static final String CODE_CHANGES         = "code_changes";
    public static final String ITERATIONS           = "iterations";
    public static final String MAX_ITERATIONS       = "max_iterations";
    public static final String NEEDS_HUMAN_APPROVAL = "needs_human_approval";
    public static final String PENDING_ACTION       = "pending_action";
    public static final String APPROVED             = "approved";
    public static final String MESSAGES             = "messages";
    public static final String STATUS               = "status";

    public static final String STATUS_INVESTIGATING     = "investigating";
    public static final String STATUS_RESEARCHING       = "researching";
    public static final String STATUS_AUDITING          = "auditing";
    public static final String STATUS_SOLVING           = "solving";
    public static final String STATUS_COMPLETE          = "complete";
    public static final String STATUS_AWAITING_APPROVAL = "awaiting_approval";
    public static final String STATUS_APPROVED          = "approved";
    public static final String STATUS_REJECTED          = "rejected";

    public static final int DEFAULT_MAX_ITERATIONS = 3;

    private IncidentState() {}

    public static StateSchema schema() {
        return schema(DEFAULT_MAX_ITERATIONS);
    }

    /** @param maxIterations default research/refine loop budget for runs that do not set one */
    public static StateSchema schema(int maxIterations) {
        return StateSchema.builder()
                .text(ERROR_LOG, "")
                .text(ERROR_TYPE, "unknown")
                .text(ERROR_SUMMARY, "")
                .textList(AFFECTED_COMPONENTS)
                .textList(SEARCH_QUERIES)
                .textList(RESEARCH_FINDINGS)
                .textList(RELEVANT_DOCS)
                .textList(FILES_TO_CHECK)
                .text(CODE_CONTEXT, "")
                .text(PROPOSED_SOLUTION, "")
                .number(SOLUTION_CONFIDENCE, 0.0)
                .textList(SOLUTION_STEPS)
                .text(CODE_CHANGES, "")
                .integer(ITERATIONS, 0)
                .integer(MAX_ITERATIONS, maxIterations)
                .bool(NEEDS_HUMAN_APPROVAL, false)
                .text(PENDING_ACTION, "")
                .bool(APPROVED, null)
                .textList(MESSAGES)
                .text(STATUS, STATUS_INVESTIGATING)
                .build();
    }

    /** The run's message log with one more entry appended. */
    static List<String> appendMessage(AgentState state, String message) {
        List<String> messages = new ArrayList<>(state.getTextList(MESSAGES));
        messages.add(message);
        return messages;
    }
}
