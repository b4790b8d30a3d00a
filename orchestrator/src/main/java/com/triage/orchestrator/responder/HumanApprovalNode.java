package com.triage.orchestrator.responder;

import com.triage.orchestrator.graph.AgentState;
import com.triage.orchestrator.graph.Node;
import com.triage.orchestrator.graph.NodeResult;
import com.triage.orchestrator.graph.StateUpdate;
import com.triage.orchestrator.graph.SuspendRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.triage.orchestrator.responder.IncidentState.*;

/**
 * Checkpoint in front of a risky fix.
 *
 * On first entry {@code approved} is unset and the node pauses the run with a
 * description of the pending action. When the run is resumed with a decision,
 * the node records it as {@code approved} or {@code rejected} status.
 */
public class HumanApprovalNode implements Node {

    private static final Logger log = LoggerFactory.getLogger(HumanApprovalNode.class);

    public static final String REASON = "AWAITING_APPROVAL";

    @Override
    public NodeResult execute(AgentState state) {
        Boolean approved = state.getBoolean(APPROVED);

        if (approved == null) {
            String action = state.getTextOrEmpty(PENDING_ACTION);
            String description = action.isBlank() ? "Apply the proposed solution" : action;
            log.info("Pausing for approval: {}", description);
            return NodeResult.suspend(
                    StateUpdate.builder()
                            .set(STATUS, STATUS_AWAITING_APPROVAL)
                            .set(MESSAGES, appendMessage(state, "[System] Awaiting human approval"))
                            .build(),
                    new SuspendRequest(REASON, description, impact(state)));
        }

        log.info("Approval decision received: {}", approved ? "approved" : "rejected");
        return NodeResult.of(StateUpdate.builder()
                .set(STATUS, approved ? STATUS_APPROVED : STATUS_REJECTED)
                .set(MESSAGES, appendMessage(state,
                        approved ? "[System] Solution approved" : "[System] Solution rejected"))
                .build());
    }

    private static Map<String, Object> impact(AgentState state) {
        Map<String, Object> impact = new LinkedHashMap<>();
        impact.put("errorType",        state.getTextOrEmpty(ERROR_TYPE));
        impact.put("confidence",       state.getNumber(SOLUTION_CONFIDENCE));
        impact.put("stepCount",        state.getTextList(SOLUTION_STEPS).size());
        impact.put("hasCodeChanges",   !state.getTextOrEmpty(CODE_CHANGES).isBlank());
        impact.put("proposedSolution", state.getTextOrEmpty(PROPOSED_SOLUTION));
        return impact;
    }
}
