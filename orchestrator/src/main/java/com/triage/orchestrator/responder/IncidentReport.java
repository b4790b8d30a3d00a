package com.triage.orchestrator.responder;

import com.triage.orchestrator.graph.AgentState;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.triage.orchestrator.responder.IncidentState.*;

/**
 * Renders the final state of an investigation as a Markdown report.
 */
@Component
public class IncidentReport {

    public String render(AgentState state) {
        Double confidence = state.getNumber(SOLUTION_CONFIDENCE);
        List<String> components = state.getTextList(AFFECTED_COMPONENTS);

        StringBuilder sb = new StringBuilder();
        sb.append("""
                # Incident Investigation Report

                ## Error Summary
                **Type:** %s
                **Confidence:** %d%%
                **Iterations:** %d

                ## Original Error
                ```
                %s
                ```

                ## Diagnosis
                %s

                ## Affected Components
                %s

                ## Proposed Solution
                %s

                ## Implementation Steps
                """.formatted(
                state.getTextOrEmpty(ERROR_TYPE),
                Math.round((confidence == null ? 0.0 : confidence) * 100),
                state.getInt(ITERATIONS),
                orNa(state.getTextOrEmpty(ERROR_LOG)),
                orNa(state.getTextOrEmpty(ERROR_SUMMARY)),
                components.isEmpty() ? "N/A" : String.join(", ", components),
                orNa(state.getTextOrEmpty(PROPOSED_SOLUTION))));

        List<String> steps = state.getTextList(SOLUTION_STEPS);
        for (int i = 0; i < steps.size(); i++) {
            sb.append(i + 1).append(". ").append(steps.get(i)).append('\n');
        }

        String codeChanges = state.getTextOrEmpty(CODE_CHANGES);
        if (!codeChanges.isBlank()) {
            sb.append("""

                    ## Code Changes
                    ```
                    %s
                    ```
                    """.formatted(codeChanges));
        }

        if (Boolean.TRUE.equals(state.getBoolean(NEEDS_HUMAN_APPROVAL))) {
            String action = state.getTextOrEmpty(PENDING_ACTION);
            sb.append("""

                    ## Requires Human Approval
                    %s
                    """.formatted(action.isBlank() ? "No details provided" : action));
            Boolean approved = state.getBoolean(APPROVED);
            if (approved != null) {
                sb.append("**Decision:** ").append(approved ? "approved" : "rejected").append('\n');
            }
        }
        return sb.toString();
    }

    private static String orNa(String value) {
        return value.isBlank() ? "N/A" : value;
    }
}
