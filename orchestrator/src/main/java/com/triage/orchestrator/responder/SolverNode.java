package com.triage.orchestrator.responder;

import com.triage.orchestrator.graph.AgentState;
import com.triage.orchestrator.graph.Node;
import com.triage.orchestrator.graph.NodeResult;
import com.triage.orchestrator.graph.StateUpdate;
import com.triage.orchestrator.llm.LanguageModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.triage.orchestrator.responder.IncidentState.*;

/**
 * Combines diagnosis, research and code analysis into a proposed fix with a
 * confidence score. A fix the model flags as risky is marked for approval.
 */
public class SolverNode implements Node {

    private static final Logger log = LoggerFactory.getLogger(SolverNode.class);

    static final double DEFAULT_CONFIDENCE = 0.5;

    private static final Pattern NUMBERED_STEP = Pattern.compile("\\d+\\.\\s*(.+)");

    private static final List<String> LEGACY_FIELDS = List.of(
            "DIAGNOSIS_SUMMARY", "SOLUTION_CONFIDENCE", "PROPOSED_SOLUTION", "STEP_BY_STEP",
            "CODE_CHANGES", "COMMANDS_TO_RUN", "REQUIRES_APPROVAL", "APPROVAL_REASON",
            "PREVENTION", "VERIFICATION");

    private final LanguageModel llm;

    public SolverNode(LanguageModel llm) {
        this.llm = llm;
    }

    @Override
    public NodeResult execute(AgentState state) {
        String codeAnalysis = state.getTextOrEmpty(CODE_CONTEXT);
        String response = llm.generate(IncidentPrompts.SOLVER_SYSTEM,
                IncidentPrompts.solver(
                        state.getTextOrEmpty(ERROR_SUMMARY),
                        state.getTextOrEmpty(ERROR_TYPE),
                        String.join("\n", state.getTextList(RESEARCH_FINDINGS)),
                        codeAnalysis.isBlank() ? "No code analysis available" : codeAnalysis));

        Solution solution;
        Map<String, Object> parsed = ResponseParser.parseJson(response);
        if (!parsed.isEmpty()) {
            solution = fromJson(parsed);
        } else {
            log.debug("Solution is not JSON, falling back to field parsing");
            solution = fromFields(ResponseParser.parseFields(response, LEGACY_FIELDS), response);
        }

        double confidence = Math.max(0.0, Math.min(1.0, solution.confidence()));
        String status = solution.requiresApproval() ? STATUS_AWAITING_APPROVAL : STATUS_COMPLETE;
        log.info("Proposed solution with confidence {}%, approval required: {}",
                Math.round(confidence * 100), solution.requiresApproval());

        return NodeResult.of(StateUpdate.builder()
                .set(PROPOSED_SOLUTION, solution.text())
                .set(SOLUTION_CONFIDENCE, confidence)
                .set(SOLUTION_STEPS, solution.steps())
                .set(CODE_CHANGES, solution.codeChanges())
                .set(NEEDS_HUMAN_APPROVAL, solution.requiresApproval())
                .set(PENDING_ACTION, solution.approvalReason())
                .set(MESSAGES, appendMessage(state, "[Solver] " + response))
                .set(STATUS, status)
                .build());
    }

    // ------------------------------------------------------------------
    // Parsing
    // ------------------------------------------------------------------

    record Solution(String text, double confidence, List<String> steps, String codeChanges,
                    boolean requiresApproval, String approvalReason) {}

    static Solution fromJson(Map<String, Object> parsed) {
        List<String> steps    = ResponseParser.textList(parsed.get("step_by_step"));
        List<String> commands = ResponseParser.textList(parsed.get("executable_commands"));
        List<Map<?, ?>> fileChanges = new ArrayList<>();
        if (parsed.get("file_changes") instanceof List) {
            for (Object fc : (List<?>) parsed.get("file_changes")) {
                if (fc instanceof Map) fileChanges.add((Map<?, ?>) fc);
            }
        }
        String prevention   = ResponseParser.text(parsed, "prevention", "");
        String verification = ResponseParser.text(parsed, "verification", "");

        List<String> lines = new ArrayList<>();
        lines.add(ResponseParser.text(parsed, "root_cause", ""));
        lines.add("");
        lines.add(ResponseParser.text(parsed, "solution_summary", ""));
        lines.add("");
        if (!steps.isEmpty()) {
            lines.add("Steps:");
            for (int i = 0; i < steps.size(); i++) lines.add("  %d. %s".formatted(i + 1, steps.get(i)));
            lines.add("");
        }
        if (!commands.isEmpty()) {
            lines.add("Commands to run:");
            commands.forEach(c -> lines.add("  $ " + c));
            lines.add("");
        }
        if (!fileChanges.isEmpty()) {
            lines.add("File changes:");
            fileChanges.forEach(fc -> lines.add("  - %s: %s".formatted(
                    valueOr(fc.get("file_path"), "unknown"), valueOr(fc.get("description"), ""))));
            lines.add("");
        }
        if (!prevention.isEmpty())   lines.add("Prevention: " + prevention);
        if (!verification.isEmpty()) lines.add("Verification: " + verification);

        List<String> changes = new ArrayList<>();
        for (Map<?, ?> fc : fileChanges) {
            String before = valueOr(fc.get("before"), "");
            String after  = valueOr(fc.get("after"), "");
            if (!before.isEmpty() && !after.isEmpty()) {
                changes.add("File: " + valueOr(fc.get("file_path"), "unknown"));
                changes.add("Before:\n" + before);
                changes.add("After:\n" + after);
                changes.add("---");
            }
        }

        return new Solution(
                String.join("\n", lines),
                ResponseParser.number(parsed.get("confidence_score"), DEFAULT_CONFIDENCE),
                steps,
                String.join("\n", changes),
                ResponseParser.flag(parsed.get("requires_approval")),
                ResponseParser.text(parsed, "approval_reason", ""));
    }

    static Solution fromFields(Map<String, String> fields, String response) {
        List<String> steps = new ArrayList<>();
        Matcher m = NUMBERED_STEP.matcher(fields.get("step_by_step"));
        while (m.find()) steps.add(m.group(1).strip());

        return new Solution(
                ResponseParser.text(fields, "proposed_solution", response),
                ResponseParser.number(fields.get("solution_confidence"), DEFAULT_CONFIDENCE),
                steps,
                fields.get("code_changes"),
                ResponseParser.flag(fields.get("requires_approval")),
                fields.get("approval_reason"));
    }

    private static String valueOr(Object value, String fallback) {
        return value == null ? fallback : String.valueOf(value);
    }
}
