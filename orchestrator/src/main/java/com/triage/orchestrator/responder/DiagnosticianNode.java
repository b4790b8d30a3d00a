package com.triage.orchestrator.responder;

import com.triage.orchestrator.graph.AgentState;
import com.triage.orchestrator.graph.Node;
import com.triage.orchestrator.graph.NodeResult;
import com.triage.orchestrator.graph.StateUpdate;
import com.triage.orchestrator.llm.LanguageModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

import static com.triage.orchestrator.responder.IncidentState.*;

/**
 * Entry node: classifies the error log and plans the research.
 *
 * Produces the error type and summary, the affected components, up to
 * {@value #MAX_QUERIES} search queries and the file patterns worth auditing.
 */
public class DiagnosticianNode implements Node {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticianNode.class);

    static final int MAX_QUERIES = 5;

    private static final List<String> LEGACY_FIELDS = List.of(
            "ERROR_TYPE", "ERROR_SUMMARY", "AFFECTED_COMPONENTS", "SEARCH_QUERIES",
            "FILES_TO_CHECK", "SEVERITY", "IMMEDIATE_ACTIONS");

    private final LanguageModel llm;

    public DiagnosticianNode(LanguageModel llm) {
        this.llm = llm;
    }

    @Override
    public NodeResult execute(AgentState state) {
        String response = llm.generate(IncidentPrompts.DIAGNOSTICIAN_SYSTEM,
                IncidentPrompts.diagnostician(state.getTextOrEmpty(ERROR_LOG)));

        String       errorType;
        String       errorSummary;
        List<String> components;
        List<String> queries;
        List<String> files;

        Map<String, Object> parsed = ResponseParser.parseJson(response);
        if (!parsed.isEmpty()) {
            errorType    = ResponseParser.text(parsed, "error_type", "unknown");
            errorSummary = ResponseParser.text(parsed, "error_summary", "N/A");
            components   = ResponseParser.textList(parsed.get("affected_components"));
            queries      = ResponseParser.textList(parsed.get("search_keywords"));
            files        = ResponseParser.textList(parsed.get("files_to_check"));
        } else {
            log.debug("Diagnosis is not JSON, falling back to field parsing");
            Map<String, String> fields = ResponseParser.parseFields(response, LEGACY_FIELDS);
            errorType    = ResponseParser.text(fields, "error_type", "unknown");
            errorSummary = ResponseParser.text(fields, "error_summary", "N/A");
            components   = ResponseParser.splitCsv(fields.get("affected_components"));
            queries      = ResponseParser.splitCsv(fields.get("search_queries"));
            files        = ResponseParser.splitCsv(fields.get("files_to_check"));
        }

        if (queries.size() > MAX_QUERIES) queries = queries.subList(0, MAX_QUERIES);
        log.info("Diagnosed {} error; {} search queries, {} file patterns",
                errorType, queries.size(), files.size());

        return NodeResult.of(StateUpdate.builder()
                .set(ERROR_TYPE, errorType)
                .set(ERROR_SUMMARY, errorSummary)
                .set(AFFECTED_COMPONENTS, components)
                .set(SEARCH_QUERIES, queries)
                .set(FILES_TO_CHECK, files)
                .set(MESSAGES, appendMessage(state, "[Diagnostician] " + response))
                .set(STATUS, STATUS_RESEARCHING)
                .build());
    }
}
