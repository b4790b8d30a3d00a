package com.triage.orchestrator.responder;

import com.triage.orchestrator.graph.AgentState;
import com.triage.orchestrator.graph.Node;
import com.triage.orchestrator.graph.NodeResult;
import com.triage.orchestrator.graph.StateUpdate;
import com.triage.orchestrator.llm.LanguageModel;
import com.triage.orchestrator.search.SearchClient;
import com.triage.orchestrator.search.SearchHit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.triage.orchestrator.responder.IncidentState.*;

/**
 * Runs the planned web searches and asks the model what they show.
 *
 * Each call counts as one research iteration. While the model wants more
 * research, has a narrower query and the iteration budget is not spent, the
 * node stays in {@code researching} with the refined query; otherwise it hands
 * over to the code audit.
 */
public class ResearcherNode implements Node {

    private static final Logger log = LoggerFactory.getLogger(ResearcherNode.class);

    static final int    RESULTS_PER_QUERY = 5;
    static final String NO_RESULTS        = "No search results found.";

    private static final List<String> LEGACY_FIELDS = List.of(
            "RELEVANT_FINDINGS", "COMMON_SOLUTIONS", "POTENTIAL_PITFALLS",
            "CONFIDENCE_LEVEL", "NEED_MORE_RESEARCH", "REFINED_QUERY");

    private final LanguageModel llm;
    private final SearchClient  search;

    public ResearcherNode(LanguageModel llm, SearchClient search) {
        this.llm    = llm;
        this.search = search;
    }

    @Override
    public NodeResult execute(AgentState state) {
        List<String> results = new ArrayList<>();
        for (String query : state.getTextList(SEARCH_QUERIES)) {
            try {
                for (SearchHit hit : search.searchTechnical(query, RESULTS_PER_QUERY)) {
                    results.add("[%s](%s)\n%s".formatted(hit.title(), hit.url(), hit.content()));
                }
            } catch (RuntimeException e) {
                log.warn("Search for '{}' failed: {}", query, e.getMessage());
                results.add("Search for '%s' failed: %s".formatted(query, e.getMessage()));
            }
        }
        String searchResults = results.isEmpty() ? NO_RESULTS : String.join("\n\n---\n\n", results);

        String response = llm.generate(IncidentPrompts.RESEARCHER_SYSTEM,
                IncidentPrompts.researcher(state.getTextOrEmpty(ERROR_SUMMARY),
                        state.getTextOrEmpty(ERROR_TYPE), searchResults));

        boolean      needMore;
        String       refinedQuery;
        List<String> newFindings;

        Map<String, Object> parsed = ResponseParser.parseJson(response);
        if (!parsed.isEmpty()) {
            needMore     = ResponseParser.flag(parsed.get("needs_more_research"));
            refinedQuery = ResponseParser.text(parsed, "refined_query", "");
            newFindings  = List.of(
                    "Solutions:\n" + formatSolutions(parsed.get("relevant_solutions")),
                    "Common patterns: " + String.join(", ", ResponseParser.textList(parsed.get("common_patterns"))),
                    "Warnings: " + String.join(", ", ResponseParser.textList(parsed.get("warnings"))));
        } else {
            Map<String, String> fields = ResponseParser.parseFields(response, LEGACY_FIELDS);
            needMore     = ResponseParser.flag(fields.get("need_more_research"));
            refinedQuery = fields.get("refined_query");
            newFindings  = List.of(fields.get("relevant_findings"), fields.get("common_solutions"));
        }
        if ("null".equalsIgnoreCase(refinedQuery)) refinedQuery = "";

        List<String> findings = new ArrayList<>(state.getTextList(RESEARCH_FINDINGS));
        findings.addAll(newFindings);

        int iterations    = state.getInt(ITERATIONS) + 1;
        int maxIterations = state.getInt(MAX_ITERATIONS);
        List<String> messages = appendMessage(state, "[Researcher] " + response);

        if (needMore && !refinedQuery.isBlank() && iterations < maxIterations) {
            log.info("More research needed (iteration {}/{}), refined query: {}",
                    iterations, maxIterations, refinedQuery);
            return NodeResult.of(StateUpdate.builder()
                    .set(RESEARCH_FINDINGS, findings)
                    .set(SEARCH_QUERIES, List.of(refinedQuery))
                    .set(ITERATIONS, iterations)
                    .set(MESSAGES, messages)
                    .set(STATUS, STATUS_RESEARCHING)
                    .build());
        }

        log.info("Research complete after {} iteration(s)", iterations);
        return NodeResult.of(StateUpdate.builder()
                .set(RESEARCH_FINDINGS, findings)
                .set(RELEVANT_DOCS, List.of(searchResults))
                .set(ITERATIONS, iterations)
                .set(MESSAGES, messages)
                .set(STATUS, STATUS_AUDITING)
                .build());
    }

    private static String formatSolutions(Object solutions) {
        if (!(solutions instanceof List)) return "";
        return ((List<?>) solutions).stream()
                .filter(Map.class::isInstance)
                .map(s -> (Map<?, ?>) s)
                .map(s -> "- %s (Source: %s, Confidence: %s)".formatted(
                        valueOr(s.get("solution_summary"), ""),
                        valueOr(s.get("source_url"), "unknown"),
                        valueOr(s.get("confidence"), "unknown")))
                .collect(Collectors.joining("\n"));
    }

    private static String valueOr(Object value, String fallback) {
        return value == null ? fallback : String.valueOf(value);
    }
}
