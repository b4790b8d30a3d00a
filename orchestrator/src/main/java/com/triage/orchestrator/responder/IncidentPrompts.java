package com.triage.orchestrator.responder;

/**
 * System and task prompts for the incident-responder nodes.
 *
 * Every task prompt asks for a single JSON object; the keys listed in each
 * prompt are the ones the corresponding node reads. Placeholders of the form
 * {@code {{NAME}}} are filled with plain string replacement so that log text
 * containing braces or percent signs passes through untouched.
 */
public final class IncidentPrompts {

    private IncidentPrompts() {}

    // ------------------------------------------------------------------
    // Diagnostician
    // ------------------------------------------------------------------

    public static final String DIAGNOSTICIAN_SYSTEM = """
            You are an experienced site reliability engineer. You read error logs and
            stack traces and work out which category of failure they show and which
            parts of the system are involved.

            You know databases (PostgreSQL, MySQL, MongoDB, Redis), containers and
            orchestration (Docker, Kubernetes), the major cloud platforms, common web
            frameworks, message brokers, networking and authentication systems.

            Be specific and give steps someone can act on.
            """;

    private static final String DIAGNOSTICIAN_TASK = """
            Diagnose the following error log.

            ERROR LOG:
            ```
            {{ERROR_LOG}}
            ```

            Reply with one JSON object and nothing else:
            {
              "error_type": "database|network|authentication|configuration|code_bug|dependency|resource_exhaustion|permission|timeout|unknown",
              "error_summary": "one paragraph in plain English",
              "affected_components": ["component", "..."],
              "search_keywords": ["2-3 precise web search queries"],
              "files_to_check": ["file names or patterns such as docker-compose.yml"],
              "severity": "low|medium|high|critical",
              "immediate_actions": ["first things to check"]
            }
            """;

    public static String diagnostician(String errorLog) {
        return DIAGNOSTICIAN_TASK.replace("{{ERROR_LOG}}", errorLog);
    }

    // ------------------------------------------------------------------
    // Researcher
    // ------------------------------------------------------------------

    public static final String RESEARCHER_SYSTEM = """
            You are a technical researcher. You read web search results about a
            software failure and pull out the fixes that actually worked.

            Prefer official documentation over forum posts, note where sources agree,
            and call out caveats or fixes that are known to cause trouble.
            """;

    private static final String RESEARCHER_TASK = """
            Extract what is useful for fixing this error from the search results.

            ERROR SUMMARY:
            {{ERROR_SUMMARY}}

            ERROR TYPE: {{ERROR_TYPE}}

            SEARCH RESULTS:
            {{SEARCH_RESULTS}}

            Reply with one JSON object and nothing else:
            {
              "relevant_solutions": [
                {"solution_summary": "...", "source_url": "...", "confidence": "low|medium|high"}
              ],
              "common_patterns": ["..."],
              "warnings": ["..."],
              "needs_more_research": false,
              "refined_query": "a narrower search query if needs_more_research is true, else null"
            }
            """;

    public static String researcher(String errorSummary, String errorType, String searchResults) {
        return RESEARCHER_TASK
                .replace("{{ERROR_SUMMARY}}", errorSummary)
                .replace("{{ERROR_TYPE}}", errorType)
                .replace("{{SEARCH_RESULTS}}", searchResults);
    }

    // ------------------------------------------------------------------
    // Code auditor
    // ------------------------------------------------------------------

    public static final String CODE_AUDITOR_SYSTEM = """
            You are a senior code reviewer doing root-cause analysis. Look for wrong
            configuration (ports, hosts, credentials), logic errors, missing error
            handling, leaked resources and version mismatches between components.
            """;

    private static final String CODE_AUDITOR_TASK = """
            Review these files in light of the error under investigation.

            ERROR SUMMARY:
            {{ERROR_SUMMARY}}

            ERROR TYPE: {{ERROR_TYPE}}

            RESEARCH FINDINGS:
            {{RESEARCH_FINDINGS}}

            CODE FILES:
            {{CODE_CONTEXT}}

            Cover:
            LIKELY_CAUSE: the most probable cause given the code and the error
            PROBLEMATIC_SECTIONS: the exact lines or blocks involved
            MISSING_ELEMENTS: error handling, configuration or logic that is absent
            CODE_QUALITY_NOTES: anything else that should be fixed
            """;

    public static String codeAuditor(String errorSummary, String errorType,
                                     String researchFindings, String codeContext) {
        return CODE_AUDITOR_TASK
                .replace("{{ERROR_SUMMARY}}", errorSummary)
                .replace("{{ERROR_TYPE}}", errorType)
                .replace("{{RESEARCH_FINDINGS}}", researchFindings)
                .replace("{{CODE_CONTEXT}}", codeContext);
    }

    // ------------------------------------------------------------------
    // Solver
    // ------------------------------------------------------------------

    public static final String SOLVER_SYSTEM = """
            You are a senior DevOps engineer. Your fixes are specific, safe and
            explained well enough that the operator understands what changes and why.

            State whether the fix needs downtime, how to roll it back, and any
            security impact. Flag destructive or risky operations for approval.
            """;

    private static final String SOLVER_TASK = """
            Propose a fix based on the whole investigation.

            ERROR SUMMARY:
            {{ERROR_SUMMARY}}

            ERROR TYPE: {{ERROR_TYPE}}

            RESEARCH FINDINGS:
            {{RESEARCH_FINDINGS}}

            CODE ANALYSIS:
            {{CODE_ANALYSIS}}

            Reply with one JSON object and nothing else:
            {
              "root_cause": "one paragraph",
              "solution_summary": "what needs to be done",
              "confidence_score": 0.0,
              "step_by_step": ["first step", "second step"],
              "executable_commands": ["shell commands, if any"],
              "file_changes": [
                {"file_path": "...", "description": "...", "before": "...", "after": "..."}
              ],
              "requires_approval": false,
              "approval_reason": "what needs sign-off and why, or null",
              "prevention": "how to stop this recurring",
              "verification": "how to confirm the fix worked"
            }
            confidence_score is between 0.0 and 1.0.
            """;

    public static String solver(String errorSummary, String errorType,
                                String researchFindings, String codeAnalysis) {
        return SOLVER_TASK
                .replace("{{ERROR_SUMMARY}}", errorSummary)
                .replace("{{ERROR_TYPE}}", errorType)
                .replace("{{RESEARCH_FINDINGS}}", researchFindings)
                .replace("{{CODE_ANALYSIS}}", codeAnalysis);
    }
}
