package com.triage.orchestrator.responder;

import com.triage.orchestrator.graph.AgentState;
import com.triage.orchestrator.graph.Node;
import com.triage.orchestrator.graph.NodeResult;
import com.triage.orchestrator.graph.StateUpdate;
import com.triage.orchestrator.llm.LanguageModel;
import com.triage.orchestrator.workspace.CodeReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.triage.orchestrator.responder.IncidentState.*;

/**
 * Reads the files the diagnosis pointed at and asks the model for a code-level
 * root-cause analysis. Patterns that cannot be searched and unreadable files
 * are skipped.
 */
public class CodeAuditorNode implements Node {

    private static final Logger log = LoggerFactory.getLogger(CodeAuditorNode.class);

    static final int    FILES_PER_PATTERN = 2;
    static final String NO_FILES          = "No relevant code files found or accessible.";

    private final LanguageModel llm;
    private final CodeReader    reader;

    public CodeAuditorNode(LanguageModel llm, CodeReader reader) {
        this.llm    = llm;
        this.reader = reader;
    }

    @Override
    public NodeResult execute(AgentState state) {
        StringBuilder context = new StringBuilder();
        Set<String>   read    = new LinkedHashSet<>();

        for (String pattern : state.getTextList(FILES_TO_CHECK)) {
            List<String> matches;
            try {
                matches = reader.find(List.of("**/" + pattern, "**/*" + pattern + "*"));
            } catch (RuntimeException e) {
                log.warn("Search for '{}' failed: {}", pattern, e.getMessage());
                continue;
            }
            for (String path : matches.subList(0, Math.min(FILES_PER_PATTERN, matches.size()))) {
                if (!read.add(path)) continue;
                try {
                    context.append(reader.format(reader.read(path)));
                } catch (RuntimeException e) {
                    log.warn("Could not read {}: {}", path, e.getMessage());
                }
            }
        }

        String codeContext = context.length() == 0 ? NO_FILES : context.toString();
        log.info("Auditing {} file(s)", read.size());

        String response = llm.generate(IncidentPrompts.CODE_AUDITOR_SYSTEM,
                IncidentPrompts.codeAuditor(
                        state.getTextOrEmpty(ERROR_SUMMARY),
                        state.getTextOrEmpty(ERROR_TYPE),
                        String.join("\n", state.getTextList(RESEARCH_FINDINGS)),
                        codeContext));

        return NodeResult.of(StateUpdate.builder()
                .set(CODE_CONTEXT, codeContext + "\n\n[Analysis]\n" + response)
                .set(MESSAGES, appendMessage(state, "[Code Auditor] " + response))
                .set(STATUS, STATUS_SOLVING)
                .build());
    }
}
