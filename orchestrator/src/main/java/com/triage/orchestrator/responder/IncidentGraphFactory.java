package com.triage.orchestrator.responder;

import com.triage.orchestrator.graph.CompiledGraph;
import com.triage.orchestrator.graph.GraphDefinition;
import com.triage.orchestrator.llm.LanguageModel;
import com.triage.orchestrator.search.SearchClient;
import com.triage.orchestrator.workspace.CodeReader;

import java.util.Map;

/**
 * Wires the incident-responder nodes into a graph:
 *
 * <pre>
 *   diagnose -> research
 *   research --continue_research--> research | audit
 *   audit    -> solve
 *   solve    --solution_confidence--> refine: research | approve: human_approval | end: END
 *   human_approval (checkpoint) -> END
 * </pre>
 */
public class IncidentGraphFactory {

    public static final String DIAGNOSE       = "diagnose";
    public static final String RESEARCH       = "research";
    public static final String AUDIT          = "audit";
    public static final String SOLVE          = "solve";
    public static final String HUMAN_APPROVAL = "human_approval";

    private final LanguageModel llm;
    private final SearchClient  search;
    private final CodeReader    reader;

    public IncidentGraphFactory(LanguageModel llm, SearchClient search, CodeReader reader) {
        this.llm    = llm;
        this.search = search;
        this.reader = reader;
    }

    /**
     * @param maxIterations   default research/refine budget written into each run's state
     * @param refineThreshold confidence below which the solver's answer is sent back to research
     */
    public CompiledGraph build(int maxIterations, double refineThreshold) {
        IncidentRouting routing = new IncidentRouting(refineThreshold);

        return new GraphDefinition(IncidentState.schema(maxIterations))
                .addNode(DIAGNOSE, new DiagnosticianNode(llm))
                .addNode(RESEARCH, new ResearcherNode(llm, search))
                .addNode(AUDIT,    new CodeAuditorNode(llm, reader))
                .addNode(SOLVE,    new SolverNode(llm))
                .addCheckpointNode(HUMAN_APPROVAL, new HumanApprovalNode())
                .setStart(DIAGNOSE)
                .addEdge(DIAGNOSE, RESEARCH)
                .addConditionalEdge(RESEARCH, routing::continueResearch, Map.of(
                        IncidentRouting.RESEARCH, RESEARCH,
                        IncidentRouting.AUDIT,    AUDIT))
                .addEdge(AUDIT, SOLVE)
                .addConditionalEdge(SOLVE, routing::solutionConfidence, Map.of(
                        IncidentRouting.REFINE,  RESEARCH,
                        IncidentRouting.APPROVE, HUMAN_APPROVAL,
                        IncidentRouting.END,     GraphDefinition.END))
                .addEdge(HUMAN_APPROVAL, GraphDefinition.END)
                .compile();
    }
}
