package com.triage.orchestrator.graph;

/**
 * A named unit of work in a graph.
 *
 * Implementations are stateless between invocations: anything a node needs to
 * remember across a loop lives in the {@link AgentState}. Collaborators such
 * as API clients are handed to the node when the graph is built.
 */
@FunctionalInterface
public interface Node {

    /**
     * Do this node's work against the current state.
     *
     * @return the fields to change, optionally with a suspension request
     * @throws Exception any failure; the run ends as {@code Failed(NODE_EXECUTION)}
     */
    NodeResult execute(AgentState state) throws Exception;
}
