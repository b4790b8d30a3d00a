package com.triage.orchestrator.graph;

/**
 * Picks the outcome of a conditional edge from the state the source node just produced.
 * The returned label must be one of the outcomes declared for the edge.
 */
@FunctionalInterface
public interface Router {

    String route(AgentState state);
}
