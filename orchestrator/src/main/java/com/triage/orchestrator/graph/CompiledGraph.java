package com.triage.orchestrator.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Validated, immutable execution plan produced by {@link GraphDefinition#compile()}.
 *
 * Holds no per-run state, so one instance is shared by every concurrent run.
 */
public final class CompiledGraph {

    private final StateSchema                  schema;
    private final String                       start;
    private final Map<String, Node>            nodes;
    private final Set<String>                  checkpointNodes;
    private final Map<String, String>          next;
    private final Map<String, ConditionalEdge> conditional;

    CompiledGraph(StateSchema schema,
                  String start,
                  Map<String, Node> nodes,
                  Set<String> checkpointNodes,
                  Map<String, String> next,
                  Map<String, ConditionalEdge> conditional) {
        this.schema          = schema;
        this.start           = start;
        this.nodes           = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.checkpointNodes = Set.copyOf(checkpointNodes);
        this.next            = Map.copyOf(next);
        this.conditional     = Map.copyOf(conditional);
    }

    public StateSchema schema()           { return schema; }
    public String      start()            { return start; }
    public Set<String> nodeNames()        { return nodes.keySet(); }
    public boolean     hasNode(String n)  { return nodes.containsKey(n); }

    public boolean isCheckpoint(String name) {
        return checkpointNodes.contains(name);
    }

    Node node(String name) {
        Node n = nodes.get(name);
        if (n == null) throw new IllegalArgumentException("Unknown node: " + name);
        return n;
    }

    /**
     * Resolve the node that follows {@code from}, evaluated against the state
     * {@code from} just produced.
     *
     * @return a node name or {@link GraphDefinition#END}
     * @throws RoutingException if the router throws or returns an undeclared outcome
     */
    public String nextNode(String from, AgentState state) {
        String target = next.get(from);
        if (target != null) return target;

        ConditionalEdge edge = conditional.get(from);
        String outcome;
        try {
            outcome = edge.router().route(state);
        } catch (RuntimeException e) {
            throw new RoutingException("Router of '" + from + "' failed: " + e.getMessage(), e);
        }
        if (outcome == null || !edge.outcomes().contains(outcome)) {
            throw new RoutingException("Router of '" + from + "' returned undeclared outcome '"
                    + outcome + "', expected one of " + edge.outcomes());
        }
        return edge.destinations().get(outcome);
    }
}
