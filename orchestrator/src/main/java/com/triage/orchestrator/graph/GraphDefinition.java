package com.triage.orchestrator.graph;

import com.triage.orchestrator.graph.GraphValidationException.Kind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable builder for a workflow graph.
 *
 * <pre>
 *   GraphDefinition g = new GraphDefinition(schema);
 *   g.addNode("research", researcher);
 *   g.addNode("solve", solver);
 *   g.addEdge("research", "solve");
 *   g.addConditionalEdge("solve", router, Map.of("refine", "research", "end", GraphDefinition.END));
 *   g.setStart("research");
 *   CompiledGraph plan = g.compile();
 * </pre>
 *
 * Problems such as duplicate names or edges to undeclared nodes are recorded
 * while building and reported by {@link #compile()}, which is the single place
 * a {@link GraphValidationException} comes from. Once compiled, the definition
 * is frozen.
 */
public class GraphDefinition {

    /** Destination that ends a run. No node may use this name. */
    public static final String END = "__end__";

    private final StateSchema schema;

    private final Map<String, Node>                  nodes            = new LinkedHashMap<>();
    private final Set<String>                        checkpointNodes  = new HashSet<>();
    private final Map<String, List<String>>          edges            = new LinkedHashMap<>();
    private final Map<String, List<ConditionalEdge>> conditionalEdges = new LinkedHashMap<>();
    private final List<String>                       duplicateNodes   = new ArrayList<>();
    private final List<String>                       starts           = new ArrayList<>();

    private CompiledGraph compiled;

    public GraphDefinition(StateSchema schema) {
        if (schema == null) throw new IllegalArgumentException("State schema must not be null");
        this.schema = schema;
    }

    // ------------------------------------------------------------------
    // Construction
    // ------------------------------------------------------------------

    public GraphDefinition addNode(String name, Node node) {
        checkNotFrozen();
        if (node == null) throw new IllegalArgumentException("Node '" + name + "' has no implementation");
        if (nodes.containsKey(name)) {
            duplicateNodes.add(name);
        } else {
            nodes.put(name, node);
        }
        return this;
    }

    /** Register a node that is allowed to pause the run with a {@link SuspendRequest}. */
    public GraphDefinition addCheckpointNode(String name, Node node) {
        addNode(name, node);
        checkpointNodes.add(name);
        return this;
    }

    public GraphDefinition addEdge(String from, String to) {
        checkNotFrozen();
        edges.computeIfAbsent(from, k -> new ArrayList<>()).add(to);
        return this;
    }

    /** Conditional edge whose declared outcomes are exactly the keys of {@code outcomeMap}. */
    public GraphDefinition addConditionalEdge(String from, Router router, Map<String, String> outcomeMap) {
        return addConditionalEdge(from, outcomeMap.keySet(), router, outcomeMap);
    }

    /**
     * Conditional edge with an explicitly declared outcome set. Compilation fails
     * if any declared outcome has no destination in {@code outcomeMap}, or if the
     * map binds an outcome that was not declared.
     */
    public GraphDefinition addConditionalEdge(String from, Set<String> outcomes,
                                              Router router, Map<String, String> outcomeMap) {
        checkNotFrozen();
        if (router == null) throw new IllegalArgumentException("Conditional edge from '" + from + "' has no router");
        conditionalEdges.computeIfAbsent(from, k -> new ArrayList<>())
                .add(new ConditionalEdge(from, outcomes, router, outcomeMap));
        return this;
    }

    public GraphDefinition setStart(String name) {
        checkNotFrozen();
        starts.add(name);
        return this;
    }

    // ------------------------------------------------------------------
    // Compilation
    // ------------------------------------------------------------------

    /**
     * Validate the graph and freeze it into an immutable, shareable plan.
     * Calling this again returns the same plan.
     *
     * @throws GraphValidationException on the first structural problem found
     */
    public synchronized CompiledGraph compile() {
        if (compiled != null) return compiled;

        if (!duplicateNodes.isEmpty()) {
            fail(Kind.DUPLICATE_NODE, "Node names declared more than once: " + duplicateNodes);
        }
        for (String name : nodes.keySet()) {
            if (name == null || name.isBlank() || END.equals(name)) {
                fail(Kind.RESERVED_NAME, "Invalid node name '" + name + "'");
            }
        }

        if (starts.isEmpty()) fail(Kind.MISSING_START, "No start node set");
        if (starts.size() > 1) fail(Kind.DUPLICATE_START, "Start node set more than once: " + starts);
        String start = starts.get(0);
        if (!nodes.containsKey(start)) fail(Kind.DANGLING_EDGE, "Start node '" + start + "' is not declared");

        Map<String, String>          next        = new LinkedHashMap<>();
        Map<String, ConditionalEdge> conditional = new LinkedHashMap<>();

        edges.forEach((from, targets) -> {
            requireSource(from);
            for (String to : targets) requireTarget(from, to);
            next.put(from, targets.get(0));
        });

        conditionalEdges.forEach((from, list) -> {
            requireSource(from);
            for (ConditionalEdge edge : list) {
                validateOutcomes(edge);
                conditional.put(from, edge);
            }
        });

        for (String name : nodes.keySet()) {
            int paths = edges.getOrDefault(name, List.of()).size()
                      + conditionalEdges.getOrDefault(name, List.of()).size();
            if (paths == 0) fail(Kind.MISSING_EDGE, "Node '" + name + "' has no outgoing edge");
            if (paths > 1)  fail(Kind.AMBIGUOUS_EDGE, "Node '" + name + "' has " + paths + " outgoing edges");
        }

        Set<String> unreachable = new LinkedHashSet<>(nodes.keySet());
        unreachable.removeAll(reachableFrom(start, next, conditional));
        if (!unreachable.isEmpty()) {
            fail(Kind.UNREACHABLE_NODE, "Nodes not reachable from '" + start + "': " + unreachable);
        }

        compiled = new CompiledGraph(schema, start, nodes, checkpointNodes, next, conditional);
        return compiled;
    }

    public boolean isCompiled() {
        return compiled != null;
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private void validateOutcomes(ConditionalEdge edge) {
        String from = edge.from();
        for (String outcome : edge.outcomes()) {
            String destination = edge.destinations().get(outcome);
            if (destination == null || destination.isBlank()) {
                fail(Kind.UNBOUND_OUTCOME, "Outcome '" + outcome + "' of '" + from + "' has no destination");
            }
        }
        for (Map.Entry<String, String> e : edge.destinations().entrySet()) {
            if (!edge.outcomes().contains(e.getKey())) {
                fail(Kind.UNBOUND_OUTCOME, "Destination bound for undeclared outcome '"
                        + e.getKey() + "' of '" + from + "'");
            }
            requireTarget(from, e.getValue());
        }
        if (edge.outcomes().isEmpty()) {
            fail(Kind.UNBOUND_OUTCOME, "Conditional edge from '" + from + "' declares no outcomes");
        }
    }

    private void requireSource(String from) {
        if (!nodes.containsKey(from)) {
            fail(Kind.DANGLING_EDGE, "Edge starts at undeclared node '" + from + "'");
        }
    }

    private void requireTarget(String from, String to) {
        if (!END.equals(to) && !nodes.containsKey(to)) {
            fail(Kind.DANGLING_EDGE, "Edge from '" + from + "' points to undeclared node '" + to + "'");
        }
    }

    /** Breadth-first walk over unconditional edges and every outcome of every conditional edge. */
    private static Set<String> reachableFrom(String start,
                                             Map<String, String> next,
                                             Map<String, ConditionalEdge> conditional) {
        Set<String>   seen  = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        seen.add(start);
        queue.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            List<String> targets = new ArrayList<>();
            if (next.containsKey(current)) targets.add(next.get(current));
            if (conditional.containsKey(current)) targets.addAll(conditional.get(current).destinations().values());
            for (String t : targets) {
                if (!END.equals(t) && seen.add(t)) queue.add(t);
            }
        }
        return seen;
    }

    private void checkNotFrozen() {
        if (compiled != null) {
            throw new IllegalStateException("Graph has been compiled and can no longer be modified");
        }
    }

    private static void fail(Kind kind, String message) {
        throw new GraphValidationException(kind, message);
    }
}
