package com.triage.orchestrator.graph;

/**
 * Thrown by {@link GraphDefinition#compile()} when the graph is malformed.
 * A graph that fails validation is never run.
 */
public class GraphValidationException extends RuntimeException {

    public enum Kind {
        DUPLICATE_NODE,
        RESERVED_NAME,
        MISSING_START,
        DUPLICATE_START,
        DANGLING_EDGE,
        UNBOUND_OUTCOME,
        MISSING_EDGE,
        AMBIGUOUS_EDGE,
        UNREACHABLE_NODE
    }

    private final Kind kind;

    public GraphValidationException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
