package com.triage.orchestrator.graph;

/**
 * Thrown when a value cannot be merged into an {@link AgentState}: the field is
 * not declared by the schema, the value has the wrong type, or a single update
 * names the same field twice.
 */
public class StateUpdateException extends RuntimeException {

    public enum Kind { UNKNOWN_FIELD, TYPE_MISMATCH, DUPLICATE_FIELD, MISSING_FIELD }

    private final Kind   kind;
    private final String field;

    public StateUpdateException(Kind kind, String field, String message) {
        super("[" + kind + "] " + field + ": " + message);
        this.kind  = kind;
        this.field = field;
    }

    public Kind getKind()    { return kind; }
    public String getField() { return field; }
}
