package com.triage.orchestrator.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of a run's shared state.
 *
 * Nodes read from it and return a {@link StateUpdate}; the executor produces
 * the next snapshot with {@link #merge}. Fields the update does not name keep
 * their previous value.
 */
public final class AgentState {

    private final StateSchema         schema;
    private final Map<String, Object> values;

    AgentState(StateSchema schema, Map<String, Object> values) {
        this.schema = schema;
        this.values = Collections.unmodifiableMap(values);
    }

    public StateSchema schema() { return schema; }

    // ------------------------------------------------------------------
    // Merge
    // ------------------------------------------------------------------

    /**
     * Apply a partial update, last writer wins per field.
     *
     * @throws StateUpdateException if the update names an undeclared field or a value has the wrong type
     */
    public AgentState merge(StateUpdate update) {
        if (update == null || update.isEmpty()) return this;
        Map<String, Object> next = new LinkedHashMap<>(values);
        update.values().forEach((name, value) ->
                next.put(name, schema.field(name).type().coerce(name, value)));
        return new AgentState(schema, next);
    }

    // ------------------------------------------------------------------
    // Typed accessors
    // ------------------------------------------------------------------

    public Object get(String field) {
        schema.field(field);
        return values.get(field);
    }

    public String getText(String field) {
        return (String) get(field);
    }

    /** Text value, or the empty string when unset. */
    public String getTextOrEmpty(String field) {
        String v = getText(field);
        return v == null ? "" : v;
    }

    public Double getNumber(String field) {
        return (Double) get(field);
    }

    public Integer getInteger(String field) {
        return (Integer) get(field);
    }

    /** Integer value, or 0 when unset. */
    public int getInt(String field) {
        Integer v = getInteger(field);
        return v == null ? 0 : v;
    }

    public Boolean getBoolean(String field) {
        return (Boolean) get(field);
    }

    @SuppressWarnings("unchecked")
    public List<String> getTextList(String field) {
        List<String> v = (List<String>) get(field);
        return v == null ? List.of() : v;
    }

    /** All fields in schema order. The map may contain null values. */
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AgentState && values.equals(((AgentState) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "AgentState" + values;
    }
}
