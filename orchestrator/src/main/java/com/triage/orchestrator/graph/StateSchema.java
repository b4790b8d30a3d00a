package com.triage.orchestrator.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The fixed set of named, typed fields that make up a run's state.
 *
 * A schema is built once when the graph is defined and shared by every run of
 * that graph. Defaults are applied to fields the caller leaves out of the
 * initial values; a TEXT_LIST field defaults to the empty list.
 */
public final class StateSchema {

    public record Field(String name, FieldType type, Object defaultValue) {}

    private final Map<String, Field> fields;

    private StateSchema(Map<String, Field> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Builder builder() {
        return new Builder();
    }

    // ------------------------------------------------------------------
    // Introspection
    // ------------------------------------------------------------------

    public Set<String> fieldNames()          { return fields.keySet(); }
    public boolean     declares(String name) { return fields.containsKey(name); }

    public FieldType typeOf(String name) {
        return field(name).type();
    }

    Field field(String name) {
        Field f = fields.get(name);
        if (f == null) {
            throw new StateUpdateException(StateUpdateException.Kind.UNKNOWN_FIELD, name,
                    "field is not declared by the state schema");
        }
        return f;
    }

    // ------------------------------------------------------------------
    // State construction
    // ------------------------------------------------------------------

    /**
     * Build the starting state of a run. Unset fields take their defaults.
     *
     * @throws StateUpdateException if a value names an undeclared field or has the wrong type
     */
    public AgentState initialState(Map<String, ?> values) {
        Map<String, Object> state = new LinkedHashMap<>();
        for (Field f : fields.values()) {
            state.put(f.name(), f.defaultValue());
        }
        if (values != null) {
            values.forEach((name, value) -> state.put(name, field(name).type().coerce(name, value)));
        }
        return new AgentState(this, state);
    }

    /**
     * Rebuild a state from a full snapshot, such as the one stored in a checkpoint.
     * Unlike {@link #initialState}, every declared field must be present.
     */
    public AgentState restore(Map<String, ?> snapshot) {
        for (String name : fields.keySet()) {
            if (!snapshot.containsKey(name)) {
                throw new StateUpdateException(StateUpdateException.Kind.MISSING_FIELD, name,
                        "snapshot does not contain this field");
            }
        }
        return initialState(snapshot);
    }

    // ------------------------------------------------------------------
    // Builder
    // ------------------------------------------------------------------

    public static final class Builder {

        private final Map<String, Field> fields = new LinkedHashMap<>();

        private Builder() {}

        public Builder text(String name, String defaultValue)      { return add(name, FieldType.TEXT, defaultValue); }
        public Builder number(String name, Double defaultValue)    { return add(name, FieldType.NUMBER, defaultValue); }
        public Builder integer(String name, Integer defaultValue)  { return add(name, FieldType.INTEGER, defaultValue); }
        public Builder bool(String name, Boolean defaultValue)     { return add(name, FieldType.BOOLEAN, defaultValue); }
        public Builder textList(String name)                       { return add(name, FieldType.TEXT_LIST, List.of()); }

        private Builder add(String name, FieldType type, Object defaultValue) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Field name must not be blank");
            }
            if (fields.containsKey(name)) {
                throw new IllegalArgumentException("Field declared twice: " + name);
            }
            fields.put(name, new Field(name, type, type.coerce(name, defaultValue)));
            return this;
        }

        public StateSchema build() {
            return new StateSchema(fields);
        }
    }
}
