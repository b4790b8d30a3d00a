package com.triage.orchestrator.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A partial update returned by a node: only the fields it changes.
 *
 * Values may be {@code null} to clear a field. A single update names each field
 * at most once; the builder rejects a second value for the same field.
 */
public final class StateUpdate {

    private static final StateUpdate EMPTY = new StateUpdate(Map.of());

    private final Map<String, Object> values;

    private StateUpdate(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static StateUpdate empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Update with a single field. */
    public static StateUpdate of(String field, Object value) {
        return builder().set(field, value).build();
    }

    /** Update from a map of decision or input fields; keys are unique by construction. */
    public static StateUpdate of(Map<String, ?> fields) {
        Builder b = builder();
        if (fields != null) fields.forEach(b::set);
        return b.build();
    }

    public Map<String, Object> values() { return values; }
    public boolean isEmpty()            { return values.isEmpty(); }

    @Override
    public String toString() {
        return "StateUpdate" + values.keySet();
    }

    public static final class Builder {

        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {}

        /**
         * @throws StateUpdateException with kind DUPLICATE_FIELD if the field is already set
         */
        public Builder set(String field, Object value) {
            if (values.containsKey(field)) {
                throw new StateUpdateException(StateUpdateException.Kind.DUPLICATE_FIELD, field,
                        "an update may declare each field only once");
            }
            values.put(field, value);
            return this;
        }

        public StateUpdate build() {
            return values.isEmpty() ? EMPTY : new StateUpdate(new LinkedHashMap<>(values));
        }
    }
}
