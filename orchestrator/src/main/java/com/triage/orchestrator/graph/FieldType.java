package com.triage.orchestrator.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Value types a {@link StateSchema} field can hold.
 *
 * {@link #coerce} normalises values that arrive from JSON (a whole-valued
 * double for an INTEGER field, an ArrayList for a TEXT_LIST) so that the
 * same logical value always has the same Java representation. {@code null}
 * is accepted by every type and means "unset".
 */
public enum FieldType {

    TEXT {
        @Override
        Object convert(Object value) {
            return value instanceof String ? value : null;
        }
    },

    // NaN and infinities have no JSON form, so they would not survive a checkpoint.
    NUMBER {
        @Override
        Object convert(Object value) {
            if (!(value instanceof Number)) return null;
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? Double.valueOf(d) : null;
        }
    },

    INTEGER {
        @Override
        Object convert(Object value) {
            if (value instanceof Integer || value instanceof Long || value instanceof Short) {
                long l = ((Number) value).longValue();
                return l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE ? Integer.valueOf((int) l) : null;
            }
            if (value instanceof Number) {
                double d = ((Number) value).doubleValue();
                if (d == Math.rint(d) && d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE) {
                    return Integer.valueOf((int) d);
                }
            }
            return null;
        }
    },

    BOOLEAN {
        @Override
        Object convert(Object value) {
            return value instanceof Boolean ? value : null;
        }
    },

    TEXT_LIST {
        @Override
        Object convert(Object value) {
            if (!(value instanceof List)) return null;
            List<?> list = (List<?>) value;
            List<String> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                if (!(item instanceof String)) return null;
                copy.add((String) item);
            }
            return Collections.unmodifiableList(copy);
        }
    };

    /** Returns the converted value, or null when the value does not fit this type. */
    abstract Object convert(Object value);

    /**
     * Coerce {@code value} to this type's canonical representation.
     *
     * @throws StateUpdateException with kind TYPE_MISMATCH if the value does not fit
     */
    public Object coerce(String field, Object value) {
        if (value == null) return null;
        Object converted = convert(value);
        if (converted == null) {
            throw new StateUpdateException(StateUpdateException.Kind.TYPE_MISMATCH, field,
                    "expected %s but got %s".formatted(name(), value.getClass().getSimpleName()));
        }
        return converted;
    }
}
