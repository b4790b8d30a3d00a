package com.triage.orchestrator.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Serialises a {@link Checkpoint} to a flat JSON record and back.
 *
 * Example:
 * <pre>
 *   {"runId":"7f3c...","nodeName":"human_approval",
 *    "state":{"error_log":"...","solution_confidence":0.85,...},
 *    "iterationCounters":{"research":1,"solve":0},
 *    "reason":"AWAITING_APPROVAL","description":"...","impact":{...},
 *    "createdAt":"2024-05-01T12:00:00.123456Z"}
 * </pre>
 *
 * State values are decoded as plain JSON types; {@link StateSchema#restore}
 * turns them back into the declared field types on resume.
 */
public class CheckpointCodec {

    private final ObjectMapper json;

    public CheckpointCodec(ObjectMapper objectMapper) {
        this.json = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public CheckpointCodec() {
        this(new ObjectMapper());
    }

    public String encode(Checkpoint checkpoint) {
        try {
            return json.writeValueAsString(checkpoint);
        } catch (JsonProcessingException e) {
            throw new CheckpointFormatException("Failed to encode checkpoint for run " + checkpoint.runId(), e);
        }
    }

    public Checkpoint decode(String encoded) {
        try {
            return json.readValue(encoded, Checkpoint.class);
        } catch (JsonProcessingException e) {
            throw new CheckpointFormatException("Failed to decode checkpoint", e);
        }
    }
}
