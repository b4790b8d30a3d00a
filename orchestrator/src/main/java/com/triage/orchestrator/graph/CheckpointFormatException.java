package com.triage.orchestrator.graph;

/** A checkpoint could not be written to or read from its serialised form. */
public class CheckpointFormatException extends RuntimeException {

    public CheckpointFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
