package com.triage.orchestrator.service;

/** No suspended or in-flight run exists under the given id. */
public class RunNotFoundException extends RuntimeException {

    public RunNotFoundException(String runId) {
        super("No suspended run: " + runId);
    }
}
