package com.triage.orchestrator.graph;

import java.util.List;

/**
 * Outcome of one execution attempt of a run. Every variant carries the run id
 * and the names of the nodes executed during this attempt, in order.
 */
public interface RunResult {

    enum Status { COMPLETED, SUSPENDED, FAILED }

    String       runId();
    Status       status();
    List<String> trace();

    /** The run reached {@link GraphDefinition#END}. */
    record Completed(String runId, AgentState finalState, List<String> trace) implements RunResult {
        public Completed {
            trace = List.copyOf(trace);
        }

        @Override
        public Status status() { return Status.COMPLETED; }
    }

    /** A checkpointing node paused the run; resume it with {@code checkpoint}. */
    record Suspended(String runId, Checkpoint checkpoint, List<String> trace) implements RunResult {
        public Suspended {
            trace = List.copyOf(trace);
        }

        @Override
        public Status status() { return Status.SUSPENDED; }
    }

    /**
     * The run stopped at {@code nodeName}. {@code lastState} is the state before
     * that node's update was applied.
     */
    record Failed(String runId,
                  FailureKind kind,
                  String nodeName,
                  String message,
                  Throwable cause,
                  AgentState lastState,
                  List<String> trace) implements RunResult {
        public Failed {
            trace = List.copyOf(trace);
        }

        @Override
        public Status status() { return Status.FAILED; }
    }
}
