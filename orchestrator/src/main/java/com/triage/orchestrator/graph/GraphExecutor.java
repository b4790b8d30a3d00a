package com.triage.orchestrator.graph;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a {@link CompiledGraph} one node at a time.
 *
 * <p>Loop per run:
 * <ol>
 *   <li>Check cancellation.</li>
 *   <li>Count a repeat visit of the current node and stop with
 *       ITERATION_LIMIT_EXCEEDED once the count passes the bound.</li>
 *   <li>Invoke the node (on the worker pool when a timeout is set).</li>
 *   <li>Merge its update; pause with a checkpoint if it asked to.</li>
 *   <li>Route against the merged state; END completes the run.</li>
 * </ol>
 *
 * The executor keeps no state between runs, so one instance serves any number
 * of concurrent runs. Every node call is timed and counted:
 * <pre>
 *   triage.node.duration{node}
 *   triage.node.calls{node, status="success|suspended|error|timeout"}
 *   triage.run.results{status="completed|suspended|failed"}
 * </pre>
 */
public class GraphExecutor {

    private static final Logger log = LoggerFactory.getLogger(GraphExecutor.class);

    private final ExecutorService workers;
    private final MeterRegistry   meterRegistry;

    public GraphExecutor(ExecutorService workers, MeterRegistry meterRegistry) {
        this.workers       = workers;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Public API
    // ------------------------------------------------------------------

    /**
     * Start a new run with a generated id.
     *
     * @throws StateUpdateException if the initial fields do not fit the graph's schema
     */
    public RunResult run(CompiledGraph graph, Map<String, ?> initialFields, RunOptions options) {
        AgentState initial = graph.schema().initialState(initialFields);
        return run(graph, UUID.randomUUID().toString(), initial, options);
    }

    public RunResult run(CompiledGraph graph, String runId, AgentState initialState, RunOptions options) {
        log.info("Run {} starting at '{}'", runId, graph.start());
        return record(loop(graph, runId, graph.start(), initialState, new HashMap<>(), false, options));
    }

    /**
     * Continue a suspended run. The decision is merged into the checkpointed
     * state and the suspended node runs again with it.
     *
     * @throws IllegalArgumentException if the checkpoint does not belong to this graph
     * @throws StateUpdateException     if the decision fields do not fit the schema
     */
    public RunResult resume(CompiledGraph graph, Checkpoint checkpoint,
                            Map<String, ?> decision, RunOptions options) {
        String node = checkpoint.nodeName();
        if (!graph.hasNode(node) || !graph.isCheckpoint(node)) {
            throw new IllegalArgumentException("Checkpoint of run " + checkpoint.runId()
                    + " points at '" + node + "', which is not a checkpoint node of this graph");
        }
        AgentState state = graph.schema().restore(checkpoint.state())
                .merge(StateUpdate.of(decision));

        log.info("Run {} resuming at '{}' with decision {}", checkpoint.runId(), node,
                decision == null ? "{}" : decision.keySet());
        return record(loop(graph, checkpoint.runId(), node, state,
                new HashMap<>(checkpoint.iterationCounters()), true, options));
    }

    // ------------------------------------------------------------------
    // Execution loop
    // ------------------------------------------------------------------

    private RunResult loop(CompiledGraph graph, String runId, String current, AgentState state,
                           Map<String, Integer> counters, boolean resuming, RunOptions options) {
        List<String> trace = new ArrayList<>();
        MDC.put("runId", runId);
        try {
            while (true) {
                if (options.cancellation().isCancelled()) {
                    return failed(runId, FailureKind.CANCELLED, current,
                            "Run cancelled before '" + current + "'", null, state, trace);
                }

                // Re-entering the suspended node is the same visit, not a repeat.
                if (resuming) {
                    resuming = false;
                } else if (counters.containsKey(current)) {
                    int repeats = counters.merge(current, 1, Integer::sum);
                    if (repeats > options.maxIterations()) {
                        return failed(runId, FailureKind.ITERATION_LIMIT_EXCEEDED, current,
                                "Node '%s' exceeded %d iterations".formatted(current, options.maxIterations()),
                                null, state, trace);
                    }
                } else {
                    counters.put(current, 0);
                }

                MDC.put("node", current);
                trace.add(current);

                NodeResult result;
                try {
                    result = invoke(graph, current, state, options);
                } catch (TimeoutException e) {
                    return failed(runId, FailureKind.NODE_EXECUTION, current,
                            "Node '%s' timed out after %s".formatted(current, options.nodeTimeout()),
                            e, state, trace);
                } catch (StateUpdateException e) {
                    return failed(runId, FailureKind.INVALID_UPDATE, current, e.getMessage(), e, state, trace);
                } catch (Exception e) {
                    return failed(runId, FailureKind.NODE_EXECUTION, current,
                            "Node '%s' failed: %s".formatted(current, e.getMessage()), e, state, trace);
                }
                if (result == null) {
                    return failed(runId, FailureKind.NODE_EXECUTION, current,
                            "Node '" + current + "' returned no result", null, state, trace);
                }

                AgentState merged;
                try {
                    merged = state.merge(result.update());
                } catch (StateUpdateException e) {
                    return failed(runId, FailureKind.INVALID_UPDATE, current, e.getMessage(), e, state, trace);
                }

                if (result.suspends()) {
                    if (!graph.isCheckpoint(current)) {
                        return failed(runId, FailureKind.NODE_EXECUTION, current,
                                "Node '" + current + "' requested suspension but is not a checkpoint node",
                                null, state, trace);
                    }
                    Checkpoint checkpoint = Checkpoint.capture(runId, current, merged, counters, result.suspension());
                    log.info("Run {} suspended at '{}': {}", runId, current, checkpoint.reason());
                    return new RunResult.Suspended(runId, checkpoint, trace);
                }
                state = merged;

                String next;
                try {
                    next = graph.nextNode(current, state);
                } catch (RoutingException e) {
                    return failed(runId, FailureKind.ROUTING_ERROR, current, e.getMessage(), e, state, trace);
                }

                if (GraphDefinition.END.equals(next)) {
                    log.info("Run {} completed after {} node executions", runId, trace.size());
                    return new RunResult.Completed(runId, state, trace);
                }
                log.debug("Run {} routing '{}' -> '{}'", runId, current, next);
                current = next;
            }
        } finally {
            MDC.remove("node");
            MDC.remove("runId");
        }
    }

    /** Call one node, timed and counted; with a timeout the call runs on the worker pool. */
    private NodeResult invoke(CompiledGraph graph, String name, AgentState state, RunOptions options)
            throws Exception {
        Node node = graph.node(name);
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            NodeResult result = options.nodeTimeout() == null
                    ? node.execute(state)
                    : invokeWithTimeout(node, state, options);
            if (result != null && result.suspends()) status = "suspended";
            return result;
        } catch (TimeoutException e) {
            status = "timeout";
            throw e;
        } catch (Exception e) {
            status = "error";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("triage.node.duration", "node", name));
            meterRegistry.counter("triage.node.calls", "node", name, "status", status).increment();
        }
    }

    private NodeResult invokeWithTimeout(Node node, AgentState state, RunOptions options) throws Exception {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<NodeResult> future = workers.submit(() -> {
            if (mdc != null) MDC.setContextMap(mdc);
            try {
                return node.execute(state);
            } finally {
                MDC.clear();
            }
        });
        try {
            return future.get(options.nodeTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) throw (Exception) cause;
            throw e;
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private RunResult.Failed failed(String runId, FailureKind kind, String node, String message,
                                    Throwable cause, AgentState lastState, List<String> trace) {
        log.warn("Run {} failed at '{}' ({}): {}", runId, node, kind, message);
        return new RunResult.Failed(runId, kind, node, message, cause, lastState, trace);
    }

    private RunResult record(RunResult result) {
        meterRegistry.counter("triage.run.results",
                "status", result.status().name().toLowerCase()).increment();
        return result;
    }
}
