package com.triage.orchestrator.service;

import com.triage.orchestrator.checkpoint.CheckpointStore;
import com.triage.orchestrator.graph.AgentState;
import com.triage.orchestrator.graph.CancellationToken;
import com.triage.orchestrator.graph.Checkpoint;
import com.triage.orchestrator.graph.CompiledGraph;
import com.triage.orchestrator.graph.GraphExecutor;
import com.triage.orchestrator.graph.RunOptions;
import com.triage.orchestrator.graph.RunResult;
import com.triage.orchestrator.graph.StateUpdate;
import com.triage.orchestrator.graph.StateUpdateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Run lifecycle on top of the {@link GraphExecutor}.
 *
 * <ol>
 *   <li>{@link #start}: new run from input fields.</li>
 *   <li>A Suspended result is stored in the {@link CheckpointStore} under its run id.</li>
 *   <li>{@link #resume}: consume that checkpoint and continue with the decision.</li>
 *   <li>{@link #cancel}: stop an in-flight run between nodes, or drop a suspended one.</li>
 * </ol>
 *
 * Runs execute on the calling thread; nothing about a run is kept once it
 * completes or fails.
 */
@Service
public class RunService {

    private static final Logger log = LoggerFactory.getLogger(RunService.class);

    private final GraphExecutor   executor;
    private final CompiledGraph   graph;
    private final CheckpointStore checkpoints;
    private final RunOptions      options;

    private final Map<String, CancellationToken> inFlight = new ConcurrentHashMap<>();

    public RunService(GraphExecutor executor,
                      CompiledGraph incidentGraph,
                      CheckpointStore checkpoints,
                      @Value("${triage.engine.max-iterations:5}") int maxIterations,
                      @Value("${triage.engine.node-timeout-seconds:180}") long nodeTimeoutSeconds) {
        this.executor    = executor;
        this.graph       = incidentGraph;
        this.checkpoints = checkpoints;
        this.options     = new RunOptions(maxIterations,
                nodeTimeoutSeconds > 0 ? Duration.ofSeconds(nodeTimeoutSeconds) : null, null);
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /**
     * Start a run and drive it until it completes, fails or suspends.
     *
     * @throws StateUpdateException if the input names unknown fields or has wrong types
     */
    public RunResult start(Map<String, ?> initialFields) {
        AgentState initial = graph.schema().initialState(initialFields);
        String runId = UUID.randomUUID().toString();
        CancellationToken token = register(runId);
        try {
            return settle(executor.run(graph, runId, initial, options.withCancellation(token)));
        } finally {
            inFlight.remove(runId);
        }
    }

    /**
     * Continue a suspended run with an external decision.
     *
     * @throws RunNotFoundException if no checkpoint is pending for {@code runId}
     * @throws StateUpdateException if the decision does not fit the state schema; the
     *                              checkpoint stays pending
     * @throws IllegalArgumentException if the checkpoint names no checkpoint node of the
     *                                  graph; the checkpoint stays pending
     */
    public RunResult resume(String runId, Map<String, ?> decision) {
        Checkpoint checkpoint = checkpoints.take(runId)
                .orElseThrow(() -> new RunNotFoundException(runId));
        // validate before resuming so a bad decision or checkpoint does not consume it
        try {
            String node = checkpoint.nodeName();
            if (!graph.hasNode(node) || !graph.isCheckpoint(node)) {
                throw new IllegalArgumentException(
                        "'" + node + "' is not a checkpoint node of this graph");
            }
            graph.schema().restore(checkpoint.state()).merge(StateUpdate.of(decision));
        } catch (StateUpdateException | IllegalArgumentException e) {
            checkpoints.save(checkpoint);
            throw e;
        }

        CancellationToken token = register(runId);
        try {
            return settle(executor.resume(graph, checkpoint, decision, options.withCancellation(token)));
        } finally {
            inFlight.remove(runId);
        }
    }

    /** Highest number of repeat visits any node of a run may make. */
    public int maxIterations() {
        return options.maxIterations();
    }

    /** The decision a suspended run is waiting for, if any. */
    public Optional<Checkpoint> pending(String runId) {
        return checkpoints.find(runId);
    }

    /**
     * Cancel a run. An in-flight run stops before its next node; a suspended
     * run's checkpoint is discarded.
     *
     * @return false if no such run exists
     */
    public boolean cancel(String runId) {
        CancellationToken token = inFlight.get(runId);
        if (token != null) {
            token.cancel();
            log.info("Cancellation requested for in-flight run {}", runId);
            return true;
        }
        boolean discarded = checkpoints.discard(runId);
        if (discarded) log.info("Discarded suspended run {}", runId);
        return discarded;
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private CancellationToken register(String runId) {
        CancellationToken token = new CancellationToken();
        inFlight.put(runId, token);
        return token;
    }

    private RunResult settle(RunResult result) {
        if (result instanceof RunResult.Suspended) {
            checkpoints.save(((RunResult.Suspended) result).checkpoint());
        }
        log.info("Run {} ended attempt as {}", result.runId(), result.status());
        return result;
    }
}
