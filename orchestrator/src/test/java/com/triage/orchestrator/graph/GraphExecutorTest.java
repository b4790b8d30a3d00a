package com.triage.orchestrator.graph;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Executor behaviour against small hand-built graphs. No Spring context.
 */
class GraphExecutorTest {

    private static final StateSchema SCHEMA = StateSchema.builder()
            .text("input", "")
            .text("output", "")
            .text("status", "new")
            .integer("visits", 0)
            .bool("approved", null)
            .build();

    SimpleMeterRegistry meters;
    ExecutorService     workers;
    GraphExecutor       executor;

    @BeforeEach
    void setUp() {
        meters   = new SimpleMeterRegistry();
        workers  = Executors.newFixedThreadPool(4);
        executor = new GraphExecutor(workers, meters);
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    // ------------------------------------------------------------------
    // End-to-end scenarios
    // ------------------------------------------------------------------

    @Test
    void scenarioA_singleNodeToTerminal_completesInOneExecution() {
        CompiledGraph plan = new GraphDefinition(SCHEMA)
                .addNode("start", s -> NodeResult.of(StateUpdate.of("status", "done")))
                .addEdge("start", GraphDefinition.END)
                .setStart("start")
                .compile();

        RunResult result = executor.run(plan, Map.of("input", "hello"), RunOptions.defaults());

        assertThat(result).isInstanceOf(RunResult.Completed.class);
        RunResult.Completed done = (RunResult.Completed) result;
        assertThat(done.trace()).containsExactly("start");
        AgentState expected = SCHEMA.initialState(Map.of("input", "hello", "status", "done"));
        assertThat(done.finalState()).isEqualTo(expected);
    }

    @Test
    void scenarioB_loopBackPastBound_failsAfterThreeExecutionsOfA() {
        AtomicInteger aRuns = new AtomicInteger();
        CompiledGraph plan = new GraphDefinition(SCHEMA)
                .addNode("A", s -> {
                    aRuns.incrementAndGet();
                    return NodeResult.of(StateUpdate.of("visits", s.getInt("visits") + 1));
                })
                .addNode("B", s -> NodeResult.of(StateUpdate.empty()))
                .addEdge("A", "B")
                .addConditionalEdge("B", s -> "again", Map.of("again", "A", "done", GraphDefinition.END))
                .setStart("A")
                .compile();

        RunResult result = executor.run(plan, Map.of(), RunOptions.defaults().withMaxIterations(2));

        assertThat(result).isInstanceOf(RunResult.Failed.class);
        RunResult.Failed failed = (RunResult.Failed) result;
        assertThat(failed.kind()).isEqualTo(FailureKind.ITERATION_LIMIT_EXCEEDED);
        assertThat(failed.nodeName()).isEqualTo("A");
        assertThat(aRuns.get()).isEqualTo(3);
        assertThat(failed.lastState().getInt("visits")).isEqualTo(3);
        assertThat(failed.trace()).containsExactly("A", "B", "A", "B", "A", "B");
    }

    @Test
    void scenarioC_checkpointNode_suspendsThenSeesDecisionOnResume() {
        List<Boolean> seen = new ArrayList<>();
        CompiledGraph plan = approvalGraph(seen);

        RunResult first = executor.run(plan, Map.of("input", "deploy"), RunOptions.defaults());

        assertThat(first).isInstanceOf(RunResult.Suspended.class);
        Checkpoint checkpoint = ((RunResult.Suspended) first).checkpoint();
        assertThat(checkpoint.nodeName()).isEqualTo("approval");
        assertThat(checkpoint.reason()).isEqualTo("AWAITING_APPROVAL");
        assertThat(checkpoint.impact()).containsEntry("action", "deploy");
        assertThat(checkpoint.state()).containsEntry("status", "awaiting");

        RunResult second = executor.resume(plan, checkpoint, Map.of("approved", true), RunOptions.defaults());

        assertThat(second).isInstanceOf(RunResult.Completed.class);
        assertThat(second.runId()).isEqualTo(first.runId());
        assertThat(second.trace()).containsExactly("approval");
        assertThat(seen).containsExactly(null, true);
        assertThat(((RunResult.Completed) second).finalState().getText("status")).isEqualTo("approved");
    }

    // ------------------------------------------------------------------
    // Suspend / resume
    // ------------------------------------------------------------------

    @Test
    void suspendThenResume_matchesRunningStraightThrough() {
        CompiledGraph plan = approvalGraph(new ArrayList<>());
        CheckpointCodec codec = new CheckpointCodec();

        RunResult.Completed straight = (RunResult.Completed) executor.run(
                plan, Map.of("input", "deploy", "approved", true), RunOptions.defaults());

        RunResult.Suspended paused = (RunResult.Suspended) executor.run(
                plan, Map.of("input", "deploy"), RunOptions.defaults());
        Checkpoint restored = codec.decode(codec.encode(paused.checkpoint()));
        RunResult.Completed resumed = (RunResult.Completed) executor.resume(
                plan, restored, Map.of("approved", true), RunOptions.defaults());

        assertThat(resumed.finalState()).isEqualTo(straight.finalState());
    }

    @Test
    void resume_reenteringSuspendedNode_doesNotCountAsIteration() {
        CompiledGraph plan = approvalGraph(new ArrayList<>());
        RunOptions noRepeats = RunOptions.defaults().withMaxIterations(0);

        RunResult.Suspended paused = (RunResult.Suspended) executor.run(plan, Map.of(), noRepeats);
        assertThat(paused.checkpoint().iterationCounters()).containsEntry("prepare", 0).containsEntry("approval", 0);

        RunResult resumed = executor.resume(plan, paused.checkpoint(), Map.of("approved", false), noRepeats);

        assertThat(resumed).isInstanceOf(RunResult.Completed.class);
        assertThat(((RunResult.Completed) resumed).finalState().getText("status")).isEqualTo("rejected");
    }

    @Test
    void resume_checkpointFromUnknownNode_rejected() {
        CompiledGraph plan = approvalGraph(new ArrayList<>());
        RunResult.Suspended paused = (RunResult.Suspended) executor.run(plan, Map.of(), RunOptions.defaults());
        Checkpoint c = paused.checkpoint();
        Checkpoint wrong = new Checkpoint(c.runId(), "prepare", c.state(), c.iterationCounters(),
                c.reason(), c.description(), c.impact(), c.createdAt());

        assertThatThrownBy(() -> executor.resume(plan, wrong, Map.of("approved", true), RunOptions.defaults()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void suspension_fromNonCheckpointNode_failsRun() {
        CompiledGraph plan = new GraphDefinition(SCHEMA)
                .addNode("sneaky", s -> NodeResult.suspend(StateUpdate.empty(),
                        new SuspendRequest("WAIT", "not allowed here", Map.of())))
                .addEdge("sneaky", GraphDefinition.END)
                .setStart("sneaky")
                .compile();

        RunResult.Failed failed = (RunResult.Failed) executor.run(plan, Map.of(), RunOptions.defaults());

        assertThat(failed.kind()).isEqualTo(FailureKind.NODE_EXECUTION);
        assertThat(failed.nodeName()).isEqualTo("sneaky");
    }

    // ------------------------------------------------------------------
    // Failures
    // ------------------------------------------------------------------

    @Test
    void router_undeclaredOutcome_failsWithRoutingError() {
        CompiledGraph plan = new GraphDefinition(SCHEMA)
                .addNode("decide", s -> NodeResult.of(StateUpdate.of("status", "maybe")))
                .addConditionalEdge("decide", s -> s.getText("status"),
                        Map.of("yes", GraphDefinition.END, "no", GraphDefinition.END))
                .setStart("decide")
                .compile();

        RunResult.Failed failed = (RunResult.Failed) executor.run(plan, Map.of(), RunOptions.defaults());

        assertThat(failed.kind()).isEqualTo(FailureKind.ROUTING_ERROR);
        assertThat(failed.nodeName()).isEqualTo("decide");
        assertThat(failed.message()).contains("maybe");
    }

    @Test
    void router_throwing_failsWithRoutingError() {
        CompiledGraph plan = new GraphDefinition(SCHEMA)
                .addNode("decide", s -> NodeResult.of(StateUpdate.empty()))
                .addConditionalEdge("decide", s -> { throw new IllegalStateException("boom"); },
                        Map.of("done", GraphDefinition.END))
                .setStart("decide")
                .compile();

        RunResult.Failed failed = (RunResult.Failed) executor.run(plan, Map.of(), RunOptions.defaults());

        assertThat(failed.kind()).isEqualTo(FailureKind.ROUTING_ERROR);
        assertThat(failed.cause()).isInstanceOf(RoutingException.class);
    }

    @Test
    void nodeThrows_failsWithNodeNameAndLastCommittedState() {
        CompiledGraph plan = new GraphDefinition(SCHEMA)
                .addNode("first", s -> NodeResult.of(StateUpdate.of("status", "first-done")))
                .addNode("second", s -> { throw new IllegalStateException("search API down"); })
                .addEdge("first", "second")
                .addEdge("second", GraphDefinition.END)
                .setStart("first")
                .compile();

        RunResult.Failed failed = (RunResult.Failed) executor.run(plan, Map.of(), RunOptions.defaults());

        assertThat(failed.kind()).isEqualTo(FailureKind.NODE_EXECUTION);
        assertThat(failed.nodeName()).isEqualTo("second");
        assertThat(failed.message()).contains("search API down");
        assertThat(failed.lastState().getText("status")).isEqualTo("first-done");
    }

    @Test
    void nodeUpdate_duplicateField_failsWithInvalidUpdate() {
        CompiledGraph plan = new GraphDefinition(SCHEMA)
                .addNode("sloppy", s -> NodeResult.of(StateUpdate.builder()
                        .set("status", "a")
                        .set("status", "b")
                        .build()))
                .addEdge("sloppy", GraphDefinition.END)
                .setStart("sloppy")
                .compile();

        RunResult.Failed failed = (RunResult.Failed) executor.run(plan, Map.of(), RunOptions.defaults());

        assertThat(failed.kind()).isEqualTo(FailureKind.INVALID_UPDATE);
    }

    @Test
    void nodeUpdate_unknownField_failsWithInvalidUpdateAndNoPartialState() {
        CompiledGraph plan = new GraphDefinition(SCHEMA)
                .addNode("sloppy", s -> NodeResult.of(StateUpdate.builder()
                        .set("status", "changed")
                        .set("not_a_field", "x")
                        .build()))
                .addEdge("sloppy", GraphDefinition.END)
                .setStart("sloppy")
                .compile();

        RunResult.Failed failed = (RunResult.Failed) executor.run(plan, Map.of(), RunOptions.defaults());

        assertThat(failed.kind()).isEqualTo(FailureKind.INVALID_UPDATE);
        assertThat(failed.lastState().getText("status")).isEqualTo("new");
    }

    @Test
    void nodeTimeout_failsWithNodeExecution() {
        CompiledGraph plan = new GraphDefinition(SCHEMA)
                .addNode("slow", s -> {
                    Thread.sleep(5_000);
                    return NodeResult.of(StateUpdate.empty());
                })
                .addEdge("slow", GraphDefinition.END)
                .setStart("slow")
                .compile();

        RunResult.Failed failed = (RunResult.Failed) executor.run(plan, Map.of(),
                RunOptions.defaults().withNodeTimeout(Duration.ofMillis(100)));

        assertThat(failed.kind()).isEqualTo(FailureKind.NODE_EXECUTION);
        assertThat(failed.cause()).isInstanceOf(TimeoutException.class);
        assertThat(meters.counter("triage.node.calls", "node", "slow", "status", "timeout").count())
                .isEqualTo(1.0);
    }

    @Test
    void cancellation_stopsBeforeNextNode() {
        CancellationToken token = new CancellationToken();
        AtomicInteger secondRuns = new AtomicInteger();
        CompiledGraph plan = new GraphDefinition(SCHEMA)
                .addNode("first", s -> {
                    token.cancel();
                    return NodeResult.of(StateUpdate.of("status", "first-done"));
                })
                .addNode("second", s -> {
                    secondRuns.incrementAndGet();
                    return NodeResult.of(StateUpdate.empty());
                })
                .addEdge("first", "second")
                .addEdge("second", GraphDefinition.END)
                .setStart("first")
                .compile();

        RunResult.Failed failed = (RunResult.Failed) executor.run(plan, Map.of(),
                RunOptions.defaults().withCancellation(token));

        assertThat(failed.kind()).isEqualTo(FailureKind.CANCELLED);
        assertThat(failed.nodeName()).isEqualTo("second");
        assertThat(failed.lastState().getText("status")).isEqualTo("first-done");
        assertThat(secondRuns.get()).isZero();
    }

    // ------------------------------------------------------------------
    // Concurrency and metrics
    // ------------------------------------------------------------------

    @Test
    void concurrentRuns_onSharedPlan_doNotObserveEachOther() throws Exception {
        AtomicReference<String> leak = new AtomicReference<>();
        CompiledGraph plan = new GraphDefinition(SCHEMA)
                .addNode("echo", s -> {
                    Thread.sleep(5);
                    return NodeResult.of(StateUpdate.builder()
                            .set("output", s.getText("input") + "-" + s.getInt("visits"))
                            .set("visits", s.getInt("visits") + 1)
                            .build());
                })
                .addNode("check", s -> {
                    if (!s.getText("output").startsWith(s.getText("input") + "-")) {
                        leak.set(s.getText("input") + " saw " + s.getText("output"));
                    }
                    return NodeResult.of(StateUpdate.empty());
                })
                .addEdge("echo", "check")
                .addConditionalEdge("check", s -> s.getInt("visits") < 3 ? "again" : "done",
                        Map.of("again", "echo", "done", GraphDefinition.END))
                .setStart("echo")
                .compile();

        ExecutorService callers = Executors.newFixedThreadPool(8);
        try {
            List<Future<RunResult>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                String input = "run" + i;
                Callable<RunResult> call = () -> executor.run(plan, Map.of("input", input), RunOptions.defaults());
                futures.add(callers.submit(call));
            }
            for (int i = 0; i < futures.size(); i++) {
                RunResult.Completed done = (RunResult.Completed) futures.get(i).get();
                assertThat(done.finalState().getText("output")).isEqualTo("run" + i + "-2");
                assertThat(done.finalState().getInt("visits")).isEqualTo(3);
            }
        } finally {
            callers.shutdownNow();
        }
        assertThat(leak.get()).isNull();
    }

    @Test
    void everyNodeCall_isTimedAndCounted() {
        CompiledGraph plan = new GraphDefinition(SCHEMA)
                .addNode("start", s -> NodeResult.of(StateUpdate.empty()))
                .addEdge("start", GraphDefinition.END)
                .setStart("start")
                .compile();

        executor.run(plan, Map.of(), RunOptions.defaults());

        assertThat(meters.counter("triage.node.calls", "node", "start", "status", "success").count()).isEqualTo(1.0);
        assertThat(meters.timer("triage.node.duration", "node", "start").count()).isEqualTo(1);
        assertThat(meters.counter("triage.run.results", "status", "completed").count()).isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** prepare -> approval (checkpoint) -> END; approval records what it saw in {@code seen}. */
    private static CompiledGraph approvalGraph(List<Boolean> seen) {
        return new GraphDefinition(SCHEMA)
                .addNode("prepare", s -> NodeResult.of(StateUpdate.of("output", "plan for " + s.getText("input"))))
                .addCheckpointNode("approval", s -> {
                    Boolean approved = s.getBoolean("approved");
                    seen.add(approved);
                    if (approved == null) {
                        return NodeResult.suspend(StateUpdate.of("status", "awaiting"),
                                new SuspendRequest("AWAITING_APPROVAL", "Approve " + s.getText("output"),
                                        Map.of("action", s.getText("input"))));
                    }
                    return NodeResult.of(StateUpdate.of("status", approved ? "approved" : "rejected"));
                })
                .addEdge("prepare", "approval")
                .addEdge("approval", GraphDefinition.END)
                .setStart("prepare")
                .compile();
    }
}
