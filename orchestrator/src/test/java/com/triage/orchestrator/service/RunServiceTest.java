package com.triage.orchestrator.service;

import com.triage.orchestrator.checkpoint.CheckpointStore;
import com.triage.orchestrator.graph.AgentState;
import com.triage.orchestrator.graph.Checkpoint;
import com.triage.orchestrator.graph.CompiledGraph;
import com.triage.orchestrator.graph.GraphDefinition;
import com.triage.orchestrator.graph.GraphExecutor;
import com.triage.orchestrator.graph.NodeResult;
import com.triage.orchestrator.graph.RunOptions;
import com.triage.orchestrator.graph.RunResult;
import com.triage.orchestrator.graph.StateSchema;
import com.triage.orchestrator.graph.StateUpdate;
import com.triage.orchestrator.graph.StateUpdateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RunService.
 *
 * The executor and checkpoint store are mocked; the graph is a real
 * two-field graph so schema validation runs for real.
 */
@ExtendWith(MockitoExtension.class)
class RunServiceTest {

    @Mock GraphExecutor   executor;
    @Mock CheckpointStore checkpoints;

    CompiledGraph graph;
    RunService    service;

    @BeforeEach
    void setUp() {
        StateSchema schema = StateSchema.builder()
                .text("status", "new")
                .bool("approved", null)
                .build();
        graph = new GraphDefinition(schema)
                .addCheckpointNode("approval", state -> NodeResult.of(StateUpdate.empty()))
                .setStart("approval")
                .addEdge("approval", GraphDefinition.END)
                .compile();
        service = new RunService(executor, graph, checkpoints, 5, 0);
    }

    // ------------------------------------------------------------------
    // start()
    // ------------------------------------------------------------------

    @Test
    void start_suspendedRun_storesCheckpoint() {
        Checkpoint cp = checkpoint("run-1");
        when(executor.run(eq(graph), anyString(), any(AgentState.class), any(RunOptions.class)))
                .thenReturn(new RunResult.Suspended("run-1", cp, List.of("approval")));

        RunResult result = service.start(Map.of("status", "new"));

        assertThat(result.status()).isEqualTo(RunResult.Status.SUSPENDED);
        verify(checkpoints).save(cp);
    }

    @Test
    void start_completedRun_storesNothing() {
        when(executor.run(eq(graph), anyString(), any(AgentState.class), any(RunOptions.class)))
                .thenAnswer(inv -> new RunResult.Completed(inv.getArgument(1), inv.getArgument(2), List.of("approval")));

        RunResult result = service.start(Map.of());

        assertThat(result.status()).isEqualTo(RunResult.Status.COMPLETED);
        verify(checkpoints, never()).save(any());
    }

    @Test
    void start_passesConfiguredOptions() {
        when(executor.run(eq(graph), anyString(), any(AgentState.class), any(RunOptions.class)))
                .thenAnswer(inv -> new RunResult.Completed(inv.getArgument(1), inv.getArgument(2), List.of()));

        service.start(Map.of());

        ArgumentCaptor<RunOptions> options = ArgumentCaptor.forClass(RunOptions.class);
        verify(executor).run(eq(graph), anyString(), any(AgentState.class), options.capture());
        assertThat(options.getValue().maxIterations()).isEqualTo(5);
        assertThat(options.getValue().nodeTimeout()).isNull();   // 0 seconds means no timeout
    }

    @Test
    void start_unknownInputField_rejectedBeforeExecution() {
        assertThatThrownBy(() -> service.start(Map.of("bogus", 1)))
                .isInstanceOf(StateUpdateException.class);
        verifyNoInteractions(executor);
    }

    @Test
    void cancel_duringRun_setsTheRunsToken() {
        when(executor.run(eq(graph), anyString(), any(AgentState.class), any(RunOptions.class)))
                .thenAnswer(inv -> {
                    String runId = inv.getArgument(1);
                    RunOptions options = inv.getArgument(3);
                    assertThat(service.cancel(runId)).isTrue();
                    assertThat(options.cancellation().isCancelled()).isTrue();
                    return new RunResult.Completed(runId, inv.getArgument(2), List.of());
                });

        service.start(Map.of());

        verify(checkpoints, never()).discard(anyString());
    }

    // ------------------------------------------------------------------
    // resume()
    // ------------------------------------------------------------------

    @Test
    void resume_pendingRun_continuesWithDecision() {
        Checkpoint cp = checkpoint("run-1");
        when(checkpoints.take("run-1")).thenReturn(Optional.of(cp));
        when(executor.resume(eq(graph), eq(cp), eq(Map.of("approved", true)), any(RunOptions.class)))
                .thenReturn(new RunResult.Completed("run-1",
                        graph.schema().initialState(Map.of("approved", true)), List.of("approval")));

        RunResult result = service.resume("run-1", Map.of("approved", true));

        assertThat(result.status()).isEqualTo(RunResult.Status.COMPLETED);
        verify(checkpoints, never()).save(any());
    }

    @Test
    void resume_unknownRun_throwsRunNotFound() {
        when(checkpoints.take("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.resume("nope", Map.of("approved", true)))
                .isInstanceOf(RunNotFoundException.class)
                .hasMessageContaining("nope");
        verifyNoInteractions(executor);
    }

    @Test
    void resume_invalidDecision_keepsCheckpointPending() {
        Checkpoint cp = checkpoint("run-1");
        when(checkpoints.take("run-1")).thenReturn(Optional.of(cp));

        assertThatThrownBy(() -> service.resume("run-1", Map.of("approved", "maybe")))
                .isInstanceOf(StateUpdateException.class);

        verify(checkpoints).save(cp);
        verifyNoInteractions(executor);
    }

    @Test
    void resume_checkpointOfUnknownNode_keepsCheckpointPending() {
        Checkpoint cp = new Checkpoint("run-1", "retired_node", checkpoint("run-1").state(), Map.of(),
                "AWAITING_APPROVAL", "Apply the fix", Map.of(), Instant.parse("2024-05-01T12:00:00Z"));
        when(checkpoints.take("run-1")).thenReturn(Optional.of(cp));

        assertThatThrownBy(() -> service.resume("run-1", Map.of("approved", true)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("retired_node");

        verify(checkpoints).save(cp);
        verifyNoInteractions(executor);
    }

    @Test
    void maxIterations_reportsEngineLimit() {
        assertThat(service.maxIterations()).isEqualTo(5);
    }

    @Test
    void resume_suspendsAgain_storesNewCheckpoint() {
        Checkpoint cp = checkpoint("run-1");
        Checkpoint next = checkpoint("run-1");
        when(checkpoints.take("run-1")).thenReturn(Optional.of(cp));
        when(executor.resume(eq(graph), eq(cp), any(), any(RunOptions.class)))
                .thenReturn(new RunResult.Suspended("run-1", next, List.of("approval")));

        service.resume("run-1", Map.of("status", "edited"));

        verify(checkpoints).save(next);
    }

    // ------------------------------------------------------------------
    // cancel() / pending()
    // ------------------------------------------------------------------

    @Test
    void cancel_suspendedRun_discardsCheckpoint() {
        when(checkpoints.discard("run-1")).thenReturn(true);

        assertThat(service.cancel("run-1")).isTrue();
    }

    @Test
    void cancel_unknownRun_returnsFalse() {
        when(checkpoints.discard("nope")).thenReturn(false);

        assertThat(service.cancel("nope")).isFalse();
    }

    @Test
    void pending_delegatesToStore() {
        Checkpoint cp = checkpoint("run-1");
        when(checkpoints.find("run-1")).thenReturn(Optional.of(cp));

        assertThat(service.pending("run-1")).contains(cp);
    }

    private static Checkpoint checkpoint(String runId) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("status", "awaiting");
        state.put("approved", null);
        return new Checkpoint(runId, "approval", state, Map.of("approval", 0),
                "AWAITING_APPROVAL", "Apply the fix", Map.of(), Instant.parse("2024-05-01T12:00:00Z"));
    }
}
