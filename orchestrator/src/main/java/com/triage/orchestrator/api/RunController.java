package com.triage.orchestrator.api;

import com.triage.orchestrator.api.dto.CheckpointResponse;
import com.triage.orchestrator.api.dto.ResumeRunRequest;
import com.triage.orchestrator.api.dto.RunResponse;
import com.triage.orchestrator.api.dto.StartRunRequest;
import com.triage.orchestrator.graph.RunResult;
import com.triage.orchestrator.graph.StateUpdateException;
import com.triage.orchestrator.responder.IncidentReport;
import com.triage.orchestrator.responder.IncidentState;
import com.triage.orchestrator.service.RunNotFoundException;
import com.triage.orchestrator.service.RunService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * REST API for incident investigation runs.
 *
 * POST   /runs                  start investigating an error log
 * POST   /runs/{id}/resume      supply the decision a suspended run is waiting for
 * GET    /runs/{id}/checkpoint  show the pending decision of a suspended run
 * DELETE /runs/{id}             cancel an in-flight run or drop a suspended one
 *
 * Runs execute synchronously inside the request; the response carries the
 * outcome of this attempt (COMPLETED, SUSPENDED or FAILED).
 */
@RestController
@RequestMapping("/runs")
public class RunController {

    private final RunService     runService;
    private final IncidentReport incidentReport;

    public RunController(RunService runService, IncidentReport incidentReport) {
        this.runService     = runService;
        this.incidentReport = incidentReport;
    }

    /**
     * Start a run.
     *
     * Example:
     *   curl -X POST http://localhost:8080/runs \
     *     -H "Content-Type: application/json" \
     *     -d '{"errorLog":"psycopg2.OperationalError: could not connect to server"}'
     */
    @PostMapping
    public ResponseEntity<RunResponse> start(@RequestBody StartRunRequest req) {
        if (req.errorLog() == null || req.errorLog().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "errorLog is required");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(IncidentState.ERROR_LOG, req.errorLog());
        if (req.maxIterations() != null) {
            // the research loop must end before the engine's repeat limit stops it
            int bound = runService.maxIterations();
            if (req.maxIterations() < 0 || req.maxIterations() > bound) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                        "maxIterations must be between 0 and " + bound);
            }
            fields.put(IncidentState.MAX_ITERATIONS, req.maxIterations());
        }

        RunResult result = invoke(() -> runService.start(fields));
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(result));
    }

    /**
     * Resume a suspended run.
     *
     * Example:
     *   curl -X POST http://localhost:8080/runs/{id}/resume \
     *     -H "Content-Type: application/json" -d '{"approved":true}'
     *
     * Returns 404 if the run is not waiting for a decision.
     */
    @PostMapping("/{id}/resume")
    public RunResponse resume(@PathVariable String id, @RequestBody ResumeRunRequest req) {
        Map<String, Object> decision = req.decision();
        if (decision.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "A decision is required");
        }
        try {
            return toResponse(invoke(() -> runService.resume(id, decision)));
        } catch (RunNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    /** Returns 404 if the run is not waiting for a decision. */
    @GetMapping("/{id}/checkpoint")
    public CheckpointResponse checkpoint(@PathVariable String id) {
        return runService.pending(id)
                .map(CheckpointResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "No suspended run: " + id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> cancel(@PathVariable String id) {
        if (!runService.cancel(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No active or suspended run: " + id);
        }
        return ResponseEntity.noContent().build();
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private RunResponse toResponse(RunResult result) {
        String report = result instanceof RunResult.Completed
                ? incidentReport.render(((RunResult.Completed) result).finalState())
                : null;
        return RunResponse.from(result, report);
    }

    /** Input that does not fit the state schema is a client error. */
    private static RunResult invoke(Supplier<RunResult> call) {
        try {
            return call.get();
        } catch (StateUpdateException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }
}
