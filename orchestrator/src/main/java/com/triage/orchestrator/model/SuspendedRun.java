package com.triage.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A run paused at a checkpoint node, waiting for an external decision.
 *
 * The row exists only while the run is suspended: resuming or cancelling the
 * run deletes it. Finished runs are not kept.
 *
 * DB table: suspended_runs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "suspended_runs")
public class SuspendedRun {

    @Id
    @Column(name = "run_id", nullable = false, updatable = false)
    private String runId;

    @Column(name = "node_name", nullable = false)
    private String nodeName;

    // Reason code from the suspend request, e.g. AWAITING_APPROVAL.
    @Column(nullable = false)
    private String reason;

    // Full checkpoint as produced by CheckpointCodec.
    @Column(name = "checkpoint_json", nullable = false, columnDefinition = "TEXT")
    private String checkpointJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected SuspendedRun() {}   // required by JPA

    public SuspendedRun(String runId, String nodeName, String reason, String checkpointJson) {
        this.runId          = runId;
        this.nodeName       = nodeName;
        this.reason         = reason;
        this.checkpointJson = checkpointJson;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String  getRunId()          { return runId; }
    public String  getNodeName()       { return nodeName; }
    public String  getReason()         { return reason; }
    public String  getCheckpointJson() { return checkpointJson; }
    public Instant getCreatedAt()      { return createdAt; }

    public void setNodeName(String nodeName)             { this.nodeName = nodeName; }
    public void setReason(String reason)                 { this.reason = reason; }
    public void setCheckpointJson(String checkpointJson) { this.checkpointJson = checkpointJson; }
}
