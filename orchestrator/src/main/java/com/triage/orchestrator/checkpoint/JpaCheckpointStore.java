package com.triage.orchestrator.checkpoint;

import com.triage.orchestrator.graph.Checkpoint;
import com.triage.orchestrator.graph.CheckpointCodec;
import com.triage.orchestrator.model.SuspendedRun;
import com.triage.orchestrator.repository.SuspendedRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Checkpoints persisted in the suspended_runs table, so a paused run can be
 * resumed after the service restarts.
 */
public class JpaCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(JpaCheckpointStore.class);

    private final SuspendedRunRepository repository;
    private final CheckpointCodec        codec;

    public JpaCheckpointStore(SuspendedRunRepository repository, CheckpointCodec codec) {
        this.repository = repository;
        this.codec      = codec;
    }

    @Override
    @Transactional
    public void save(Checkpoint checkpoint) {
        String json = codec.encode(checkpoint);
        SuspendedRun row = repository.findById(checkpoint.runId())
                .orElseGet(() -> new SuspendedRun(checkpoint.runId(), checkpoint.nodeName(),
                        checkpoint.reason(), json));
        row.setNodeName(checkpoint.nodeName());
        row.setReason(checkpoint.reason());
        row.setCheckpointJson(json);
        repository.save(row);
        log.debug("Stored checkpoint for run {} at '{}'", checkpoint.runId(), checkpoint.nodeName());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Checkpoint> find(String runId) {
        return repository.findById(runId)
                .map(row -> codec.decode(row.getCheckpointJson()));
    }

    @Override
    @Transactional
    public Optional<Checkpoint> take(String runId) {
        Optional<SuspendedRun> row = repository.findForUpdate(runId);
        row.ifPresent(repository::delete);
        return row.map(r -> codec.decode(r.getCheckpointJson()));
    }

    @Override
    @Transactional
    public boolean discard(String runId) {
        Optional<SuspendedRun> row = repository.findForUpdate(runId);
        row.ifPresent(repository::delete);
        return row.isPresent();
    }
}
