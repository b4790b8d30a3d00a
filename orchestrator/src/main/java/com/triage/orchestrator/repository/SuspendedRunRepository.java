package com.triage.orchestrator.repository;

import com.triage.orchestrator.model.SuspendedRun;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * CRUD for the suspended_runs table.
 */
public interface SuspendedRunRepository extends JpaRepository<SuspendedRun, String> {

    /**
     * Load a suspended run and hold a row lock until the transaction ends.
     *
     * Two resume requests for the same run serialise on this lock; the second
     * one finds the row already deleted. Must be called inside a
     * {@code @Transactional} method.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM SuspendedRun r WHERE r.runId = :runId")
    Optional<SuspendedRun> findForUpdate(@Param("runId") String runId);
}
