package com.triage.orchestrator.graph;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one run. The executor checks it between
 * nodes; a node that is already running is allowed to finish.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel()          { cancelled.set(true); }
    public boolean isCancelled()  { return cancelled.get(); }
}
