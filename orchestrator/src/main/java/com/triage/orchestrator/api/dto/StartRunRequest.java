package com.triage.orchestrator.api.dto;

/**
 * Request body for POST /runs.
 *
 * Required: errorLog
 * Optional: maxIterations, the research/refine budget for this run; the
 *   configured default applies when omitted.
 */
public record StartRunRequest(String errorLog, Integer maxIterations) {}
