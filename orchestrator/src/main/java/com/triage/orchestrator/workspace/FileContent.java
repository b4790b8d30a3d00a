package com.triage.orchestrator.workspace;

/**
 * A source file read by {@link CodeReader}.
 *
 * @param path      path relative to the workspace base directory
 * @param lineCount lines returned, including the truncation marker if present
 */
public record FileContent(String path, String content, String language, int lineCount) {}
