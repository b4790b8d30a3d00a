package com.triage.orchestrator.workspace;

/**
 * A file could not be read from the workspace: it is outside the sandbox,
 * matches a blocked pattern, has a disallowed extension, or does not exist.
 */
public class FileAccessException extends RuntimeException {

    public enum Kind { BLOCKED, EXTENSION_NOT_ALLOWED, NOT_FOUND, IO_ERROR }

    private final Kind kind;

    public FileAccessException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public FileAccessException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
