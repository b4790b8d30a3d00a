package com.triage.orchestrator.llm;

/**
 * A call to the language model failed. {@code statusCode} is the provider's
 * HTTP status, or -1 if the request never got a response.
 */
public class LanguageModelException extends RuntimeException {

    private final int statusCode;

    public LanguageModelException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public LanguageModelException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int statusCode() { return statusCode; }

    /** Rate limiting and overload are worth retrying; anything else is not. */
    public boolean isRetryable() {
        return statusCode == 429 || statusCode == 503 || statusCode == 529;
    }
}
