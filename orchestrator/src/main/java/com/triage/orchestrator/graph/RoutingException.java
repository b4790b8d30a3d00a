package com.triage.orchestrator.graph;

/**
 * A conditional edge could not pick a destination: the router threw or
 * returned a label the edge does not declare.
 */
public class RoutingException extends RuntimeException {

    public RoutingException(String message) {
        super(message);
    }

    public RoutingException(String message, Throwable cause) {
        super(message, cause);
    }
}
