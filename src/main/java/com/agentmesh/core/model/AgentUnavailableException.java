package com.agentmesh.core.model;

/**
 * Thrown when no agent can take a piece of work: no capable worker, a full queue, or a
 * collaborator that is down.
 */
public class AgentUnavailableException extends RuntimeException {
    public AgentUnavailableException(String message) {
        super(message);
    }

    public AgentUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
