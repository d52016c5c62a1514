package com.agentmesh.core.bus;

import com.agentmesh.core.model.AgentUnavailableException;

/**
 * Thrown when a correlated reply does not arrive in time. Treated like any other unavailability.
 */
public class ResponseTimeoutException extends AgentUnavailableException {
    public ResponseTimeoutException(String message) {
        super(message);
    }

    public ResponseTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
